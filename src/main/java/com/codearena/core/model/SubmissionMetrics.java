package com.codearena.core.model;

/**
 * Aggregate figures for a submission.
 *
 * @param totalTimeMs wall-clock time of the whole execution
 * @param totalMemory unmeasured placeholder, always 0
 * @param passedTests number of passing test cases
 * @param totalTests  number of test cases
 */
public record SubmissionMetrics(
    long totalTimeMs,
    long totalMemory,
    int passedTests,
    int totalTests
) {}
