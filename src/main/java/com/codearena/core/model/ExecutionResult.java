package com.codearena.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a single test case.
 *
 * @param passed          whether the returned value matched the expectation
 * @param error           classified, human-readable failure message, if any
 * @param actual          the value the function returned, if one was reported
 * @param expected        the value the test case expected
 * @param executionTimeMs wall-clock time attributed to this test case
 * @param memoryUsed      unmeasured placeholder, always 0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
    boolean passed,
    String error,
    JsonNode actual,
    JsonNode expected,
    long executionTimeMs,
    long memoryUsed
) {

    public static ExecutionResult passed(JsonNode actual, JsonNode expected, long executionTimeMs) {
        return new ExecutionResult(true, null, actual, expected, executionTimeMs, 0);
    }

    public static ExecutionResult failed(String error, JsonNode actual, JsonNode expected, long executionTimeMs) {
        return new ExecutionResult(false, error, actual, expected, executionTimeMs, 0);
    }

    public static ExecutionResult failed(String error, TestCase testCase, long executionTimeMs) {
        return failed(error, null, testCase.expected(), executionTimeMs);
    }
}
