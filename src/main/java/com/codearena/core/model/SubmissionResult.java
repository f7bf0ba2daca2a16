package com.codearena.core.model;

import java.util.List;

/**
 * Uniform pass/fail report for a submission.
 *
 * <p>Instances are built through {@link #of} or {@link #allFailed}, which keep
 * {@code success} consistent with the per-test results and the metrics
 * consistent with both.
 *
 * @param success true iff every test case passed
 * @param results one result per test case, positionally aligned
 * @param metrics aggregate figures
 */
public record SubmissionResult(
    boolean success,
    List<ExecutionResult> results,
    SubmissionMetrics metrics
) {

    public SubmissionResult {
        results = List.copyOf(results);
    }

    public static SubmissionResult of(List<ExecutionResult> results, long totalTimeMs) {
        int passed = (int) results.stream().filter(ExecutionResult::passed).count();
        return new SubmissionResult(passed == results.size(), results,
                new SubmissionMetrics(totalTimeMs, 0, passed, results.size()));
    }

    /**
     * Builds a result in which every test case failed with the same message.
     */
    public static SubmissionResult allFailed(List<TestCase> testCases, String error, long timeMs) {
        var results = testCases.stream()
                .map(tc -> ExecutionResult.failed(error, tc, timeMs))
                .toList();
        return of(results, timeMs);
    }
}
