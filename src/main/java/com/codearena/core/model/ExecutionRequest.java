package com.codearena.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to judge one submission. Created once per call and never mutated.
 *
 * @param code      raw learner source text
 * @param language  the execution path to take
 * @param testCases test cases, in the order results must be reported
 * @param metadata  the entry point to call
 */
public record ExecutionRequest(
    String code,
    Language language,
    List<TestCase> testCases,
    FunctionMetadata metadata
) {

    public ExecutionRequest {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(metadata, "metadata");
        code = code == null ? "" : code;
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }
}
