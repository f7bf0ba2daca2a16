package com.codearena.core.execution;

/**
 * Classification of a submission-wide failure.
 */
public enum FailureKind {
    TOOLCHAIN_UNAVAILABLE,
    MODULE_INIT_FAILURE,
    COMPILE_OR_SYNTAX_FAILURE,
    RUNTIME_TIMEOUT,
    OUTPUT_PARSE_FAILURE,
    ENVIRONMENT_LIFECYCLE_FAILURE,
    GENERIC_EXECUTION_FAILURE
}
