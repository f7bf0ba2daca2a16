package com.codearena.core.execution;

/**
 * Raised when an execution environment cannot be driven to completion.
 * Runners convert it into an all-failing result; it never reaches the caller.
 */
public class SandboxFailureException extends RuntimeException {

    private final FailureKind kind;

    public SandboxFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SandboxFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
