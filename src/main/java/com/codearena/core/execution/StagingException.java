package com.codearena.core.execution;

/**
 * The staging area for a submission could not be prepared. Nothing has run yet,
 * so no per-test result can be built and the error propagates to the caller.
 */
public class StagingException extends RuntimeException {

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
