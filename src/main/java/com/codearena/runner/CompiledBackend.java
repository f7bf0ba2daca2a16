package com.codearena.runner;

import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.SubmissionResult;

/**
 * One way of building and running a compiled-language submission.
 */
public interface CompiledBackend {

    SubmissionResult execute(ExecutionRequest request);

    /**
     * Whether this backend can be used right now.
     */
    default boolean isAvailable() {
        return true;
    }
}
