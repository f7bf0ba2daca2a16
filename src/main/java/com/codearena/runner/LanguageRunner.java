package com.codearena.runner;

import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.Language;
import com.codearena.core.model.SubmissionResult;

/**
 * Executes submissions for one language family.
 *
 * <p>Implementations never throw for user-level or environment failures; those
 * become failing {@link SubmissionResult}s. Only
 * {@link com.codearena.core.execution.StagingException} escapes.
 */
public interface LanguageRunner {

    Language language();

    SubmissionResult run(ExecutionRequest request);
}
