package com.codearena.dispatch;

import com.codearena.core.logging.MdcContext;
import com.codearena.core.metrics.ExecutorMetrics;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.FunctionMetadata;
import com.codearena.core.model.Language;
import com.codearena.core.model.SubmissionResult;
import com.codearena.core.model.TestCase;
import com.codearena.runner.LanguageRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point for judging a submission. Routes each request to the
 * runner registered for its language.
 *
 * <p>Only {@link com.codearena.core.execution.StagingException} escapes
 * {@link #execute}; every other failure is reported through the result.
 */
@Service
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final Map<Language, LanguageRunner> runners;
    private final ExecutorMetrics metrics;

    public ExecutionDispatcher(List<LanguageRunner> runners,
                               @Autowired(required = false) ExecutorMetrics metrics) {
        var registry = new EnumMap<Language, LanguageRunner>(Language.class);
        for (LanguageRunner runner : runners) {
            LanguageRunner previous = registry.put(runner.language(), runner);
            if (previous != null) {
                throw new IllegalStateException("Duplicate runner for " + runner.language() + ": "
                        + previous.getClass().getSimpleName() + " and " + runner.getClass().getSimpleName());
            }
        }
        for (Language language : Language.values()) {
            if (!registry.containsKey(language)) {
                throw new IllegalStateException("No runner registered for language " + language);
            }
        }
        this.runners = registry;
        this.metrics = metrics;
    }

    /**
     * Judges a submission given a raw language tag. Unknown tags take the
     * script path.
     */
    public SubmissionResult execute(String code, List<TestCase> testCases, FunctionMetadata metadata,
                                    String languageTag) {
        Language language = Language.fromTag(languageTag);
        if (language == null) {
            log.warn("Unknown language '{}', using {}", languageTag, Language.SCRIPT.tag());
            language = Language.SCRIPT;
        }
        return execute(new ExecutionRequest(code, language, testCases, metadata));
    }

    public SubmissionResult execute(ExecutionRequest request) {
        String submissionId = UUID.randomUUID().toString();
        MdcContext.setSubmission(submissionId, request.language().tag());
        long startMs = System.currentTimeMillis();
        try {
            log.info("Executing {} submission with {} test cases", request.language().tag(),
                    request.testCases().size());
            SubmissionResult result = runners.get(request.language()).run(request);
            long elapsedMs = System.currentTimeMillis() - startMs;
            log.info("Submission finished: {}/{} passed in {}ms", result.metrics().passedTests(),
                    result.metrics().totalTests(), elapsedMs);
            if (metrics != null) {
                metrics.recordExecution(request.language().tag(), result.success(), elapsedMs);
                metrics.recordTestResults(request.language().tag(), result.metrics().passedTests(),
                        result.metrics().totalTests());
            }
            return result;
        } finally {
            MdcContext.clear();
        }
    }
}
