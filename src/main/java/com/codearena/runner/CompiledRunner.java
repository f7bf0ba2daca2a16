package com.codearena.runner;

import com.codearena.core.logging.MdcContext;
import com.codearena.core.metrics.ExecutorMetrics;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.Language;
import com.codearena.core.model.SubmissionResult;
import com.codearena.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs Go submissions, natively when configured and possible, otherwise in a container.
 */
@Component
public class CompiledRunner implements LanguageRunner {

    private static final Logger log = LoggerFactory.getLogger(CompiledRunner.class);

    private final NativeThenContainer strategy;
    private final ExecutorMetrics metrics;

    @Autowired
    public CompiledRunner(NativeGoBackend nativeBackend, ContainerGoBackend containerBackend,
                          SandboxProperties properties,
                          @Autowired(required = false) ExecutorMetrics metrics) {
        this(new NativeThenContainer(nativeBackend, containerBackend, properties.isUseNativeGo()), metrics);
    }

    CompiledRunner(NativeThenContainer strategy, ExecutorMetrics metrics) {
        this.strategy = strategy;
        this.metrics = metrics;
    }

    @Override
    public Language language() {
        return Language.COMPILED;
    }

    @Override
    public SubmissionResult run(ExecutionRequest request) {
        BackendOutcome outcome = strategy.execute(request);
        MdcContext.setBackend(outcome.backend().tag());
        log.info("Compiled submission served by {} backend (fallback: {})",
                outcome.backend().tag(), outcome.fallbackReason().tag());
        if (metrics != null) {
            metrics.recordCompiledBackend(outcome.backend().tag(), outcome.fallbackReason().tag());
        }
        return outcome.result();
    }
}
