package com.codearena.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for submission execution.
 */
@Service
public class ExecutorMetrics {

    private final MeterRegistry registry;

    public ExecutorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String language, boolean success, long ms) {
        Timer.builder("codearena.execution.duration")
                .tag("language", language)
                .tag("outcome", success ? "passed" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts individual test-case verdicts so pass rates can be graphed per language.
     */
    public void recordTestResults(String language, int passed, int total) {
        Counter.builder("codearena.execution.results")
                .tag("language", language)
                .tag("result", "passed")
                .register(registry)
                .increment(passed);
        Counter.builder("codearena.execution.results")
                .tag("language", language)
                .tag("result", "failed")
                .register(registry)
                .increment(total - passed);
    }

    /**
     * Records which compiled-language backend served a submission.
     *
     * @param backend        "native" or "container"
     * @param fallbackReason why the container ran instead of native, or "none"
     */
    public void recordCompiledBackend(String backend, String fallbackReason) {
        Counter.builder("codearena.compiled.backend")
                .description("Compiled-language executions by backend")
                .tag("backend", backend)
                .tag("fallback", fallbackReason)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String language) {
        Counter.builder("codearena.execution.timeouts")
                .tag("language", language)
                .register(registry)
                .increment();
    }

    public void recordOutputSize(int chars) {
        DistributionSummary.builder("codearena.execution.output_chars")
                .description("Size of captured sandbox output")
                .register(registry)
                .record(chars);
    }
}
