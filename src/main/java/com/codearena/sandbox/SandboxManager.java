package com.codearena.sandbox;

import com.codearena.core.execution.Deadline;
import com.codearena.core.metrics.ExecutorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives one sandbox from creation to removal.
 *
 * <p>Flow: open sandbox -> wait (bounded by the deadline) -> capture output ->
 * teardown. Teardown runs on every path, including timeouts and failures
 * while waiting or reading output.
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final SandboxProvider provider;
    private final ExecutorMetrics metrics;

    public SandboxManager(SandboxProvider provider,
                          @Autowired(required = false) ExecutorMetrics metrics) {
        this.provider = provider;
        this.metrics = metrics;
    }

    /**
     * Outcome of one sandbox run.
     *
     * @param sandboxId container that ran the submission
     * @param exitCode  process exit code, or -1 when the run timed out
     * @param output    combined stdout/stderr, empty when the run timed out
     * @param timedOut  whether the deadline expired before the process exited
     * @param elapsedMs wall-clock time from open to output capture
     */
    public record SandboxRun(
        String sandboxId,
        int exitCode,
        String output,
        boolean timedOut,
        long elapsedMs
    ) {}

    public SandboxRun run(SandboxRequest request, Deadline deadline) {
        long startMs = System.currentTimeMillis();
        String sandboxId = provider.openSandbox(request);
        try {
            SandboxExit exit = provider.awaitExit(sandboxId, deadline);
            if (exit.timedOut()) {
                long elapsedMs = System.currentTimeMillis() - startMs;
                log.warn("Sandbox {} timed out after {}ms", request.name(), elapsedMs);
                return new SandboxRun(sandboxId, -1, "", true, elapsedMs);
            }

            String output = provider.captureOutput(sandboxId);
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordOutputSize(output.length());
            }
            log.info("Sandbox {} completed with exit code {} in {}ms", request.name(), exit.exitCode(), elapsedMs);
            return new SandboxRun(sandboxId, exit.exitCode(), output, false, elapsedMs);
        } finally {
            provider.teardownSandbox(sandboxId);
        }
    }

    /** Whether the execution environment can currently be reached. */
    public boolean isAvailable() {
        return provider.isReachable();
    }
}
