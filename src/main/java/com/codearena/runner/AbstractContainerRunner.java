package com.codearena.runner;

import com.codearena.core.execution.Deadline;
import com.codearena.core.execution.SandboxFailureException;
import com.codearena.core.metrics.ExecutorMetrics;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.SubmissionResult;
import com.codearena.core.result.ResultNormalizer;
import com.codearena.sandbox.SandboxManager;
import com.codearena.sandbox.SandboxManager.SandboxRun;
import com.codearena.sandbox.SandboxProperties;
import com.codearena.sandbox.SandboxRequest;
import com.codearena.sandbox.StagedSubmission;
import com.codearena.sandbox.StagingArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * Skeleton shared by every container-backed execution path.
 *
 * <p>Flow: stage files -> run the sandbox under a deadline -> interpret the
 * output -> remove staged files. Subclasses supply the staged layout, the
 * image and command, and how the output is read.
 */
public abstract class AbstractContainerRunner {

    private static final Logger log = LoggerFactory.getLogger(AbstractContainerRunner.class);

    static final String WORKING_DIR = "/code";

    protected final SandboxManager sandboxManager;
    protected final StagingArea stagingArea;
    protected final SandboxProperties properties;
    protected final ResultNormalizer normalizer;
    protected final ExecutorMetrics metrics;

    protected AbstractContainerRunner(SandboxManager sandboxManager, StagingArea stagingArea,
                                      SandboxProperties properties, ResultNormalizer normalizer,
                                      ExecutorMetrics metrics) {
        this.sandboxManager = sandboxManager;
        this.stagingArea = stagingArea;
        this.properties = properties;
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    /**
     * Writes the submission's files and returns their container mounts.
     */
    protected abstract List<SandboxRequest.Mount> stage(StagedSubmission staged, ExecutionRequest request);

    protected abstract String image();

    /** Prefix of the container name; the submission id is appended. */
    protected abstract String containerPrefix();

    protected abstract List<String> command(ExecutionRequest request);

    protected abstract SubmissionResult interpret(SandboxRun run, ExecutionRequest request);

    /** Short label used in logs and metrics. */
    protected abstract String label();

    protected long timeoutMs() {
        return properties.getTimeoutMs();
    }

    protected String timeoutMessage(long timeoutMs) {
        return "Execution timeout - took longer than " + timeoutMs + "ms";
    }

    public SubmissionResult run(ExecutionRequest request) {
        String submissionId = UUID.randomUUID().toString();
        long timeoutMs = timeoutMs();
        long startMs = System.currentTimeMillis();

        try (StagedSubmission staged = stagingArea.open(submissionId)) {
            List<SandboxRequest.Mount> mounts = stage(staged, request);
            var sandboxRequest = new SandboxRequest(
                    containerPrefix() + submissionId,
                    image(),
                    command(request),
                    mounts,
                    properties.getMemoryBytes(),
                    properties.getCpuQuota(),
                    WORKING_DIR);

            SandboxRun run;
            try {
                run = sandboxManager.run(sandboxRequest, Deadline.afterMillis(timeoutMs));
            } catch (SandboxFailureException e) {
                log.error("{} execution {} failed: {}", label(), submissionId, e.getMessage(), e);
                return normalizer.failure(request.testCases(), e, System.currentTimeMillis() - startMs);
            }

            if (run.timedOut()) {
                if (metrics != null) {
                    metrics.recordTimeout(label());
                }
                return normalizer.timeout(request.testCases(), timeoutMessage(timeoutMs), timeoutMs);
            }
            return interpret(run, request);
        }
    }
}
