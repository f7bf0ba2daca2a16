package com.codearena.sandbox;

import com.codearena.core.execution.Deadline;
import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider.
 * Creates one disposable container per submission.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>Read-only bind mounts for the staged submission files</li>
 *   <li>Networking disabled ({@code NetworkMode=none})</li>
 *   <li>Memory ceiling with unlimited swap accounting and a CFS CPU quota</li>
 *   <li>No auto-removal, so logs can be read after the process exits and
 *       removal happens only in {@link #teardownSandbox}</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    private static final Duration LOG_CAPTURE_TIMEOUT = Duration.ofSeconds(10);

    private final DockerClient dockerClient;
    private final int stopGraceSeconds;
    private final Duration logCaptureTimeout;

    public DockerSandboxProvider(DockerClient dockerClient, int stopGraceSeconds) {
        this(dockerClient, stopGraceSeconds, LOG_CAPTURE_TIMEOUT);
    }

    DockerSandboxProvider(DockerClient dockerClient, int stopGraceSeconds, Duration logCaptureTimeout) {
        this.dockerClient = dockerClient;
        this.stopGraceSeconds = stopGraceSeconds;
        this.logCaptureTimeout = logCaptureTimeout;
    }

    @Override
    public String openSandbox(SandboxRequest request) {
        log.info("Opening Sandbox {} (image: {})", request.name(), request.image());

        Bind[] binds = request.mounts().stream()
                .map(m -> new Bind(m.hostPath().toAbsolutePath().toString(),
                        new Volume(m.containerPath()), AccessMode.ro))
                .toArray(Bind[]::new);

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds)
                .withMemory(request.memoryBytes())
                .withMemorySwap(-1L)
                .withCpuQuota(request.cpuQuota())
                .withNetworkMode("none")
                .withAutoRemove(false);

        String containerId;
        try {
            var response = dockerClient.createContainerCmd(request.image())
                    .withName(request.name())
                    .withHostConfig(hostConfig)
                    .withNetworkDisabled(true)
                    .withCmd(request.command())
                    .withWorkingDir(request.workingDir())
                    .exec();
            containerId = response.getId();
        } catch (RuntimeException e) {
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Failed to create container " + request.name(), e);
        }

        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            teardownSandbox(containerId);
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Failed to start container " + request.name(), e);
        }
        log.info("Sandbox {} started (container {})", request.name(), containerId);
        return containerId;
    }

    @Override
    public SandboxExit awaitExit(String sandboxId, Deadline deadline) {
        if (deadline.isExpired()) {
            return SandboxExit.deadlineExceeded();
        }
        try {
            Integer status = dockerClient.waitContainerCmd(sandboxId)
                    .exec(new WaitContainerResultCallback())
                    .awaitStatusCode(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
            return SandboxExit.exited(status != null ? status : -1);
        } catch (RuntimeException e) {
            if (deadline.isExpired()) {
                log.warn("Sandbox {} exceeded its {}ms deadline", sandboxId, deadline.budget().toMillis());
                return SandboxExit.deadlineExceeded();
            }
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Failed waiting for container " + sandboxId, e);
        }
    }

    @Override
    public String captureOutput(String sandboxId) {
        var stream = new ContainerLogStream();
        try {
            dockerClient.logContainerCmd(sandboxId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(stream);
            return new String(stream.readFully(logCaptureTimeout), StandardCharsets.UTF_8);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Interrupted while capturing output from sandbox " + sandboxId, e);
        } catch (SandboxFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Failed to capture output from sandbox " + sandboxId, e);
        } finally {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Could not close log stream for {}: {}", sandboxId, e.getMessage());
            }
        }
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        try {
            dockerClient.stopContainerCmd(sandboxId).withTimeout(stopGraceSeconds).exec();
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", sandboxId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(sandboxId).withForce(true).exec();
            log.info("Sandbox {} torn down", sandboxId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", sandboxId, e);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.debug("Docker daemon not reachable: {}", e.getMessage());
            return false;
        }
    }
}
