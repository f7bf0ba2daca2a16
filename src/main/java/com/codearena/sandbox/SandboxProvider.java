package com.codearena.sandbox;

import com.codearena.core.execution.Deadline;

/**
 * Abstraction for container orchestration.
 * Implementation: {@link DockerSandboxProvider}.
 */
public interface SandboxProvider {

    /**
     * Creates and starts a container. The container is not auto-removed, so its
     * output stays readable after it exits.
     *
     * @return the container/sandbox ID
     * @throws com.codearena.core.execution.SandboxFailureException if the container
     *         cannot be created or started
     */
    String openSandbox(SandboxRequest request);

    /**
     * Blocks until the container exits or the deadline expires.
     */
    SandboxExit awaitExit(String sandboxId, Deadline deadline);

    /**
     * Captures combined stdout/stderr logs from the container.
     */
    String captureOutput(String sandboxId);

    /**
     * Stops (with a short grace period) and force-removes the container.
     * Never throws.
     */
    void teardownSandbox(String sandboxId);

    /**
     * Cheap reachability check of the container runtime.
     */
    boolean isReachable();
}
