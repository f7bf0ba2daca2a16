package com.codearena.sandbox;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to open a Sandbox container.
 *
 * @param name        container name, unique per submission
 * @param image       image to run
 * @param command     command and arguments
 * @param mounts      host files bind-mounted read-only into the container
 * @param memoryBytes memory ceiling in bytes
 * @param cpuQuota    CFS CPU quota in microseconds per period
 * @param workingDir  working directory inside the container
 */
public record SandboxRequest(
    String name,
    String image,
    List<String> command,
    List<Mount> mounts,
    long memoryBytes,
    long cpuQuota,
    String workingDir
) {

    public SandboxRequest {
        command = List.copyOf(command);
        mounts = List.copyOf(mounts);
    }

    /**
     * A read-only bind mount of a single staged host file.
     */
    public record Mount(Path hostPath, String containerPath) {}
}
