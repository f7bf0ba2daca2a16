package com.codearena.sandbox;

/**
 * How a sandbox stopped running.
 *
 * @param timedOut true when the deadline expired before the container exited
 * @param exitCode container exit code, or -1 when unknown
 */
public record SandboxExit(boolean timedOut, int exitCode) {

    public static SandboxExit exited(int exitCode) {
        return new SandboxExit(false, exitCode);
    }

    public static SandboxExit deadlineExceeded() {
        return new SandboxExit(true, -1);
    }
}
