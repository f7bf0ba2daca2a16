package com.codearena.runner;

/**
 * Outcome of a host subprocess.
 *
 * @param exitCode  process exit code; {@value #TIMEOUT_EXIT_CODE} when killed at the deadline
 * @param stdout    captured standard output
 * @param stderr    captured standard error
 * @param timedOut  whether the process was killed at its deadline
 * @param elapsedMs wall-clock time of the process
 */
public record CommandResult(
    int exitCode,
    String stdout,
    String stderr,
    boolean timedOut,
    long elapsedMs
) {

    public static final int TIMEOUT_EXIT_CODE = 124;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
