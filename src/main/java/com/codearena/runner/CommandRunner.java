package com.codearena.runner;

import com.codearena.core.execution.Deadline;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs a host command to completion or until its deadline, whichever comes first.
 * Implementation: {@link ProcessCommandRunner}.
 */
public interface CommandRunner {

    /**
     * @param workingDir  directory to run in, or null for the current one
     * @param environment variables added to the inherited environment
     * @throws com.codearena.core.execution.SandboxFailureException if the process cannot be started
     */
    CommandResult run(List<String> command, Path workingDir, Map<String, String> environment, Deadline deadline);
}
