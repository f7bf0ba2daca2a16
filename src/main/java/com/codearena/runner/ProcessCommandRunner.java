package com.codearena.runner;

import com.codearena.core.execution.Deadline;
import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Output is redirected to
 * temporary files so a chatty process can never block on a full pipe. On
 * deadline expiry the whole process tree is killed.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Path workingDir, Map<String, String> environment,
                             Deadline deadline) {
        long startMs = System.currentTimeMillis();
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("cmd-out-", ".log");
            stderrFile = Files.createTempFile("cmd-err-", ".log");

            var builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            if (workingDir != null) {
                builder.directory(workingDir.toFile());
            }
            builder.environment().putAll(environment);

            log.debug("Running {} (budget {}ms)", String.join(" ", command), deadline.remainingMillis());
            process = builder.start();

            boolean exited = process.waitFor(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                kill(process);
                long elapsedMs = System.currentTimeMillis() - startMs;
                log.warn("Command {} killed after {}ms", command.get(0), elapsedMs);
                return new CommandResult(CommandResult.TIMEOUT_EXIT_CODE, read(stdoutFile),
                        "Command timed out after " + deadline.budget().toMillis() + "ms",
                        true, elapsedMs);
            }
            return new CommandResult(process.exitValue(), read(stdoutFile), read(stderrFile), false,
                    System.currentTimeMillis() - startMs);
        } catch (IOException e) {
            throw new SandboxFailureException(FailureKind.TOOLCHAIN_UNAVAILABLE,
                    "Cannot run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new SandboxFailureException(FailureKind.GENERIC_EXECUTION_FAILURE,
                    "Interrupted while running " + command.get(0), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void kill(Process process) {
        if (process == null) return;
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
