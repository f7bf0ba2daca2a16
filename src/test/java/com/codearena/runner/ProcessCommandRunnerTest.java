package com.codearena.runner;

import com.codearena.core.execution.Deadline;
import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @TempDir
    Path workDir;

    @Test
    void capturesOutputAndExitCode() {
        var result = runner.run(List.of("sh", "-c", "echo out; echo err >&2; exit 3"),
                workDir, Map.of(), Deadline.afterMillis(10_000));

        assertEquals(3, result.exitCode());
        assertEquals("out\n", result.stdout());
        assertEquals("err\n", result.stderr());
        assertFalse(result.timedOut());
        assertFalse(result.succeeded());
    }

    @Test
    void runsInWorkingDirectoryWithExtraEnvironment() throws Exception {
        Files.writeString(workDir.resolve("marker.txt"), "here");

        var result = runner.run(List.of("sh", "-c", "cat marker.txt; printf \" $GREETING\""),
                workDir, Map.of("GREETING", "hello"), Deadline.afterMillis(10_000));

        assertTrue(result.succeeded());
        assertEquals("here hello", result.stdout());
    }

    @Test
    void killsProcessAtDeadline() {
        long start = System.currentTimeMillis();

        var result = runner.run(List.of("sh", "-c", "sleep 30"), workDir, Map.of(), Deadline.afterMillis(300));

        assertTrue(result.timedOut());
        assertEquals(CommandResult.TIMEOUT_EXIT_CODE, result.exitCode());
        assertTrue(System.currentTimeMillis() - start < 10_000);
    }

    @Test
    void missingBinaryIsToolchainUnavailable() {
        var e = assertThrows(SandboxFailureException.class, () -> runner.run(
                List.of("definitely-not-a-real-binary-xyz"), workDir, Map.of(), Deadline.afterMillis(1_000)));

        assertEquals(FailureKind.TOOLCHAIN_UNAVAILABLE, e.kind());
    }
}
