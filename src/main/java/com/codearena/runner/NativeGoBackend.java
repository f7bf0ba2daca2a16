package com.codearena.runner;

import com.codearena.core.execution.Deadline;
import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.SubmissionResult;
import com.codearena.core.result.ResultNormalizer;
import com.codearena.harness.GoHarnessGenerator;
import com.codearena.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Builds and runs Go submissions with the Go toolchain installed on the host.
 *
 * <p>Each submission gets a fresh scratch module with its own build cache and
 * GOPATH, so nothing is shared between submissions or with the host user.
 * Failures of the submission itself become failing results; failures to
 * prepare or start the toolchain are thrown so the caller can fall back.
 */
@Component
public class NativeGoBackend implements CompiledBackend {

    private static final Logger log = LoggerFactory.getLogger(NativeGoBackend.class);

    private final CommandRunner commandRunner;
    private final GoHarnessGenerator harnessGenerator;
    private final ResultNormalizer normalizer;
    private final SandboxProperties properties;

    public NativeGoBackend(CommandRunner commandRunner, GoHarnessGenerator harnessGenerator,
                           ResultNormalizer normalizer, SandboxProperties properties) {
        this.commandRunner = commandRunner;
        this.harnessGenerator = harnessGenerator;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    /**
     * Probes {@code go version} under its own short timeout.
     */
    @Override
    public boolean isAvailable() {
        try {
            CommandResult probe = commandRunner.run(List.of(properties.getGoBinary(), "version"), null, Map.of(),
                    Deadline.afterMillis(properties.getProbeTimeoutMs()));
            if (probe.succeeded()) {
                log.debug("Go toolchain: {}", probe.stdout().strip());
            }
            return probe.succeeded();
        } catch (SandboxFailureException e) {
            log.debug("Go toolchain probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public SubmissionResult execute(ExecutionRequest request) {
        long timeoutMs = properties.getNativeGoTimeoutMs();
        Deadline deadline = Deadline.afterMillis(timeoutMs);
        long startMs = System.currentTimeMillis();

        String program = harnessGenerator.generate(request.code(), request.testCases(), request.metadata());
        Path scratch = createScratch(program);
        try {
            Map<String, String> env = goEnvironment(scratch);

            CommandResult init = commandRunner.run(List.of(properties.getGoBinary(), "mod", "init", "solution"),
                    scratch, env, deadline.limitedTo(Duration.ofMillis(properties.getModuleInitTimeoutMs())));
            if (!init.succeeded()) {
                log.warn("go mod init failed with exit code {}", init.exitCode());
                return normalizer.fromToolchainFailure("Go module initialization failed: " + init.stderr(),
                        init.stdout(), request.testCases(), System.currentTimeMillis() - startMs);
            }

            CommandResult run = commandRunner.run(List.of(properties.getGoBinary(), "run", "main.go"),
                    scratch, env, deadline);
            long elapsedMs = System.currentTimeMillis() - startMs;
            log.info("go run finished with exit code {} in {}ms (init {}ms)", run.exitCode(), elapsedMs,
                    init.elapsedMs());

            if (run.timedOut()) {
                return normalizer.timeout(request.testCases(),
                        "Execution timeout - took longer than " + timeoutMs + "ms", timeoutMs);
            }
            if (!run.succeeded()) {
                return normalizer.fromToolchainFailure(run.stderr(), run.stdout(), request.testCases(), elapsedMs);
            }
            return normalizer.fromResultArray(run.stdout(), request.testCases(), elapsedMs);
        } finally {
            deleteRecursively(scratch);
        }
    }

    static Map<String, String> goEnvironment(Path scratch) {
        return Map.of(
                "GOCACHE", scratch.resolve(".gocache").toString(),
                "GOPATH", scratch.resolve(".gopath").toString(),
                "GO111MODULE", "on",
                "CGO_ENABLED", "0",
                "GOPROXY", "direct",
                "GOSUMDB", "off");
    }

    private Path createScratch(String program) {
        Path scratch = null;
        try {
            scratch = Files.createTempDirectory("go-native-");
            Files.writeString(scratch.resolve("main.go"), program, StandardCharsets.UTF_8);
            return scratch;
        } catch (IOException e) {
            deleteRecursively(scratch);
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Cannot prepare native Go workspace", e);
        }
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
