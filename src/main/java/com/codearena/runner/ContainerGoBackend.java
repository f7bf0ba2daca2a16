package com.codearena.runner;

import com.codearena.core.execution.StagingException;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs Go submissions with the precompiled executor inside the compiled image.
 * The executor reads the raw user code, the test cases and the function
 * metadata, and prints a JSON result array.
 */
@Component
public class ContainerGoBackend extends AbstractContainerRunner implements CompiledBackend {

    private static final String CODE_PATH = WORKING_DIR + "/user-code.go";
    private static final String TESTS_PATH = WORKING_DIR + "/test-cases.json";
    private static final String METADATA_PATH = WORKING_DIR + "/metadata.json";

    private final ObjectMapper objectMapper;

    public ContainerGoBackend(SandboxManager sandboxManager, StagingArea stagingArea, SandboxProperties properties,
                              ResultNormalizer normalizer, ObjectMapper objectMapper,
                              @Autowired(required = false) ExecutorMetrics metrics) {
        super(sandboxManager, stagingArea, properties, normalizer, metrics);
        this.objectMapper = objectMapper;
    }

    @Override
    public SubmissionResult execute(ExecutionRequest request) {
        return run(request);
    }

    @Override
    protected List<SandboxRequest.Mount> stage(StagedSubmission staged, ExecutionRequest request) {
        return List.of(
                new SandboxRequest.Mount(staged.write("-code.go", request.code()), CODE_PATH),
                new SandboxRequest.Mount(staged.write("-tests.json", toJson(request.testCases())), TESTS_PATH),
                new SandboxRequest.Mount(staged.write("-metadata.json", toJson(request.metadata())), METADATA_PATH));
    }

    @Override
    protected String image() {
        return properties.getCompiledImage();
    }

    @Override
    protected String containerPrefix() {
        return "go-execution-";
    }

    @Override
    protected List<String> command(ExecutionRequest request) {
        return List.of("go-executor", CODE_PATH, TESTS_PATH, METADATA_PATH);
    }

    @Override
    protected long timeoutMs() {
        return properties.getCompiledTimeoutMs();
    }

    @Override
    protected String timeoutMessage(long timeoutMs) {
        return "Go execution timeout - took longer than " + timeoutMs + "ms";
    }

    @Override
    protected SubmissionResult interpret(SandboxRun run, ExecutionRequest request) {
        return normalizer.fromResultArray(run.output(), request.testCases(), run.elapsedMs());
    }

    @Override
    protected String label() {
        return "compiled";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StagingException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
