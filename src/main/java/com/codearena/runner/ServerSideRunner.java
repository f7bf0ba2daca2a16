package com.codearena.runner;

import com.codearena.core.execution.StagingException;
import com.codearena.core.metrics.ExecutorMetrics;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.Language;
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
 * Runs PHP submissions against a fixed driver script inside the server-side image.
 * The user code is staged unmodified.
 */
@Component
public class ServerSideRunner extends AbstractContainerRunner implements LanguageRunner {

    static final String DRIVER_RESOURCE = "runners/php-test-runner.php";

    private final ObjectMapper objectMapper;

    public ServerSideRunner(SandboxManager sandboxManager, StagingArea stagingArea, SandboxProperties properties,
                            ResultNormalizer normalizer, ObjectMapper objectMapper,
                            @Autowired(required = false) ExecutorMetrics metrics) {
        super(sandboxManager, stagingArea, properties, normalizer, metrics);
        this.objectMapper = objectMapper;
    }

    @Override
    public Language language() {
        return Language.SERVER_SIDE;
    }

    @Override
    protected List<SandboxRequest.Mount> stage(StagedSubmission staged, ExecutionRequest request) {
        String testCasesJson;
        try {
            testCasesJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.testCases());
        } catch (JsonProcessingException e) {
            throw new StagingException("Cannot serialize test cases", e);
        }
        return List.of(
                new SandboxRequest.Mount(staged.write("-solution.php", request.code()),
                        WORKING_DIR + "/user-solution.php"),
                new SandboxRequest.Mount(staged.write("-test-cases.json", testCasesJson),
                        WORKING_DIR + "/test-cases.json"),
                new SandboxRequest.Mount(staged.copyResource(DRIVER_RESOURCE, "-test-runner.php"),
                        WORKING_DIR + "/test-runner.php"));
    }

    @Override
    protected String image() {
        return properties.getServerSideImage();
    }

    @Override
    protected String containerPrefix() {
        return "php-execution-";
    }

    @Override
    protected List<String> command(ExecutionRequest request) {
        return List.of("php", WORKING_DIR + "/test-runner.php", request.metadata().functionName());
    }

    @Override
    protected SubmissionResult interpret(SandboxRun run, ExecutionRequest request) {
        return normalizer.fromRecordLines(run.output(), request.testCases(), run.elapsedMs());
    }

    @Override
    protected String label() {
        return language().tag();
    }
}
