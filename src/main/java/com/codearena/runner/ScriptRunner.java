package com.codearena.runner;

import com.codearena.core.metrics.ExecutorMetrics;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.Language;
import com.codearena.core.model.SubmissionResult;
import com.codearena.core.result.ResultNormalizer;
import com.codearena.harness.ScriptDriverGenerator;
import com.codearena.sandbox.SandboxManager;
import com.codearena.sandbox.SandboxManager.SandboxRun;
import com.codearena.sandbox.SandboxProperties;
import com.codearena.sandbox.SandboxRequest;
import com.codearena.sandbox.StagedSubmission;
import com.codearena.sandbox.StagingArea;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs TypeScript submissions with ts-node inside the script image.
 */
@Component
public class ScriptRunner extends AbstractContainerRunner implements LanguageRunner {

    static final String COMPILER_OPTIONS = "{\"module\":\"CommonJS\",\"moduleResolution\":\"node\","
            + "\"target\":\"ES2020\",\"strict\":false,\"esModuleInterop\":true,"
            + "\"allowSyntheticDefaultImports\":true}";

    private static final String SOLUTION_PATH = WORKING_DIR + "/solution.ts";

    private final ScriptDriverGenerator driverGenerator;

    public ScriptRunner(SandboxManager sandboxManager, StagingArea stagingArea, SandboxProperties properties,
                        ResultNormalizer normalizer, ScriptDriverGenerator driverGenerator,
                        @Autowired(required = false) ExecutorMetrics metrics) {
        super(sandboxManager, stagingArea, properties, normalizer, metrics);
        this.driverGenerator = driverGenerator;
    }

    @Override
    public Language language() {
        return Language.SCRIPT;
    }

    @Override
    protected List<SandboxRequest.Mount> stage(StagedSubmission staged, ExecutionRequest request) {
        String driver = driverGenerator.generate(request.code(), request.testCases(), request.metadata());
        Path file = staged.write(".ts", driver);
        return List.of(new SandboxRequest.Mount(file, SOLUTION_PATH));
    }

    @Override
    protected String image() {
        return properties.getScriptImage();
    }

    @Override
    protected String containerPrefix() {
        return "ts-execution-";
    }

    @Override
    protected List<String> command(ExecutionRequest request) {
        return List.of("ts-node", "--transpile-only", "--compiler-options", COMPILER_OPTIONS, SOLUTION_PATH);
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
