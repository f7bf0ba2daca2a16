package com.codearena.dispatch.cli;

import com.codearena.core.execution.StagingException;
import com.codearena.core.model.FunctionMetadata;
import com.codearena.core.model.SubmissionResult;
import com.codearena.core.model.TestCase;
import com.codearena.dispatch.ExecutionDispatcher;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: codearena run --language go --code solution.go --tests tests.json --metadata meta.json
 * <p>
 * Judges one submission and prints a line per test case, or the raw result
 * as JSON with {@code --json}. Exits 0 only when every test case passed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a submission against its test cases")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Option(names = {"--language", "-l"}, description = "Language tag: script, compiled, server-side (or ts, go, php)",
            defaultValue = "script")
    private String language;

    @Option(names = {"--code", "-c"}, required = true, description = "File containing the submission source")
    private Path codeFile;

    @Option(names = {"--tests", "-t"}, required = true, description = "JSON file with the array of test cases")
    private Path testsFile;

    @Option(names = {"--metadata", "-m"}, required = true,
            description = "JSON file with functionName, parameterTypes and returnType")
    private Path metadataFile;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    private final ExecutionDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public RunCommand(ExecutionDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        String code;
        List<TestCase> testCases;
        FunctionMetadata metadata;
        try {
            code = Files.readString(codeFile, StandardCharsets.UTF_8);
            testCases = objectMapper.readValue(testsFile.toFile(), new TypeReference<List<TestCase>>() {});
            metadata = objectMapper.readValue(metadataFile.toFile(), FunctionMetadata.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read input: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        SubmissionResult result;
        try {
            result = dispatcher.execute(code, testCases, metadata, language);
        } catch (StagingException e) {
            ConsoleOutput.error("Cannot stage submission: " + e.getMessage());
            return EXIT_FAILED;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } catch (IOException e) {
                ConsoleOutput.error("Cannot serialize result: " + e.getMessage());
                return EXIT_FAILED;
            }
        } else {
            for (int i = 0; i < result.results().size(); i++) {
                ConsoleOutput.testResult(i, result.results().get(i));
            }
            ConsoleOutput.summary(result);
        }
        return result.success() ? 0 : EXIT_FAILED;
    }
}
