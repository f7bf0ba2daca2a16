package com.codearena.core.result;

import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import com.codearena.core.model.ExecutionResult;
import com.codearena.core.model.SubmissionResult;
import com.codearena.core.model.TestCase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns raw sandbox output into a {@link SubmissionResult}.
 *
 * <p>Whatever the output looks like, the result always holds exactly one entry
 * per test case, in test-case order. The verdict for every reported value is
 * re-derived with {@link JsonEquality}, so all runtimes share one equality rule.
 */
@Component
public class ResultNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);

    public static final String PARSE_FAILURE_MESSAGE =
            "Failed to parse test results. Check your code for syntax errors or infinite loops.";
    static final String MISSING_RESULT_MESSAGE = "No result reported for this test case.";

    private static final int PREVIEW_LIMIT = 200;

    private final ObjectMapper objectMapper;

    public ResultNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Normalizes line-oriented output where every test case is reported as a JSON
     * object {@code {index, passed, output, error}} somewhere on its own line.
     * Banner or noise text around the object is tolerated.
     *
     * @param output     combined stdout/stderr
     * @param testCases  the submission's test cases
     * @param elapsedMs  wall-clock time of the run
     */
    public SubmissionResult fromRecordLines(String output, List<TestCase> testCases, long elapsedMs) {
        String text = output == null ? "" : output;
        logPreview(text);

        var slots = new ExecutionResult[testCases.size()];
        int parsed = 0;
        for (String line : text.split("\\R")) {
            JsonNode record = extractRecord(line);
            if (record == null || !record.path("index").canConvertToInt()) continue;

            int index = record.get("index").asInt();
            if (index < 0 || index >= slots.length || slots[index] != null) continue;

            TestCase testCase = testCases.get(index);
            slots[index] = judge(testCase, index, record.get("output"), textOrNull(record.get("error")),
                    reportedVerdict(record), elapsedMs);
            parsed++;
        }
        log.debug("Parsed {} result records for {} test cases", parsed, testCases.size());

        if (parsed == 0) {
            return SubmissionResult.allFailed(testCases, PARSE_FAILURE_MESSAGE, elapsedMs);
        }
        return SubmissionResult.of(fillMissing(slots, testCases, elapsedMs), elapsedMs);
    }

    /**
     * Normalizes the output of a compiled harness: a single JSON array of
     * {@code {passed, expected, actual, error}} records, positionally aligned
     * with the test cases.
     *
     * <p>If the output is not such an array, it is checked for known toolchain
     * failure signatures before falling back to a parse failure.
     */
    public SubmissionResult fromResultArray(String output, List<TestCase> testCases, long elapsedMs) {
        String text = output == null ? "" : output.strip();
        logPreview(text);

        JsonNode array = parseArray(text);
        if (array == null) {
            return FailureClassifier.classify(text)
                    .map(c -> SubmissionResult.allFailed(testCases, c.message(), elapsedMs))
                    .orElseGet(() -> SubmissionResult.allFailed(testCases,
                            PARSE_FAILURE_MESSAGE + "\nOutput: " + truncate(text, FailureClassifier.DETAIL_LIMIT),
                            elapsedMs));
        }

        if (array.isEmpty() && !testCases.isEmpty()) {
            return SubmissionResult.allFailed(testCases, PARSE_FAILURE_MESSAGE, elapsedMs);
        }

        // A lone error record stands for the whole run (e.g. the executor could not build the code)
        if (array.size() == 1 && testCases.size() > 1 && !textOrEmpty(array.get(0).get("error")).isBlank()) {
            String error = textOrEmpty(array.get(0).get("error"));
            String message = FailureClassifier.classify(error)
                    .map(FailureClassifier.Classification::message)
                    .orElse(error);
            return SubmissionResult.allFailed(testCases, message, elapsedMs);
        }

        long perTestMs = testCases.isEmpty() ? 0 : elapsedMs / testCases.size();
        var slots = new ExecutionResult[testCases.size()];
        for (int i = 0; i < slots.length && i < array.size(); i++) {
            JsonNode record = array.get(i);
            slots[i] = judge(testCases.get(i), i, record.get("actual"), textOrNull(record.get("error")),
                    reportedVerdict(record), perTestMs);
        }
        return SubmissionResult.of(fillMissing(slots, testCases, perTestMs), elapsedMs);
    }

    /**
     * Builds the result for a toolchain step that exited unsuccessfully, using
     * the failure signatures where one matches.
     *
     * @param diagnostics stderr of the failed step
     * @param stdout      stdout of the failed step
     */
    public SubmissionResult fromToolchainFailure(String diagnostics, String stdout,
                                                 List<TestCase> testCases, long elapsedMs) {
        String errorText = diagnostics == null || diagnostics.isBlank() ? "Unknown error" : diagnostics.strip();
        String message = FailureClassifier.classify(errorText)
                .map(FailureClassifier.Classification::message)
                .orElse("Go execution error: " + errorText);
        if (stdout != null && !stdout.isBlank()) {
            message += "\nOutput: " + truncate(stdout.strip(), FailureClassifier.DETAIL_LIMIT);
        }
        return SubmissionResult.allFailed(testCases, message, elapsedMs);
    }

    /**
     * Result for a run killed at its deadline. Every test case carries the
     * timeout message and is charged the full budget.
     */
    public SubmissionResult timeout(List<TestCase> testCases, String message, long timeoutMs) {
        return SubmissionResult.allFailed(testCases, message, timeoutMs);
    }

    /**
     * Result for an execution environment that could not be driven to completion.
     */
    public SubmissionResult failure(List<TestCase> testCases, SandboxFailureException e, long elapsedMs) {
        String message = e.getMessage() != null ? e.getMessage() : "Execution failed";
        if (e.kind() == FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE && e.getCause() != null
                && e.getCause().getMessage() != null) {
            message += ": " + e.getCause().getMessage();
        }
        return SubmissionResult.allFailed(testCases, message, elapsedMs);
    }

    private ExecutionResult judge(TestCase testCase, int index, JsonNode actual, String error,
                                  Boolean reportedPassed, long timeMs) {
        JsonNode reportedActual = actual == null || actual.isMissingNode() ? null : actual;
        if (error != null && !error.isBlank()) {
            return ExecutionResult.failed(error, reportedActual, testCase.expected(), timeMs);
        }
        boolean equal = JsonEquality.equivalent(testCase.expected(), reportedActual);
        if (reportedPassed != null && reportedPassed != equal) {
            log.debug("Test case {}: sandbox verdict {} overridden by canonical comparison ({})",
                    index, reportedPassed, equal);
        }
        if (equal) {
            return ExecutionResult.passed(reportedActual, testCase.expected(), timeMs);
        }
        return ExecutionResult.failed(
                "Expected " + render(testCase.expected()) + " but got " + render(reportedActual),
                reportedActual, testCase.expected(), timeMs);
    }

    private List<ExecutionResult> fillMissing(ExecutionResult[] slots, List<TestCase> testCases, long timeMs) {
        var results = new ArrayList<ExecutionResult>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            results.add(slots[i] != null
                    ? slots[i]
                    : ExecutionResult.failed(MISSING_RESULT_MESSAGE, testCases.get(i), timeMs));
        }
        long missing = Arrays.stream(slots).filter(s -> s == null).count();
        if (missing > 0) {
            log.info("{} of {} test cases reported no result", missing, slots.length);
        }
        return results;
    }

    private JsonNode extractRecord(String line) {
        int start = line.indexOf('{');
        int end = line.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(line.substring(start, end + 1));
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable result line: {}", truncate(line, PREVIEW_LIMIT));
            return null;
        }
    }

    private JsonNode parseArray(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isArray() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Output is not a JSON result array: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static Boolean reportedVerdict(JsonNode record) {
        JsonNode passed = record.get("passed");
        return passed != null && passed.isBoolean() ? passed.booleanValue() : null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        return node.isTextual() ? node.textValue() : node.toString();
    }

    private static String textOrEmpty(JsonNode node) {
        String text = textOrNull(node);
        return text == null ? "" : text;
    }

    private static String render(JsonNode value) {
        return value == null ? "null" : value.toString();
    }

    private static String truncate(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) + "..." : text;
    }

    private static void logPreview(String output) {
        log.debug("Raw output ({} chars): {}", output.length(), truncate(output, PREVIEW_LIMIT));
    }
}
