package com.codearena.harness;

import com.codearena.core.model.FunctionMetadata;
import com.codearena.core.model.TestCase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Wraps a TypeScript submission in a driver that calls the entry function for
 * every test case and prints one JSON record {@code {index, passed, output, error}}
 * per line.
 */
@Component
public class ScriptDriverGenerator {

    static final String TEMPLATE_RESOURCE = "harness/script-driver.tmpl";

    private final ObjectMapper objectMapper;
    private final HarnessTemplate template;

    public ScriptDriverGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.template = HarnessTemplate.fromClasspath(TEMPLATE_RESOURCE);
    }

    public String generate(String code, List<TestCase> testCases, FunctionMetadata metadata) {
        return template.render(Map.of(
                "USER_CODE", code == null ? "" : code,
                "TEST_CASES", serializeTestCases(testCases),
                "FUNCTION_NAME", metadata.functionName()));
    }

    /** Only input, expected and description reach the driver. */
    String serializeTestCases(List<TestCase> testCases) {
        ArrayNode array = objectMapper.createArrayNode();
        for (TestCase testCase : testCases) {
            ObjectNode node = array.addObject();
            ArrayNode input = node.putArray("input");
            testCase.input().forEach(value -> input.add(value == null ? objectMapper.nullNode() : value));
            node.set("expected", testCase.expected());
            if (testCase.description() != null) {
                node.put("description", testCase.description());
            }
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize test cases", e);
        }
    }
}
