package com.codearena.harness;

import com.codearena.core.model.FunctionMetadata;
import com.codearena.core.model.TestCase;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptDriverGeneratorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScriptDriverGenerator generator = new ScriptDriverGenerator(mapper);
    private final FunctionMetadata meta = new FunctionMetadata("sum", List.of("number[]"), "number");

    @Test
    void wrapsUserCodeWithDriver() {
        String code = "function sum(xs: number[]): number { return xs.reduce((a, b) => a + b, 0); }";

        String driver = generator.generate(code, List.of(), meta);

        assertTrue(driver.contains("interface TestCase"));
        assertTrue(driver.contains(code));
        assertTrue(driver.contains("(sum as any)(input[0])"));
        assertTrue(driver.contains("(sum as any)(...input)"));
        assertTrue(driver.trim().endsWith("runTests();"));
    }

    @Test
    void serializesOnlyInputExpectedAndDescription() throws Exception {
        var testCases = List.of(
                new TestCase(List.of(mapper.readTree("[1,2]")), IntNode.valueOf(3), "adds"),
                new TestCase(List.of(), IntNode.valueOf(0)));

        JsonNode parsed = mapper.readTree(generator.serializeTestCases(testCases));

        assertEquals(2, parsed.size());
        assertEquals(mapper.readTree("{\"input\":[[1,2]],\"expected\":3,\"description\":\"adds\"}"), parsed.get(0));
        assertEquals(mapper.readTree("{\"input\":[],\"expected\":0}"), parsed.get(1));
    }

    @Test
    void embedsTestCasesAsLiteral() {
        String driver = generator.generate("function sum() { return 0; }",
                List.of(new TestCase(List.of(IntNode.valueOf(1)), IntNode.valueOf(1))), meta);

        assertTrue(driver.contains("const testCases: TestCase[] = ["));
        assertTrue(driver.contains("\"expected\" : 1"));
    }
}
