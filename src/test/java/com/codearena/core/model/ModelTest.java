package com.codearena.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the request and result records.
 */
class ModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Language")
    class LanguageTests {

        @Test
        @DisplayName("resolves canonical tags and aliases case-insensitively")
        void resolvesTags() {
            assertEquals(Language.SCRIPT, Language.fromTag("script"));
            assertEquals(Language.SCRIPT, Language.fromTag("TypeScript"));
            assertEquals(Language.COMPILED, Language.fromTag("go"));
            assertEquals(Language.COMPILED, Language.fromTag(" Compiled "));
            assertEquals(Language.SERVER_SIDE, Language.fromTag("php"));
            assertEquals(Language.SERVER_SIDE, Language.fromTag("server-side"));
        }

        @Test
        @DisplayName("unknown or blank tags resolve to null")
        void unknownTags() {
            assertNull(Language.fromTag("cobol"));
            assertNull(Language.fromTag(""));
            assertNull(Language.fromTag(null));
        }

        @Test
        void canonicalTags() {
            assertEquals("script", Language.SCRIPT.tag());
            assertEquals("compiled", Language.COMPILED.tag());
            assertEquals("server-side", Language.SERVER_SIDE.tag());
        }
    }

    @Nested
    @DisplayName("FunctionMetadata")
    class FunctionMetadataTests {

        @Test
        void acceptsIdentifiers() {
            var metadata = new FunctionMetadata("twoSum", List.of("[]int", "int"), "[]int");

            assertEquals("[]int", metadata.parameterType(0));
            assertEquals("int", metadata.parameterType(1));
            assertNull(metadata.parameterType(2));
        }

        @Test
        @DisplayName("rejects names that are not identifiers")
        void rejectsNonIdentifiers() {
            assertThrows(IllegalArgumentException.class, () -> new FunctionMetadata("add; rm -rf /", List.of(), "int"));
            assertThrows(IllegalArgumentException.class, () -> new FunctionMetadata("1add", List.of(), "int"));
            assertThrows(IllegalArgumentException.class, () -> new FunctionMetadata(null, List.of(), "int"));
        }

        @Test
        void nullTypesDefaultToEmpty() {
            var metadata = new FunctionMetadata("add", null, null);

            assertTrue(metadata.parameterTypes().isEmpty());
            assertEquals("", metadata.returnType());
        }

        @Test
        @DisplayName("ignores unknown fields when deserialized")
        void deserializes() throws Exception {
            var metadata = mapper.readValue(
                    "{\"functionName\":\"add\",\"parameterTypes\":[\"int\",\"int\"],\"returnType\":\"int\",\"difficulty\":\"easy\"}",
                    FunctionMetadata.class);

            assertEquals("add", metadata.functionName());
            assertEquals(List.of("int", "int"), metadata.parameterTypes());
        }
    }

    @Nested
    @DisplayName("TestCase")
    class TestCaseTests {

        @Test
        @DisplayName("keeps JSON null inputs and defaults a missing expectation to null")
        void nullHandling() {
            var testCase = new TestCase(Arrays.asList(NullNode.getInstance(), null), null);

            assertEquals(2, testCase.input().size());
            assertEquals(NullNode.getInstance(), testCase.expected());
            assertNull(testCase.description());
        }

        @Test
        void inputIsDefensivelyCopied() {
            var input = new ArrayList<com.fasterxml.jackson.databind.JsonNode>(List.of(IntNode.valueOf(1)));
            var testCase = new TestCase(input, IntNode.valueOf(1));
            input.add(IntNode.valueOf(2));

            assertEquals(1, testCase.input().size());
            assertThrows(UnsupportedOperationException.class, () -> testCase.input().add(IntNode.valueOf(3)));
        }

        @Test
        @DisplayName("drops store-only fields on deserialization")
        void deserializes() throws Exception {
            var testCase = mapper.readValue(
                    "{\"id\":42,\"hidden\":true,\"input\":[[1,2],\"x\"],\"expected\":3,\"description\":\"sum\"}",
                    TestCase.class);

            assertEquals(2, testCase.input().size());
            assertTrue(testCase.input().get(0).isArray());
            assertEquals(TextNode.valueOf("x"), testCase.input().get(1));
            assertEquals(IntNode.valueOf(3), testCase.expected());
            assertEquals("sum", testCase.description());
        }
    }

    @Nested
    @DisplayName("ExecutionRequest")
    class ExecutionRequestTests {

        @Test
        void normalizesNulls() {
            var request = new ExecutionRequest(null, Language.SCRIPT, null,
                    new FunctionMetadata("add", List.of(), "number"));

            assertEquals("", request.code());
            assertTrue(request.testCases().isEmpty());
        }

        @Test
        void requiresLanguageAndMetadata() {
            var metadata = new FunctionMetadata("add", List.of(), "number");
            assertThrows(NullPointerException.class, () -> new ExecutionRequest("", null, List.of(), metadata));
            assertThrows(NullPointerException.class, () -> new ExecutionRequest("", Language.SCRIPT, List.of(), null));
        }
    }

    @Nested
    @DisplayName("SubmissionResult")
    class SubmissionResultTests {

        @Test
        void successRequiresEveryTestToPass() {
            var results = List.of(
                    ExecutionResult.passed(IntNode.valueOf(3), IntNode.valueOf(3), 5),
                    ExecutionResult.failed("Expected 7 but got 8", IntNode.valueOf(8), IntNode.valueOf(7), 5));

            var submission = SubmissionResult.of(results, 10);

            assertFalse(submission.success());
            assertEquals(1, submission.metrics().passedTests());
            assertEquals(2, submission.metrics().totalTests());
            assertEquals(10, submission.metrics().totalTimeMs());
            assertEquals(0, submission.metrics().totalMemory());
        }

        @Test
        @DisplayName("an empty test set is a success")
        void emptyIsSuccess() {
            var submission = SubmissionResult.of(List.of(), 0);

            assertTrue(submission.success());
            assertEquals(0, submission.metrics().totalTests());
        }

        @Test
        void allFailedCarriesMessageForEveryTest() {
            var testCases = List.of(
                    new TestCase(List.of(IntNode.valueOf(1)), IntNode.valueOf(1)),
                    new TestCase(List.of(IntNode.valueOf(2)), IntNode.valueOf(4)));

            var submission = SubmissionResult.allFailed(testCases, "boom", 50);

            assertFalse(submission.success());
            assertEquals(2, submission.results().size());
            assertTrue(submission.results().stream().allMatch(r -> "boom".equals(r.error())));
            assertEquals(IntNode.valueOf(4), submission.results().get(1).expected());
            assertTrue(submission.results().stream().allMatch(r -> r.memoryUsed() == 0));
        }

        @Test
        @DisplayName("serializes without null fields")
        void serializes() throws Exception {
            var json = mapper.writeValueAsString(
                    ExecutionResult.passed(IntNode.valueOf(3), IntNode.valueOf(3), 5));

            assertFalse(json.contains("\"error\""));
            assertTrue(json.contains("\"passed\":true"));
        }
    }
}
