package com.codearena.core.result;

import com.codearena.core.execution.FailureKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @Test
    void missingReturn() {
        var c = FailureClassifier.classify("./main.go:12:1: missing return").orElseThrow();

        assertEquals(FailureKind.COMPILE_OR_SYNTAX_FAILURE, c.kind());
        assertTrue(c.message().startsWith("Function is missing return statement."));
        assertTrue(c.message().contains("\nDetails: ./main.go:12:1: missing return"));
    }

    @Test
    void syntaxError() {
        var c = FailureClassifier.classify("main.go:3:5: syntax error: unexpected }").orElseThrow();

        assertEquals("Syntax error in your Go code. Please check your code for errors.",
                c.message().lines().findFirst().orElseThrow());
    }

    @Test
    void buildFailure() {
        assertEquals(FailureKind.COMPILE_OR_SYNTAX_FAILURE,
                FailureClassifier.classify("# command-line-arguments\nbuild failed").orElseThrow().kind());
        assertEquals(FailureKind.COMPILE_OR_SYNTAX_FAILURE,
                FailureClassifier.classify("Compilation failed: undefined: foo").orElseThrow().kind());
    }

    @Test
    void moduleInitFailure() {
        assertEquals(FailureKind.MODULE_INIT_FAILURE,
                FailureClassifier.classify("Go module initialization failed: go.mod already exists")
                        .orElseThrow().kind());
    }

    @Test
    void toolchainUnavailable() {
        assertEquals(FailureKind.TOOLCHAIN_UNAVAILABLE,
                FailureClassifier.classify("exec: \"go\": executable file not found in $PATH").orElseThrow().kind());
    }

    @Test
    void executionErrorMarker() {
        var c = FailureClassifier.classify("EXECUTION_ERROR: panic in executor").orElseThrow();

        assertEquals(FailureKind.GENERIC_EXECUTION_FAILURE, c.kind());
        assertTrue(c.message().startsWith("Go execution error occurred."));
    }

    @Test
    void missingReturnWinsOverGenericCompilation() {
        var c = FailureClassifier.classify("compilation: missing return").orElseThrow();

        assertTrue(c.message().startsWith("Function is missing return statement."));
    }

    @Test
    void detailsAreTruncated() {
        String output = "syntax error " + "x".repeat(2_000);

        var c = FailureClassifier.classify(output).orElseThrow();

        String details = c.message().substring(c.message().indexOf("Details: ") + "Details: ".length());
        assertEquals(FailureClassifier.DETAIL_LIMIT, details.length());
    }

    @Test
    void unknownOutputIsNotClassified() {
        assertTrue(FailureClassifier.classify("hello world").isEmpty());
        assertTrue(FailureClassifier.classify("").isEmpty());
        assertTrue(FailureClassifier.classify(null).isEmpty());
    }
}
