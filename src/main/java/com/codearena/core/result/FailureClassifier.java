package com.codearena.core.result;

import com.codearena.core.execution.FailureKind;

import java.util.List;
import java.util.Optional;

/**
 * Recognises well-known toolchain failure signatures in raw output.
 *
 * <p>Rules are checked in order; the first rule with a matching substring wins.
 */
public final class FailureClassifier {

    /** Raw output kept in a classified message. */
    static final int DETAIL_LIMIT = 500;

    public record Classification(FailureKind kind, String message) {}

    private record Rule(FailureKind kind, String message, List<String> needles) {
        boolean matches(String text) {
            return needles.stream().anyMatch(text::contains);
        }
    }

    private static final List<Rule> RULES = List.of(
        new Rule(FailureKind.TOOLCHAIN_UNAVAILABLE,
                "Go toolchain is not available on the execution host.",
                List.of("Go runtime not available", "executable file not found", "go: command not found",
                        "go: not found")),
        new Rule(FailureKind.MODULE_INIT_FAILURE,
                "Go module initialization failed.",
                List.of("Go module initialization failed", "go: cannot determine module path",
                        "go.mod already exists")),
        new Rule(FailureKind.COMPILE_OR_SYNTAX_FAILURE,
                "Function is missing return statement. Make sure your function returns a value.",
                List.of("missing return")),
        new Rule(FailureKind.COMPILE_OR_SYNTAX_FAILURE,
                "Syntax error in your Go code. Please check your code for errors.",
                List.of("syntax error")),
        new Rule(FailureKind.COMPILE_OR_SYNTAX_FAILURE,
                "Go compilation failed. Please check your code for errors.",
                List.of("build failed", "Compilation failed", "compilation")),
        new Rule(FailureKind.GENERIC_EXECUTION_FAILURE,
                "Go execution error occurred.",
                List.of("EXECUTION_ERROR:"))
    );

    private FailureClassifier() {}

    /**
     * Classifies {@code output}, returning a learner-facing message followed by
     * the head of the raw output.
     */
    public static Optional<Classification> classify(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        return RULES.stream()
                .filter(rule -> rule.matches(output))
                .findFirst()
                .map(rule -> new Classification(rule.kind(), withDetails(rule.message(), output)));
    }

    static String withDetails(String message, String output) {
        String details = output.length() > DETAIL_LIMIT ? output.substring(0, DETAIL_LIMIT) : output;
        return message + "\nDetails: " + details.strip();
    }
}
