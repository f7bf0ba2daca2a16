package com.codearena.dispatch.cli;

import com.codearena.core.model.ExecutionResult;
import com.codearena.core.model.SubmissionResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CodeArena CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CODEARENA EXECUTOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CODEARENA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void testResult(int index, ExecutionResult result) {
        String status = result.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        var line = new StringBuilder("  @|fg(yellow) [TEST " + (index + 1) + "]|@ " + status);
        if (!result.passed()) {
            line.append(" expected ").append(render(result.expected()))
                .append(", got ").append(render(result.actual()));
        }
        line.append(" (").append(result.executionTimeMs()).append("ms)");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
        if (result.error() != null) {
            for (String errorLine : result.error().split("\\R")) {
                System.out.println("      " + errorLine);
            }
        }
    }

    public static void summary(SubmissionResult result) {
        var m = result.metrics();
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tests: @|fg(green) " + m.passedTests() + " passed|@ of " + m.totalTests()));
        System.out.println("  Duration: " + formatDuration(m.totalTimeMs()));
        if (result.success()) {
            success("All tests passed");
        } else {
            error("Submission failed");
        }
    }

    private static String render(Object value) {
        return value == null ? "nothing" : value.toString();
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
