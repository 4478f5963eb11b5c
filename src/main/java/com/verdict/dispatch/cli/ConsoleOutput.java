package com.verdict.dispatch.cli;

import com.verdict.core.events.VerdictEvent;
import com.verdict.core.runner.SuiteSummary;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Verdict CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) VERDICT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VERDICT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void summary(SuiteSummary summary) {
        String line = summary + " (" + summary.duration().toMillis() + "ms) [" + summary.runId() + "]";
        if (summary.passed()) {
            success(line);
        } else {
            error(line);
        }
    }

    /**
     * Prints failures, pending examples, diagnostics and deprecations of a run as they are
     * published. Other events are not printed.
     */
    public static void runEvent(VerdictEvent event) {
        Map<String, Object> payload = event.payload();
        String line = switch (event.eventType()) {
            case "example.failed" -> "@|fg(red),bold [FAILED]|@ " + payload.get("description")
                    + " @|faint (" + payload.get("location") + ")|@\n    "
                    + payload.get("exceptionClass") + ": " + payload.get("exceptionMessage");
            case "example.pending" -> "@|fg(yellow) [PENDING]|@ " + payload.get("description")
                    + " (" + payload.get("pendingMessage") + ")";
            case "run.message" -> "@|fg(magenta) [MESSAGE]|@ " + String.valueOf(payload.get("message")).strip();
            case "run.deprecation" -> "@|fg(yellow) [DEPRECATED]|@ " + deprecationText(payload);
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    private static String deprecationText(Map<String, Object> fields) {
        Object deprecated = fields.get("deprecated");
        if (deprecated == null) {
            return String.valueOf(fields.get("message"));
        }
        var text = new StringBuilder().append(deprecated).append(" is deprecated");
        if (fields.get("replacement") != null) {
            text.append(", use ").append(fields.get("replacement")).append(" instead");
        }
        if (fields.get("callSite") != null) {
            text.append(" (called from ").append(fields.get("callSite")).append(')');
        }
        return text.toString();
    }
}
