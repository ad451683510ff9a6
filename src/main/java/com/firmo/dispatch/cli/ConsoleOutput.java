package com.firmo.dispatch.cli;

import com.firmo.core.engine.FailureDetail;
import com.firmo.core.engine.Outcome;
import com.firmo.core.engine.OutcomeStatus;
import com.firmo.core.results.RunSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Firmo CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FIRMO v0.4.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FIRMO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void suite(String path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + path + "|@"));
    }

    public static void caseResult(String status, String path, long durationMs) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + statusLabel(status) + " " + path + " @|faint (" + durationMs + "ms)|@"));
    }

    /** One line per node of a resolved plan. */
    public static void planEntry(int depth, String name, boolean isCase, boolean willRun, String reason) {
        String indent = "  ".repeat(depth);
        String marker = willRun ? "@|fg(green) run |@" : "@|fg(yellow) skip|@";
        String label = isCase ? name : "@|bold " + name + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + marker + " " + label + (willRun || reason == null ? "" : " @|faint (" + reason + ")|@")));
    }

    public static void failure(Outcome outcome) {
        FailureDetail d = outcome.failureDetail();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + statusLabel(outcome.status().name()) + " " + outcome.pathString()));
        if (d == null) {
            return;
        }
        System.out.println("      " + d.message());
        if (d.expected() != null || d.actual() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(green) expected:|@ " + d.expected()));
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(red)   actual:|@ " + d.actual()));
        }
        if (d.diff() != null) {
            System.out.println("      " + d.diff());
        }
        if (d.location() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|faint at " + d.location() + "|@"));
        }
    }

    public static void summary(RunSummary s) {
        System.out.println("──────────────────────────────────");
        if (!s.failures().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Failures|@"));
            for (Outcome o : s.failures()) {
                failure(o);
            }
            System.out.println();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + s.runId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Cases: " + s.total() + " total, @|fg(green) " + s.passed() + " passed|@" +
                (s.failed() > 0 ? ", @|fg(red) " + s.failed() + " failed|@" : "") +
                (s.errors() > 0 ? ", @|fg(red) " + s.errors() + " errors|@" : "") +
                (s.skipped() > 0 ? ", @|fg(yellow) " + s.skipped() + " skipped|@" : "") +
                (s.pending() > 0 ? ", @|fg(yellow) " + s.pending() + " pending|@" : "")));
        System.out.println("  Duration: " + formatDuration(s.totalDurationMs()));
        if (s.successful()) {
            success("All executed cases passed");
        } else {
            error((s.failed() + s.errors()) + " case(s) did not pass");
        }
    }

    private static String statusLabel(String status) {
        return switch (OutcomeStatus.valueOf(status)) {
            case PASS -> "@|fg(green) PASS|@";
            case FAIL -> "@|fg(red) FAIL|@";
            case ERROR_RAISED -> "@|fg(red),bold ERROR|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
            case PENDING -> "@|fg(yellow) PEND|@";
        };
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
