package com.swarmcore.dispatch.cli;

import com.swarmcore.core.metrics.CoordinationSummary;
import com.swarmcore.core.metrics.MetricsSample;
import com.swarmcore.core.model.TaskStatus;
import com.swarmcore.core.state.TaskStatusSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the swarmcore CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWARMCORE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWARMCORE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskStatus(TaskStatusSnapshot snapshot) {
        String color = switch (snapshot.status()) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case CANCELLED -> "fg(yellow)";
            default -> "fg(white)";
        };
        String agent = snapshot.assignedAgentId() == null ? "-" : snapshot.assignedAgentId();
        String line = String.format("  %-24s @|%s %-9s|@ agent=%-12s retries=%d",
                snapshot.taskId(), color, snapshot.status(), agent, snapshot.retryCount());
        if (snapshot.status() == TaskStatus.FAILED && snapshot.failureReason() != null) {
            line += "  " + snapshot.failureReason();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void metrics(MetricsSample sample) {
        CoordinationSummary s = sample.summary();
        rule();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Coordination Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + s.totalTasks() + " total, @|fg(green) " + s.completedTasks() + " completed|@, @|fg(red) "
                        + s.failedTasks() + " failed|@"));
        System.out.println("  Agents: " + s.totalAgents() + " registered, " + s.activeAgents() + " active");
        System.out.println(String.format("  Avg execution: %s | Error rate: %.1f%% | Throughput: %.1f/min",
                formatDuration((long) s.avgExecutionMs()), s.errorRate() * 100, s.throughputPerMinute()));
        System.out.println(String.format("  Conflict rate: %.3f | Steal rate: %.3f | Pool utilization: %.0f%%",
                sample.conflictRate(), sample.stealRate(), sample.poolUtilization() * 100));
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
