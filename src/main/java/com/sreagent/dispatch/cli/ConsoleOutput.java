package com.sreagent.dispatch.cli;

import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the SRE Agent CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SRE AGENT ORCHESTRATOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SRE-AGENT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void worker(String kind, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + kind + "]|@ " + message));
    }

    /**
     * Prints one live stream frame.
     *
     * @param eventType the SSE event name
     * @param phase     the progress phase, may be null for non-progress frames
     * @param data      the text to show
     */
    public static void watchEvent(String eventType, String phase, String data) {
        String prefix = switch (eventType) {
            case "connected" -> "@|fg(cyan) [CONNECTED]|@";
            case "chat_response" -> "@|fg(green),bold [REPLY]|@";
            case "pipeline_event" -> phasePrefix(phase);
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String phasePrefix(String phase) {
        if (phase == null) {
            return "@|fg(white) [EVENT]|@";
        }
        return switch (phase) {
            case "running" -> "@|fg(blue) [RUNNING]|@";
            case "completed" -> "@|fg(green) [DONE]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            default -> "@|fg(white) [" + phase.toUpperCase(Locale.ROOT) + "]|@";
        };
    }

    static String formatSeconds(double seconds) {
        if (seconds < 60) return String.format("%.1fs", seconds);
        long whole = (long) seconds;
        return (whole / 60) + "m " + (whole % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
