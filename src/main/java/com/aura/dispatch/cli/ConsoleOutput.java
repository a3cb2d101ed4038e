package com.aura.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Aura CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AURA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AURA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void chainLink(int depth, String objectId, int methodCount) {
        String indent = "  ".repeat(depth + 1);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + "@|fg(blue) [" + depth + "]|@ " + objectId
                        + " (" + methodCount + " method" + (methodCount != 1 ? "s" : "") + ")"));
    }
}
