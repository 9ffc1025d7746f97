package com.cape.dispatch.cli;

import com.cape.core.model.MatchResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CAPE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CAPE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    public static void capability(String id, String type, String description) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + id + "|@ @|fg(blue) [" + type + "]|@ " + description));
    }

    public static void match(MatchResult match) {
        String color = match.score() >= 0.7 ? "fg(green)" : match.score() >= 0.4 ? "fg(yellow)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  @|%s %.4f|@ %s @|faint (%s)|@", color, match.score(),
                        match.capabilityId(), match.kind().name().toLowerCase())));
    }

    public static void fileProduced(String path, int size) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + path + " (" + size + " bytes)"));
    }
}
