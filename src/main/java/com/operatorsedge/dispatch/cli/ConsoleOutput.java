package com.operatorsedge.dispatch.cli;

import com.operatorsedge.core.junction.PendingJunction;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the edge CLI.
 * {@code edge run} does not use these; its stdout carries only the JSON turn result.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OPERATOR'S EDGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [EDGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void gear(String mode, int iterations) {
        String color = switch (mode) {
            case "ACTIVE" -> "fg(green)";
            case "PATROL" -> "fg(blue)";
            default -> "fg(magenta)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Gear:|@ @|" + color + " " + mode + "|@ (" + iterations + " iteration"
                        + (iterations != 1 ? "s" : "") + " in mode)"));
    }

    public static void junction(PendingJunction junction) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) [JUNCTION " + junction.type() + "]|@ " + junction.reason()));
        System.out.println("  id: " + junction.id() + "  source: " + junction.source()
                + "  raised: " + junction.createdAt());
        Object command = junction.payload().get("command");
        if (command != null) {
            System.out.println("  command: " + command);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  respond with @|bold approve|@, @|bold skip|@, @|bold dismiss [minutes]|@ or @|bold stop|@"));
    }
}
