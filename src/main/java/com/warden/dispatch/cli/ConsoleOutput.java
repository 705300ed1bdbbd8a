package com.warden.dispatch.cli;

import com.warden.core.events.Event;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Warden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(UpdateState state) {
        String color = switch (state) {
            case APPLIED -> "fg(green)";
            case FAILED -> "fg(red)";
            case ROLLED_BACK -> "fg(magenta)";
            case PENDING -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  State:    @|" + color + ",bold " + state.wireName() + "|@"));
    }

    public static void record(UpdateRecord record) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold UPDATE " + record.id() + "|@"));
        System.out.println("  Name:     " + record.name());
        System.out.println("  Version:  " + (record.version() != null ? record.version() : "-"));
        state(record.state());
        System.out.println("  Created:  " + record.createdAt());
        for (Map.Entry<String, Object> entry : record.meta().entrySet()) {
            System.out.printf("  %-9s %s%n", entry.getKey() + ":", entry.getValue());
        }
    }

    public static void recordTableHeader() {
        System.out.printf("  %-6s %-12s %-24s %-12s %s%n", "ID", "STATE", "NAME", "VERSION", "CREATED");
        System.out.println("  " + "-".repeat(80));
    }

    public static void recordRow(UpdateRecord record) {
        System.out.printf("  %-6d %-12s %-24s %-12s %s%n",
                record.id(), record.state().wireName(), truncate(record.name(), 24),
                record.version() != null ? truncate(record.version(), 12) : "-", record.createdAt());
    }

    public static void event(Event event) {
        String prefix = switch (event.kind()) {
            case "update.started" -> "@|fg(cyan) [STARTED]|@";
            case "update.applied" -> "@|fg(green),bold [APPLIED]|@";
            case "update.failed" -> "@|fg(red),bold [FAILED]|@";
            case "update.rollback_started" -> "@|fg(magenta) [ROLLBACK]|@";
            case "update.rolled_back" -> "@|fg(magenta),bold [ROLLED BACK]|@";
            default -> "@|fg(white) [" + event.kind() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + String.format("%6d", event.id()) + " " + event.createdAt() + " " + prefix + " "
                        + (event.payload() != null ? event.payload() : "")));
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
