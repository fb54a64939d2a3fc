package com.garrison.dispatch.cli;

import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.model.WaveSpec;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Garrison CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GARRISON v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GARRISON]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void waveSpec(WaveSpec wave) {
        String groups = wave.allGroups().stream()
                .map(ConsoleOutput::describe)
                .collect(Collectors.joining(", "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [WAVE " + wave.waveNumber() + "]|@ after " + formatDuration(wave.thresholdSeconds())
                + " | radius " + (int) wave.minSpawnRadius() + "-" + (int) wave.maxSpawnRadius() + "m | " + groups));
    }

    public static void waveFired(long atSecond, int waveNumber, int liveGroups) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) " + formatDuration(atSecond) + "|@ wave " + waveNumber
                + " fired, " + liveGroups + " reinforcement group" + (liveGroups != 1 ? "s" : "") + " live"));
    }

    public static void notification(String title, String subtitle) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [ALERT]|@ " + title + " - " + subtitle));
    }

    private static String describe(UnitGroupSpec group) {
        return group.prefab() + " x" + group.memberCount() + (group.aerial() ? " (air)" : "");
    }

    static String formatDuration(long seconds) {
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
