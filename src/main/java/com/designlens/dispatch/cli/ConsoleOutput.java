package com.designlens.dispatch.cli;

import com.designlens.core.comparison.ComparisonMetrics;
import com.designlens.core.engine.PipelineOutput;
import com.designlens.core.model.MappedComponent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Designlens CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DESIGNLENS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DESIGNLENS]|@ " + message));
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

    public static void stage(String stage, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + stage + "]|@ " + message));
    }

    public static void component(MappedComponent component) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + component.targetComponent() + "|@ " + component.name()
                + (component.content() != null ? " \"" + component.content() + "\"" : "")));
    }

    public static void summary(PipelineOutput output) {
        var grouping = output.grouping();
        var analysis = output.analysis();
        stage("EXTRACT", output.descriptorCount() + " descriptors");
        stage("GROUP", grouping.groups().size() + " groups, confidence "
                + percent(grouping.confidence()) + (grouping.fallback() ? " (fallback)" : ""));
        stage("VALIDATE", analysis.components().size() + " components, confidence "
                + percent(analysis.confidence()) + (analysis.fallback() ? " (fallback)" : ""));
        if (output.mapping() != null) {
            stage("MAP", output.mapping().components().size() + " mapped components");
            output.mapping().components().forEach(ConsoleOutput::component);
        }
        for (String suggestion : analysis.suggestions()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(yellow) -|@ " + suggestion));
        }
    }

    public static void metrics(ComparisonMetrics m, PipelineOutput.Timings timings) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Metrics|@"));
        if (m != null) {
            System.out.println("  Component delta: " + signed(m.improvement().componentCount()));
            System.out.println("  Confidence change: " + String.format("%+.1f", m.improvement().confidenceChange()) + "%");
            System.out.println("  Coverage: " + m.coverage().text() + " text, " + m.coverage().interactive()
                    + " interactive, " + m.coverage().structural() + " structural");
        }
        System.out.println("  Duration: " + formatDuration(timings.totalMs())
                + " (grouping " + formatDuration(timings.groupingMs())
                + ", validation " + formatDuration(timings.validationMs()) + ")");
    }

    private static String percent(double value) {
        return Math.round(value * 100) + "%";
    }

    private static String signed(int value) {
        return value > 0 ? "+" + value : String.valueOf(value);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
