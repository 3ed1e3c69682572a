package com.rolloutstream.dispatch.cli;

import com.rolloutstream.core.model.LogEvent;
import com.rolloutstream.core.model.PodInfo;
import com.rolloutstream.core.model.SourceType;
import com.rolloutstream.core.model.Target;
import picocli.CommandLine;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the rollout-stream CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ROLLOUT-STREAM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROLLOUT-STREAM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void target(Target target) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + typeTag(target.kind()) + " " + target.id() + "  @|faint " + target.selector() + "|@"));
    }

    public static void roster(List<PodInfo> pods) {
        String names = pods.stream().map(PodInfo::name).collect(Collectors.joining(", "));
        info(pods.size() + " pod" + (pods.size() != 1 ? "s" : "") + (pods.isEmpty() ? "" : ": " + names));
    }

    public static void logLine(LogEvent event) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint " + Instant.ofEpochMilli(event.timestampMillis()) + "|@ "
                + typeTag(event.sourceType()) + " @|bold " + event.pod() + "/" + event.container() + "|@ ")
                + event.text());
    }

    private static String typeTag(SourceType type) {
        return type == SourceType.JOB
                ? "@|fg(magenta) [JOB]|@"
                : "@|fg(blue) [WORKLOAD]|@";
    }
}
