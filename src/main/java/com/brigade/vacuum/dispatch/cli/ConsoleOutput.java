package com.brigade.vacuum.dispatch.cli;

import com.brigade.vacuum.core.model.BuildDeletion;
import com.brigade.vacuum.core.model.ResourceKind;
import com.brigade.vacuum.core.model.ResourceOutcome;
import com.brigade.vacuum.core.model.VacuumReport;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the vacuum CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BRIGADE VACUUM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VACUUM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /** Errors go to stderr so {@code --json} output on stdout stays parseable. */
    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void report(VacuumReport report) {
        policy("AGE", report.ageEvictions());
        policy("COUNT", report.countEvictions());

        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Pass " + report.passId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Builds evicted: " + report.allEvictions().size()));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Workers: @|fg(green) " + report.total(ResourceKind.WORKER, ResourceOutcome.Status.DELETED)
                + " deleted|@, " + report.total(ResourceKind.WORKER, ResourceOutcome.Status.SKIPPED)
                + " skipped, @|fg(red) " + report.total(ResourceKind.WORKER, ResourceOutcome.Status.FAILED)
                + " failed|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Records: @|fg(green) " + report.total(ResourceKind.RECORD, ResourceOutcome.Status.DELETED)
                + " deleted|@, @|fg(red) " + report.total(ResourceKind.RECORD, ResourceOutcome.Status.FAILED)
                + " failed|@"));
        if (report.hasFailures()) {
            warn("Some resources could not be deleted; see the log for details");
        }
    }

    private static void policy(String name, List<BuildDeletion> deletions) {
        if (deletions.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + name + "]|@ evicted " + deletions.size() +
                " build" + (deletions.size() != 1 ? "s" : "")));
        for (BuildDeletion deletion : deletions) {
            String marker = deletion.isClean() ? "@|fg(green) -|@ " : "@|fg(red) !|@ ";
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + marker + deletion.buildId()));
            for (ResourceOutcome outcome : deletion.outcomes()) {
                if (outcome.status() != ResourceOutcome.Status.DELETED) {
                    System.out.println(CommandLine.Help.Ansi.AUTO.string(
                            "      " + outcome.status() + " " + outcome.kind().name().toLowerCase(Locale.ROOT)
                            + " " + outcome.name() + " (" + outcome.detail() + ")"));
                }
            }
        }
    }
}
