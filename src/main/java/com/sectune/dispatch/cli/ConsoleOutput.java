package com.sectune.dispatch.cli;

import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.JobStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sectune CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SECTUNE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SECTUNE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void job(FineTuningJob job) {
        System.out.println();
        System.out.println("JOB " + job.id() + " (" + job.jobName() + ")");
        System.out.println("Model: " + job.modelType() + " on " + job.baseModel());
        String status = "Status: " + job.status();
        if (job.status() == JobStatus.COMPLETED) {
            success(status);
        } else if (job.status() == JobStatus.FAILED) {
            error(status);
        } else {
            info(status);
        }
        System.out.printf("  %-18s %s%n", "Training examples", job.trainingDataCount());
        System.out.printf("  %-18s %s%n", "Provider job", orDash(job.providerJobId()));
        System.out.printf("  %-18s %s%n", "Fine-tuned model", orDash(job.fineTunedModelId()));
        System.out.printf("  %-18s %s%n", "Created", job.createdAt());
        System.out.printf("  %-18s %s%n", "Updated", job.updatedAt());
        if (job.errorMessage() != null) {
            error("Error: " + job.errorMessage());
        }
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
