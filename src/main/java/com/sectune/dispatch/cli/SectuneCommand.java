package com.sectune.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Sectune.
 */
@Command(
        name = "sectune",
        mixinStandardHelpOptions = true,
        version = "Sectune 0.1.0",
        description = "Curates security conversations into fine-tuning data and manages fine-tuning jobs",
        subcommands = {
                TriggerCommand.class,
                PollCommand.class,
                JobCommand.class,
                ClassifyCommand.class,
                EvaluateCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SectuneCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
