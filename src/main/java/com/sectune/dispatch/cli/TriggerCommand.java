package com.sectune.dispatch.cli;

import com.sectune.core.scheduler.TriggerScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: sectune trigger
 * <p>
 * Runs one trigger check and starts a fine-tuning job when enough qualifying
 * conversations have accumulated.
 */
@Command(name = "trigger", mixinStandardHelpOptions = true,
        description = "Start a fine-tuning job if enough training data is available")
@Component
public class TriggerCommand implements Runnable {

    private final TriggerScheduler triggerScheduler;

    public TriggerCommand(TriggerScheduler triggerScheduler) {
        this.triggerScheduler = triggerScheduler;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var result = triggerScheduler.checkAndTrigger();
        switch (result.outcome()) {
            case BELOW_THRESHOLD -> ConsoleOutput.info("%d qualifying conversations; %d needed to start a job"
                    .formatted(result.qualifyingCount(), result.threshold()));
            case SKIPPED_CONCURRENT -> ConsoleOutput.info("Another trigger check is running; skipped");
            case TRIGGERED -> {
                ConsoleOutput.success("Started fine-tuning job from %d qualifying conversations"
                        .formatted(result.qualifyingCount()));
                ConsoleOutput.job(result.job());
            }
        }
    }
}
