package com.sectune.dispatch.cli;

import com.sectune.core.orchestrator.JobNotFoundException;
import com.sectune.core.orchestrator.JobOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: sectune poll [jobId]
 * <p>
 * Polls the provider for one job, or for every active job when no id is given.
 */
@Command(name = "poll", mixinStandardHelpOptions = true,
        description = "Poll the fine-tuning provider for job status")
@Component
public class PollCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Job ID (default: all active jobs)")
    private Long jobId;

    private final JobOrchestrator orchestrator;

    public PollCommand(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (jobId != null) {
            try {
                ConsoleOutput.job(orchestrator.pollStatus(jobId));
                return 0;
            } catch (JobNotFoundException e) {
                ConsoleOutput.error(e.getMessage());
                return 1;
            }
        }
        var jobs = orchestrator.pollActiveJobs();
        if (jobs.isEmpty()) {
            ConsoleOutput.info("No active jobs to poll");
            return 0;
        }
        ConsoleOutput.info("Polled " + jobs.size() + " active job" + (jobs.size() != 1 ? "s" : ""));
        jobs.forEach(ConsoleOutput::job);
        return 0;
    }
}
