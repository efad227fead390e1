package com.sectune.dispatch.cli;

import com.sectune.core.orchestrator.JobOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: sectune job &lt;jobId&gt;
 */
@Command(name = "job", mixinStandardHelpOptions = true, description = "Show a fine-tuning job")
@Component
public class JobCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Job ID")
    private long jobId;

    private final JobOrchestrator orchestrator;

    public JobCommand(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var job = orchestrator.findJob(jobId);
        if (job.isEmpty()) {
            ConsoleOutput.error("Job not found: " + jobId);
            return 1;
        }
        ConsoleOutput.job(job.get());
        return 0;
    }
}
