package com.sectune.dispatch.api;

import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.JobStatus;
import com.sectune.core.orchestrator.JobNotFoundException;
import com.sectune.core.orchestrator.JobOrchestrator;
import com.sectune.core.scheduler.TriggerResult;
import com.sectune.core.scheduler.TriggerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for the fine-tuning trigger and job lifecycle.
 */
@RestController
@RequestMapping("/api/v1/training")
public class TrainingController {

    private static final Logger log = LoggerFactory.getLogger(TrainingController.class);

    private final TriggerScheduler triggerScheduler;
    private final JobOrchestrator orchestrator;

    public TrainingController(TriggerScheduler triggerScheduler, JobOrchestrator orchestrator) {
        this.triggerScheduler = triggerScheduler;
        this.orchestrator = orchestrator;
    }

    /**
     * POST /api/v1/training/trigger: Runs one trigger check.
     */
    @PostMapping("/trigger")
    public ResponseEntity<TriggerResult> trigger() {
        var result = triggerScheduler.checkAndTrigger();
        log.info("Trigger check via API: {} ({} qualifying)", result.outcome(), result.qualifyingCount());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/training/jobs/{id}: A single job, or 404.
     */
    @GetMapping("/jobs/{id}")
    public ResponseEntity<FineTuningJob> getJob(@PathVariable long id) {
        return orchestrator.findJob(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * GET /api/v1/training/jobs?status=TRAINING,DATA_UPLOADED: Jobs in the given
     * statuses, all jobs when no filter is given.
     */
    @GetMapping("/jobs")
    public ResponseEntity<?> listJobs(@RequestParam(name = "status", required = false) List<String> status) {
        Set<JobStatus> statuses;
        try {
            statuses = parseStatuses(status);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid status filter: " + status
                    + ". Valid values: " + Arrays.toString(JobStatus.values())));
        }
        return ResponseEntity.ok(orchestrator.findJobs(statuses));
    }

    /**
     * POST /api/v1/training/jobs/{id}/poll: Polls the provider once for a job.
     */
    @PostMapping("/jobs/{id}/poll")
    public ResponseEntity<FineTuningJob> pollJob(@PathVariable long id) {
        return ResponseEntity.ok(orchestrator.pollStatus(id));
    }

    /**
     * POST /api/v1/training/jobs/poll: Polls every active job.
     */
    @PostMapping("/jobs/poll")
    public ResponseEntity<List<FineTuningJob>> pollActiveJobs() {
        return ResponseEntity.ok(orchestrator.pollActiveJobs());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    static Set<JobStatus> parseStatuses(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return EnumSet.allOf(JobStatus.class);
        }
        var statuses = EnumSet.noneOf(JobStatus.class);
        for (String value : raw) {
            if (value.isBlank()) {
                continue;
            }
            statuses.add(JobStatus.valueOf(value.trim().toUpperCase()));
        }
        return statuses.isEmpty() ? EnumSet.allOf(JobStatus.class) : statuses;
    }
}
