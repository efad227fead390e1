package com.sectune.dispatch.cli;

import com.sectune.core.classifier.ClassificationService;
import com.sectune.core.evaluation.PerformanceEvaluator;
import com.sectune.core.health.HealthCheckService;
import com.sectune.core.health.HealthStatus;
import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.Hyperparameters;
import com.sectune.core.model.JobStatus;
import com.sectune.core.model.PerformanceRecord;
import com.sectune.core.model.ThreatCategory;
import com.sectune.core.orchestrator.JobNotFoundException;
import com.sectune.core.orchestrator.JobOrchestrator;
import com.sectune.core.scheduler.TriggerResult;
import com.sectune.core.scheduler.TriggerScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises picocli directly with mocked services, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private TriggerScheduler triggerScheduler;
    private JobOrchestrator orchestrator;
    private ClassificationService classificationService;
    private PerformanceEvaluator evaluator;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        triggerScheduler = mock(TriggerScheduler.class);
        orchestrator = mock(JobOrchestrator.class);
        classificationService = mock(ClassificationService.class);
        evaluator = mock(PerformanceEvaluator.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    private static FineTuningJob job(long id, JobStatus status, String error) {
        var now = Instant.parse("2026-05-01T12:00:00Z");
        return new FineTuningJob(id, "security-ft-20260501-120000", "security-analyst", "gpt-4o-mini",
                status, 60, new Hyperparameters(3, 4, 1.0), "ftjob-abc", null, error, now, now, null);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == TriggerCommand.class) {
                    return (K) new TriggerCommand(triggerScheduler);
                }
                if (cls == PollCommand.class) {
                    return (K) new PollCommand(orchestrator);
                }
                if (cls == JobCommand.class) {
                    return (K) new JobCommand(orchestrator);
                }
                if (cls == ClassifyCommand.class) {
                    return (K) new ClassifyCommand(classificationService);
                }
                if (cls == EvaluateCommand.class) {
                    return (K) new EvaluateCommand(evaluator);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SectuneCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("trigger", "poll", "job", "classify", "evaluate", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("fine-tuning"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Sectune 0.1.0"));
        }

        @Test
        @DisplayName("evaluate --help shows the --history option")
        void evaluateHelp() {
            CliResult result = execute("evaluate", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--history"));
        }

        @Test
        @DisplayName("job without an id is a usage error")
        void jobRequiresId() {
            CliResult result = execute("job");
            assertEquals(2, result.exitCode());
        }
    }

    @Nested
    @DisplayName("trigger")
    class TriggerTests {

        @Test
        @DisplayName("Below threshold reports the count")
        void belowThreshold() {
            when(triggerScheduler.checkAndTrigger()).thenReturn(TriggerResult.belowThreshold(12, 50));

            CliResult result = execute("trigger");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("12 qualifying conversations; 50 needed"));
        }

        @Test
        @DisplayName("Triggered prints the new job")
        void triggered() {
            when(triggerScheduler.checkAndTrigger())
                    .thenReturn(TriggerResult.triggered(60, 50, job(7, JobStatus.DATA_UPLOADED, null)));

            CliResult result = execute("trigger");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Started fine-tuning job from 60"));
            assertTrue(result.output().contains("JOB 7"));
            assertTrue(result.output().contains("ftjob-abc"));
        }

        @Test
        @DisplayName("Concurrent check is reported as skipped")
        void skipped() {
            when(triggerScheduler.checkAndTrigger()).thenReturn(TriggerResult.skipped(50));

            CliResult result = execute("trigger");

            assertTrue(result.output().contains("skipped"));
        }
    }

    @Nested
    @DisplayName("job and poll")
    class JobTests {

        @Test
        @DisplayName("job prints a known job")
        void showJob() {
            when(orchestrator.findJob(3L)).thenReturn(Optional.of(job(3, JobStatus.FAILED, "Provider job cancelled")));

            CliResult result = execute("job", "3");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Status: FAILED"));
            assertTrue(result.output().contains("Provider job cancelled"));
        }

        @Test
        @DisplayName("job for an unknown id exits 1")
        void unknownJob() {
            when(orchestrator.findJob(99L)).thenReturn(Optional.empty());

            CliResult result = execute("job", "99");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Job not found: 99"));
        }

        @Test
        @DisplayName("poll with an id polls that job")
        void pollOne() {
            when(orchestrator.pollStatus(4L)).thenReturn(job(4, JobStatus.TRAINING, null));

            CliResult result = execute("poll", "4");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Status: TRAINING"));
            verify(orchestrator, never()).pollActiveJobs();
        }

        @Test
        @DisplayName("poll for an unknown id exits 1")
        void pollUnknown() {
            when(orchestrator.pollStatus(5L)).thenThrow(new JobNotFoundException(5L));

            CliResult result = execute("poll", "5");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Fine-tuning job not found: 5"));
        }

        @Test
        @DisplayName("poll without an id polls every active job")
        void pollAll() {
            when(orchestrator.pollActiveJobs())
                    .thenReturn(List.of(job(1, JobStatus.TRAINING, null), job(2, JobStatus.COMPLETED, null)));

            CliResult result = execute("poll");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Polled 2 active jobs"));
        }

        @Test
        @DisplayName("poll with nothing active says so")
        void pollNone() {
            when(orchestrator.pollActiveJobs()).thenReturn(List.of());

            CliResult result = execute("poll");

            assertTrue(result.output().contains("No active jobs"));
        }
    }

    @Nested
    @DisplayName("classify and evaluate")
    class ClassifyEvaluateTests {

        @Test
        @DisplayName("classify prints the stored record")
        void classify() {
            when(classificationService.classifyConversation("conv-1")).thenReturn(Optional.of(
                    new ClassificationRecord("conv-1", true, 0.9, ThreatCategory.MALWARE,
                            Set.of("malware", "ransomware"), false, null, Instant.now())));

            CliResult result = execute("classify", "conv-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Security-related conv-1"));
            assertTrue(result.output().contains("category malware"));
            assertTrue(result.output().contains("Keywords: malware, ransomware"));
        }

        @Test
        @DisplayName("classify for an unknown conversation exits 1")
        void classifyUnknown() {
            when(classificationService.classifyConversation("missing")).thenReturn(Optional.empty());

            CliResult result = execute("classify", "missing");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Conversation not found: missing"));
        }

        @Test
        @DisplayName("evaluate with no held-out data records nothing")
        void evaluateEmpty() {
            when(evaluator.evaluate("ft-1")).thenReturn(Optional.empty());

            CliResult result = execute("evaluate", "ft-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("nothing recorded"));
        }

        @Test
        @DisplayName("evaluate --history lists stored records")
        void evaluateHistory() {
            when(evaluator.history("ft-1")).thenReturn(List.of(
                    new PerformanceRecord("ft-1", "accuracy", 0.75, 20, Instant.parse("2026-05-01T12:00:00Z"))));

            CliResult result = execute("evaluate", "ft-1", "--history");

            assertTrue(result.output().contains("accuracy"));
            assertTrue(result.output().contains("2026-05-01T12:00:00Z"));
            verify(evaluator, never()).evaluate("ft-1");
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("Degraded components still exit 0")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("store", HealthStatus.Status.DEGRADED, "In-memory store", Map.of()),
                    new HealthStatus("provider", HealthStatus.Status.UP, "openai configured", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("(degraded) store: In-memory store"));
            assertTrue(result.output().contains("degraded components"));
        }

        @Test
        @DisplayName("A down component exits 1")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("database", HealthStatus.Status.DOWN, "Connection refused", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("database: Connection refused"));
        }
    }
}
