package com.sectune.core.scheduler;

import com.sectune.core.TestFixtures;
import com.sectune.core.dataset.TrainingExampleFormatter;
import com.sectune.core.dataset.TrainingExampleValidator;
import com.sectune.core.evaluation.EvaluationProperties;
import com.sectune.core.evaluation.PerformanceEvaluator;
import com.sectune.core.metrics.TrainingMetrics;
import com.sectune.core.model.JobStatus;
import com.sectune.core.orchestrator.JobOrchestrator;
import com.sectune.core.orchestrator.TrainingProperties;
import com.sectune.core.persistence.InMemoryTrainingStore;
import com.sectune.provider.FineTuningProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TriggerSchedulerTest {

    private InMemoryTrainingStore store;
    private FineTuningProvider provider;
    private SimpleMeterRegistry registry;
    private TriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryTrainingStore();
        provider = mock(FineTuningProvider.class);
        when(provider.name()).thenReturn("openai");
        when(provider.submit(anyString(), anyList(), anyString(), any())).thenReturn("ftjob-1");
        registry = new SimpleMeterRegistry();
        var metrics = new TrainingMetrics(registry);
        var properties = new TrainingProperties();
        var orchestrator = new JobOrchestrator(store, new TrainingExampleFormatter(), new TrainingExampleValidator(),
                provider, mock(PerformanceEvaluator.class), properties, new EvaluationProperties(), metrics);
        scheduler = new TriggerScheduler(store, orchestrator, properties, metrics);
    }

    @Test
    @DisplayName("Sixty qualifying records start exactly one job claiming all of them")
    void triggersOnce() {
        var ids = TestFixtures.seedQualifying(store, 60, 0.9);

        var first = scheduler.checkAndTrigger();

        assertEquals(TriggerResult.Outcome.TRIGGERED, first.outcome());
        assertEquals(60, first.qualifyingCount());
        var job = first.job();
        assertEquals(JobStatus.DATA_UPLOADED, job.status());
        assertEquals(60, job.trainingDataCount());
        assertEquals("ftjob-1", job.providerJobId());
        for (String id : ids) {
            assertEquals(job.id(), store.findClassification(id).orElseThrow().trainingJobId());
        }

        var second = scheduler.checkAndTrigger();

        assertEquals(TriggerResult.Outcome.BELOW_THRESHOLD, second.outcome());
        assertEquals(0, second.qualifyingCount());
        assertEquals(1, store.findJobsByStatus(EnumSet.allOf(JobStatus.class)).size());
        verify(provider, times(1)).submit(anyString(), anyList(), anyString(), any());
    }

    @Test
    @DisplayName("Below the threshold nothing is created")
    void belowThreshold() {
        TestFixtures.seedQualifying(store, 49, 0.9);

        var result = scheduler.checkAndTrigger();

        assertEquals(TriggerResult.Outcome.BELOW_THRESHOLD, result.outcome());
        assertEquals(49, result.qualifyingCount());
        assertEquals(50, result.threshold());
        assertNull(result.job());
        assertTrue(store.findJobsByStatus(EnumSet.allOf(JobStatus.class)).isEmpty());
        assertEquals(49, store.countQualifying(0.5));
    }

    @Test
    @DisplayName("Records below the trigger confidence are not counted")
    void lowConfidenceNotCounted() {
        TestFixtures.seedQualifying(store, 60, 0.45);

        var result = scheduler.checkAndTrigger();

        assertEquals(TriggerResult.Outcome.BELOW_THRESHOLD, result.outcome());
        assertEquals(0, result.qualifyingCount());
    }

    @Test
    @DisplayName("A held lease skips the check without counting")
    void leaseHeld() {
        TestFixtures.seedQualifying(store, 60, 0.9);
        assertTrue(store.tryAcquireLease(TriggerScheduler.LEASE_NAME, "other-node", Duration.ofMinutes(5)));

        var result = scheduler.checkAndTrigger();

        assertEquals(TriggerResult.Outcome.SKIPPED_CONCURRENT, result.outcome());
        assertEquals(60, store.countQualifying(0.5));
        verify(provider, never()).submit(anyString(), anyList(), anyString(), any());
    }

    @Test
    @DisplayName("The lease is released after every check")
    void leaseReleased() {
        scheduler.checkAndTrigger();

        assertTrue(store.tryAcquireLease(TriggerScheduler.LEASE_NAME, "other-node", Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("A failed assembly is reported as triggered with the failed job and never submitted")
    void failedAssemblyNotSubmitted() {
        for (int i = 0; i < 50; i++) {
            TestFixtures.seedInvalid(store, "bad-" + i, Instant.EPOCH.plusSeconds(i));
        }

        var result = scheduler.checkAndTrigger();

        assertEquals(TriggerResult.Outcome.TRIGGERED, result.outcome());
        assertEquals(JobStatus.FAILED, result.job().status());
        verify(provider, never()).submit(anyString(), anyList(), anyString(), any());
    }

    @Test
    @DisplayName("Trigger outcomes are counted")
    void outcomeMetrics() {
        scheduler.checkAndTrigger();

        assertEquals(1.0, registry.find("sectune.trigger.checks")
                .tag("outcome", "BELOW_THRESHOLD").counter().count());
    }
}
