package io.agentkeep.checkpoint;

import io.agentkeep.service.AgentMemoryService;
import org.jobrunr.jobs.lambdas.JobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CheckpointRetentionServiceTest {

    private JobScheduler jobScheduler;
    private AgentMemoryService memoryService;
    private CheckpointRetentionJob retentionJob;

    @BeforeEach
    void setUp() {
        jobScheduler = mock(JobScheduler.class);
        memoryService = mock(AgentMemoryService.class);
        retentionJob = new CheckpointRetentionJob(memoryService);
    }

    @Test
    void shouldRegisterRecurringJobOnStart() {
        var service = new CheckpointRetentionService(jobScheduler, retentionJob, true, 30, "0 3 * * *");

        service.start();

        verify(jobScheduler).scheduleRecurrently(eq("checkpoint-retention"), eq("0 3 * * *"), any(JobLambda.class));
    }

    @Test
    void shouldRemoveRecurringJobWhenDisabled() {
        var service = new CheckpointRetentionService(jobScheduler, retentionJob, false, 30, "0 3 * * *");

        service.start();

        verify(jobScheduler).deleteRecurringJob("checkpoint-retention");
        verify(jobScheduler, never()).scheduleRecurrently(anyString(), anyString(), any(JobLambda.class));
        assertFalse(service.isEnabled());
    }

    @Test
    void shouldPruneImmediatelyOnTrigger() {
        when(memoryService.pruneCheckpointsByAge(14)).thenReturn(3);
        var service = new CheckpointRetentionService(jobScheduler, retentionJob, true, 14, "0 * * * *");

        service.triggerNow();

        verify(memoryService).pruneCheckpointsByAge(14);
    }

    @Test
    void shouldRejectNonPositiveRetentionDays() {
        assertThrows(IllegalArgumentException.class,
                () -> new CheckpointRetentionService(jobScheduler, retentionJob, true, 0, "0 3 * * *"));
    }
}
