package io.agentkeep.checkpoint;

import io.agentkeep.service.AgentMemoryService;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recurring JobRunr job that deletes checkpoints past the retention age in every project.
 */
@Component
public class CheckpointRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(CheckpointRetentionJob.class);

    private final AgentMemoryService memoryService;

    public CheckpointRetentionJob(AgentMemoryService memoryService) {
        this.memoryService = memoryService;
    }

    @Job(name = "Prune checkpoints older than %0 days")
    public void execute(int days) {
        int deleted = memoryService.pruneCheckpointsByAge(days);
        log.info("Checkpoint retention finished: {} checkpoints older than {} days deleted", deleted, days);
    }
}
