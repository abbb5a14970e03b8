package io.agentkeep.checkpoint;

import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the age-based checkpoint retention as a JobRunr recurring job on startup.
 * Count-based retention happens on every save and does not depend on this job.
 */
@Service
public class CheckpointRetentionService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointRetentionService.class);
    static final String RETENTION_JOB_ID = "checkpoint-retention";

    private final JobScheduler jobScheduler;
    private final CheckpointRetentionJob retentionJob;
    private final boolean enabled;
    private final int days;
    private final String cron;

    public CheckpointRetentionService(JobScheduler jobScheduler, CheckpointRetentionJob retentionJob,
                                      @Value("${agentkeep.checkpoints.retention.enabled:true}") boolean enabled,
                                      @Value("${agentkeep.checkpoints.retention.days:30}") int days,
                                      @Value("${agentkeep.checkpoints.retention.cron:0 3 * * *}") String cron) {
        if (days <= 0) {
            throw new IllegalArgumentException("Retention days must be positive");
        }
        this.jobScheduler = jobScheduler;
        this.retentionJob = retentionJob;
        this.enabled = enabled;
        this.days = days;
        this.cron = cron;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Checkpoint retention disabled via configuration");
            jobScheduler.deleteRecurringJob(RETENTION_JOB_ID);
            return;
        }

        int retentionDays = days;
        jobScheduler.scheduleRecurrently(RETENTION_JOB_ID, cron, () -> retentionJob.execute(retentionDays));
        log.info("Checkpoint retention job registered: older than {} days, cron: {}", days, cron);
    }

    /**
     * Runs the retention pass immediately, outside the schedule.
     */
    public void triggerNow() {
        log.info("Triggering immediate checkpoint retention");
        retentionJob.execute(days);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getDays() {
        return days;
    }

    public String getCron() {
        return cron;
    }
}
