package net.scanorama.core.service;

import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.spi.TriggerDriver;

import java.util.UUID;

/** In-memory state of one registered job. Mutated only under the {@link JobRegistry} write lock. */
public final class RuntimeJobState {
    private final TriggerDriver.Handle handle;
    private ScheduledJob job;
    private JobRegistry.RunClaim claim;  // null when idle

    RuntimeJobState(ScheduledJob job, TriggerDriver.Handle handle) {
        this.job = job;
        this.handle = handle;
    }

    public UUID jobId() { return job.id(); }
    public ScheduledJob job() { return job; }
    public TriggerDriver.Handle handle() { return handle; }
    public boolean running() { return claim != null; }

    void job(ScheduledJob job) { this.job = job; }
    JobRegistry.RunClaim claim() { return claim; }
    void claim(JobRegistry.RunClaim claim) { this.claim = claim; }
}
