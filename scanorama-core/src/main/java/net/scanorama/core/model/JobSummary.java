package net.scanorama.core.model;

import java.time.Instant;
import java.util.UUID;

/** Listing view of a job: stored state plus the in-memory running flag and a fresh next run. */
public record JobSummary(
        UUID id,
        String name,
        JobType type,
        String cronExpr,
        boolean enabled,
        boolean running,
        Instant lastRun,
        Instant nextRun,
        RunStatus lastRunStatus,
        Long lastRunDurationMs,
        int consecutiveFailures,
        Instant createdAt
) {
    public static JobSummary of(JobRecord r, boolean running, Instant nextRun) {
        return new JobSummary(r.id(), r.name(), r.type(), r.cronExpr(), r.enabled(), running,
                r.lastRun(), nextRun, r.lastRunStatus(), r.lastRunDurationMs(),
                r.consecutiveFailures(), r.createdAt());
    }
}
