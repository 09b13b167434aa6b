package net.scanorama.core.model;

import java.time.Instant;
import java.util.UUID;

/** A job with its config decoded; what the registry and the job bodies work with. */
public record ScheduledJob(
        UUID id,
        String name,
        JobType type,
        String cronExpr,
        JobConfig config,
        boolean enabled,
        Instant lastRun,
        Instant nextRun,
        Instant createdAt
) {
    public static ScheduledJob from(JobRecord r, JobConfig config) {
        return new ScheduledJob(r.id(), r.name(), r.type(), r.cronExpr(), config,
                r.enabled(), r.lastRun(), r.nextRun(), r.createdAt());
    }

    public ScheduledJob withEnabled(boolean enabled) {
        return new ScheduledJob(id, name, type, cronExpr, config, enabled, lastRun, nextRun, createdAt);
    }
}
