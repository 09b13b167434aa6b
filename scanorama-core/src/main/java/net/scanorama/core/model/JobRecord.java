package net.scanorama.core.model;

import java.time.Instant;
import java.util.UUID;

/** Durable row of a scheduled job. {@code configPayload} is the encoded {@link JobConfig}. */
public record JobRecord(
        UUID id,
        String name,
        JobType type,
        String cronExpr,
        String configPayload,
        boolean enabled,
        Instant lastRun,
        Instant nextRun,
        Instant createdAt,
        RunStatus lastRunStatus,
        Long lastRunDurationMs,
        int consecutiveFailures
) {
    public static JobRecord ofNew(UUID id, String name, JobType type, String cronExpr,
                                  String configPayload, Instant nextRun, Instant createdAt) {
        return new JobRecord(id, name, type, cronExpr, configPayload, true,
                null, nextRun, createdAt, null, null, 0);
    }

    /** Run bookkeeping after one execution. Failures accumulate until the next success. */
    public JobRecord withRun(Instant startedAt, Instant nextRun, RunStatus status, long durationMs) {
        int failures = status == RunStatus.SUCCESS ? 0 : consecutiveFailures + 1;
        return new JobRecord(id, name, type, cronExpr, configPayload, enabled,
                startedAt, nextRun, createdAt, status, durationMs, failures);
    }
}
