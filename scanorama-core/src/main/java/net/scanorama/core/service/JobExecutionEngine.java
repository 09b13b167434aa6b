package net.scanorama.core.service;

import net.scanorama.core.job.JobBody;
import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.JobRecord;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.RunStatus;
import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.spi.Clock;
import net.scanorama.core.spi.CronCalculator;
import net.scanorama.core.spi.JobStore;
import net.scanorama.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one firing of a job: gate on the registry, run the body outside the lock, always clear
 * the running flag, then record the outcome. Nothing thrown by a body leaves {@link #execute}.
 */
public final class JobExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(JobExecutionEngine.class);

    private final JobRegistry registry;
    private final Map<JobType, JobBody> bodies = new EnumMap<>(JobType.class);
    private final JobStore store;
    private final TxRunner tx;
    private final CronCalculator cron;
    private final Clock clock;
    private final ZoneId zone;

    public JobExecutionEngine(JobRegistry registry,
                              List<JobBody> bodies,
                              JobStore store,
                              TxRunner tx,
                              CronCalculator cron,
                              Clock clock,
                              ZoneId zone) {
        this.registry = registry;
        for (JobBody b : bodies) this.bodies.put(b.type(), b);
        this.store = store;
        this.tx = tx;
        this.cron = cron;
        this.clock = clock;
        this.zone = zone;
    }

    public void execute(UUID jobId, CancellationSignal signal) {
        // 1) Checking: gone / disabled / busy → nothing to do
        Optional<JobRegistry.RunClaim> claimed = registry.tryBeginRun(jobId);
        if (claimed.isEmpty()) return;

        // 2) Running: body outside the lock
        JobRegistry.RunClaim claim = claimed.get();
        ScheduledJob job = claim.job();
        Instant startedAt = clock.now();
        RunStatus status = RunStatus.FAILED;
        try {
            JobBody body = bodies.get(job.type());
            if (body == null) throw new IllegalStateException("no job body for type " + job.type());
            status = body.run(job, signal);
            log.info("{} job '{}' finished: {}", job.type().code(), job.name(), status.code());
        } catch (RuntimeException | Error crash) {
            log.error("Recovered from crash in {} job {} ('{}')", job.type().code(), job.id(), job.name(), crash);
        } catch (Exception e) {
            log.warn("{} job '{}' failed: {}", job.type().code(), job.name(), e.getMessage(), e);
        } finally {
            // 3) back to Idle on every path
            finish(claim, startedAt, status);
        }
    }

    private void finish(JobRegistry.RunClaim claim, Instant startedAt, RunStatus status) {
        ScheduledJob job = claim.job();
        if (!registry.finishRun(claim)) {
            log.info("Job {} was removed while running, skipping run bookkeeping", job.id());
            return;
        }
        long durationMs = Duration.between(startedAt, clock.now()).toMillis();
        Instant nextRun = nextRun(job);
        try {
            tx.required(() -> {
                Optional<JobRecord> stored = store.findById(job.id());
                if (stored.isEmpty()) return null;  // deleted meanwhile, never resurrect
                store.update(stored.get().withRun(startedAt, nextRun, status, durationMs));
                return null;
            });
        } catch (Exception e) {
            log.warn("Failed to update last run time for job {}: {}", job.id(), e.getMessage());
        }
    }

    private Instant nextRun(ScheduledJob job) {
        try {
            return cron.next(clock.now(), job.cronExpr(), zone);
        } catch (RuntimeException e) {
            return null;
        }
    }
}
