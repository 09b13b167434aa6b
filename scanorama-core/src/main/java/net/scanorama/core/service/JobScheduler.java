package net.scanorama.core.service;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.DiscoveryJobConfig;
import net.scanorama.core.model.JobConfig;
import net.scanorama.core.model.JobConfigException;
import net.scanorama.core.model.JobRecord;
import net.scanorama.core.model.JobSummary;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.service.SchedulerException.Reason;
import net.scanorama.core.spi.Clock;
import net.scanorama.core.spi.CronCalculator;
import net.scanorama.core.spi.JobConfigCodec;
import net.scanorama.core.spi.JobStore;
import net.scanorama.core.spi.TriggerDriver;
import net.scanorama.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the job registry and the trigger driver, and exposes the management API.
 *
 * <p>Every operation that touches both the store and the registry runs under the registry write
 * lock with the store call first, so a failed store call leaves the registry as it was.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobRegistry registry;
    private final JobExecutionEngine engine;
    private final TriggerDriver driver;
    private final JobStore store;
    private final JobConfigCodec codec;
    private final CronCalculator cron;
    private final TxRunner tx;
    private final Clock clock;
    private final ZoneId zone;

    private volatile CancellationSignal cancellation = new CancellationSignal();

    public JobScheduler(JobRegistry registry,
                        JobExecutionEngine engine,
                        TriggerDriver driver,
                        JobStore store,
                        JobConfigCodec codec,
                        CronCalculator cron,
                        TxRunner tx,
                        Clock clock,
                        ZoneId zone) {
        this.registry = registry;
        this.engine = engine;
        this.driver = driver;
        this.store = store;
        this.codec = codec;
        this.cron = cron;
        this.tx = tx;
        this.clock = clock;
        this.zone = zone;
    }

    // --- lifecycle ---

    public void start() throws SchedulerException {
        registry.write(() -> {
            if (registry.isSchedulerRunning()) {
                throw new SchedulerException(Reason.ALREADY_RUNNING, "scheduler is already running");
            }
            List<JobRecord> records;
            try {
                records = tx.required(store::findAll);
            } catch (Exception e) {
                throw new SchedulerException(Reason.FAILED_TO_LOAD_JOBS, "failed to load scheduled jobs", e);
            }

            // bodies from before the last stop may still be running; their claims carry over
            Map<UUID, JobRegistry.RunClaim> inFlight = new HashMap<>();
            for (RuntimeJobState leftover : registry.all()) {
                driver.deregister(leftover.handle());
                if (leftover.running()) inFlight.put(leftover.jobId(), leftover.claim());
            }
            registry.clear();
            cancellation = new CancellationSignal();

            for (JobRecord r : records) {
                decode(r).ifPresent(job -> register(job).claim(inFlight.get(job.id())));
            }
            driver.start();
            registry.schedulerRunning(true);
            log.info("Scheduler started with {} jobs", registry.size());
            return null;
        });
    }

    /** Cooperative: running bodies observe the cancelled signal, nothing is interrupted. */
    public void stop() {
        registry.write(() -> {
            if (!registry.isSchedulerRunning()) return null;
            driver.stop();
            cancellation.cancel();
            registry.schedulerRunning(false);
            log.info("Scheduler stopped");
            return null;
        });
    }

    public boolean isRunning() {
        return registry.read(registry::isSchedulerRunning);
    }

    // --- management ---

    public ScheduledJob addDiscoveryJob(String name, String cronExpr, DiscoveryJobConfig config) throws SchedulerException {
        return addJob(name, cronExpr, config);
    }

    public ScheduledJob addScanJob(String name, String cronExpr, ScanJobConfig config) throws SchedulerException {
        return addJob(name, cronExpr, config);
    }

    private ScheduledJob addJob(String name, String cronExpr, JobConfig config) throws SchedulerException {
        // validation first: nothing below runs for a bad request
        validateCron(cronExpr);
        if (name == null || name.isBlank()) {
            throw new SchedulerException(Reason.INVALID_JOB_CONFIG, "job name is required");
        }
        if (config == null) {
            throw new SchedulerException(Reason.INVALID_JOB_CONFIG, "job config is required");
        }
        String payload;
        try {
            config.validate();
            payload = codec.encode(config);
        } catch (JobConfigException e) {
            throw new SchedulerException(Reason.INVALID_JOB_CONFIG, e.getMessage(), e);
        }

        Instant now = clock.now();
        JobRecord record = JobRecord.ofNew(UUID.randomUUID(), name, config.type(), cronExpr,
                payload, cron.next(now, cronExpr, zone), now);

        return registry.write(() -> {
            try {
                tx.required(() -> { store.create(record); return null; });
            } catch (Exception e) {
                throw new SchedulerException(Reason.PERSISTENCE_FAILED, "failed to save scheduled job '" + name + "'", e);
            }
            ScheduledJob job = ScheduledJob.from(record, config);
            register(job);
            log.info("Added {} job '{}' with schedule '{}'", job.type().code(), name, cronExpr);
            return job;
        });
    }

    /**
     * A failed delete leaves the trigger deregistered but keeps the registry entry,
     * so the removal can be retried.
     */
    public void removeJob(UUID id) throws SchedulerException {
        registry.write(() -> {
            RuntimeJobState state = mustExist(id);
            driver.deregister(state.handle());
            try {
                tx.required(() -> { store.delete(id); return null; });
            } catch (Exception e) {
                throw new SchedulerException(Reason.PERSISTENCE_FAILED, "failed to delete job " + id, e);
            }
            registry.remove(id);
            log.info("Removed scheduled job '{}'", state.job().name());
            return null;
        });
    }

    public void enableJob(UUID id) throws SchedulerException {
        setEnabled(id, true);
    }

    public void disableJob(UUID id) throws SchedulerException {
        setEnabled(id, false);
    }

    /** Only the stored flag and the snapshot change; the trigger keeps firing and the engine gates on it. */
    private void setEnabled(UUID id, boolean enabled) throws SchedulerException {
        registry.write(() -> {
            RuntimeJobState state = mustExist(id);
            try {
                tx.required(() -> { store.setEnabled(id, enabled); return null; });
            } catch (Exception e) {
                throw new SchedulerException(Reason.PERSISTENCE_FAILED, "failed to update job status for " + id, e);
            }
            state.job(state.job().withEnabled(enabled));
            log.info("Job '{}' {}", state.job().name(), enabled ? "enabled" : "disabled");
            return null;
        });
    }

    /** Immediate firing through the same gate as a cron firing. false when the worker queue is full. */
    public boolean runNow(UUID id) throws SchedulerException {
        return registry.read(() -> {
            if (!registry.isSchedulerRunning()) {
                throw new SchedulerException(Reason.NOT_RUNNING, "scheduler is not running");
            }
            mustExist(id);
            CancellationSignal signal = cancellation;
            return driver.submit(() -> engine.execute(id, signal));
        });
    }

    // --- listing ---

    /** Never fails: a store outage yields an empty list. */
    public List<JobSummary> getJobs() {
        Instant now = clock.now();
        return registry.read(() -> {
            List<JobRecord> records;
            try {
                records = tx.required(store::findAll);
            } catch (Exception e) {
                log.warn("Failed to load jobs from store: {}", e.getMessage());
                return List.of();
            }
            List<JobSummary> out = new ArrayList<>(records.size());
            for (JobRecord r : records) out.add(summarize(r, now));
            return out;
        });
    }

    public Optional<JobSummary> getJob(UUID id) {
        Instant now = clock.now();
        return registry.read(() -> {
            try {
                return tx.required(() -> store.findById(id)).map(r -> summarize(r, now));
            } catch (Exception e) {
                log.warn("Failed to load job {} from store: {}", id, e.getMessage());
                return Optional.empty();
            }
        });
    }

    // --- internals ---

    private JobSummary summarize(JobRecord r, Instant now) {
        RuntimeJobState state = registry.lookup(r.id());
        return JobSummary.of(r, state != null && state.running(), nextRunOrNull(r.cronExpr(), now));
    }

    private RuntimeJobState register(ScheduledJob job) {
        UUID id = job.id();
        TriggerDriver.Handle handle = driver.register(job.cronExpr(), () -> engine.execute(id, cancellation));
        RuntimeJobState state = new RuntimeJobState(job, handle);
        registry.put(state);
        return state;
    }

    /** One corrupt row must not keep the other jobs from being scheduled. */
    private Optional<ScheduledJob> decode(JobRecord r) {
        try {
            cron.validate(r.cronExpr());
        } catch (RuntimeException e) {
            log.warn("Skipping job {} ('{}'): invalid cron expression '{}'", r.id(), r.name(), r.cronExpr());
            return Optional.empty();
        }
        try {
            return Optional.of(ScheduledJob.from(r, codec.decode(r.type(), r.configPayload())));
        } catch (JobConfigException e) {
            log.warn("Skipping job {} ('{}'): {}", r.id(), r.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private void validateCron(String cronExpr) throws SchedulerException {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new SchedulerException(Reason.INVALID_CRON_EXPRESSION, "cron expression is required");
        }
        try {
            cron.validate(cronExpr);
        } catch (RuntimeException e) {
            throw new SchedulerException(Reason.INVALID_CRON_EXPRESSION,
                    "invalid cron expression '" + cronExpr + "': " + e.getMessage(), e);
        }
    }

    private RuntimeJobState mustExist(UUID id) throws SchedulerException {
        RuntimeJobState state = registry.lookup(id);
        if (state == null) throw new SchedulerException(Reason.JOB_NOT_FOUND, "job not found: " + id);
        return state;
    }

    private Instant nextRunOrNull(String cronExpr, Instant now) {
        try {
            return cron.next(now, cronExpr, zone);
        } catch (RuntimeException e) {
            return null;
        }
    }
}
