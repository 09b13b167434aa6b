package net.scanorama.core.service;

import net.scanorama.core.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Job id → runtime state, plus the scheduler running flag, behind one read-write lock.
 *
 * <p>{@link #read} / {@link #write} run a block under the lock; the unlocked accessors
 * ({@link #lookup}, {@link #put}, ...) may only be called from inside such a block.
 * {@link #tryBeginRun} / {@link #finishRun} take the write lock themselves.
 */
public final class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    @FunctionalInterface
    public interface LockedAction<T, E extends Exception> {
        T run() throws E;
    }

    /** One in-flight execution of a job. Matched by identity, so a stale run never releases a newer one. */
    public static final class RunClaim {
        private final ScheduledJob job;

        private RunClaim(ScheduledJob job) {
            this.job = job;
        }

        public ScheduledJob job() { return job; }
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<UUID, RuntimeJobState> jobs = new LinkedHashMap<>();
    private boolean schedulerRunning;

    public <T, E extends Exception> T read(LockedAction<T, E> action) throws E {
        lock.readLock().lock();
        try {
            return action.run();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T, E extends Exception> T write(LockedAction<T, E> action) throws E {
        lock.writeLock().lock();
        try {
            return action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- state transitions of one firing ---

    /** Checking phase: exists, enabled, not running → flip running on and hand out the job. */
    public Optional<RunClaim> tryBeginRun(UUID jobId) {
        return write(() -> {
            RuntimeJobState s = jobs.get(jobId);
            if (s == null) return Optional.empty();     // removed concurrently
            if (!s.job().enabled()) return Optional.empty();
            if (s.running()) {
                log.debug("Job '{}' is already running, skipping this firing", s.job().name());
                return Optional.empty();
            }
            RunClaim claim = new RunClaim(s.job());
            s.claim(claim);
            return Optional.of(claim);
        });
    }

    /**
     * Releases the claim if it is still the one held for the job.
     * false when the job was removed meanwhile.
     */
    public boolean finishRun(RunClaim claim) {
        return write(() -> {
            RuntimeJobState s = jobs.get(claim.job().id());
            if (s == null || s.claim() != claim) return false;
            s.claim(null);
            return true;
        });
    }

    public boolean isRunning(UUID jobId) {
        return read(() -> {
            RuntimeJobState s = jobs.get(jobId);
            return s != null && s.running();
        });
    }

    // --- unlocked accessors: caller holds the lock ---

    public RuntimeJobState lookup(UUID jobId) {
        checkHeld();
        return jobs.get(jobId);
    }

    public List<RuntimeJobState> all() {
        checkHeld();
        return new ArrayList<>(jobs.values());
    }

    public int size() {
        checkHeld();
        return jobs.size();
    }

    public boolean isSchedulerRunning() {
        checkHeld();
        return schedulerRunning;
    }

    void schedulerRunning(boolean running) {
        checkWriteHeld();
        this.schedulerRunning = running;
    }

    void put(RuntimeJobState state) {
        checkWriteHeld();
        jobs.put(state.jobId(), state);
    }

    RuntimeJobState remove(UUID jobId) {
        checkWriteHeld();
        return jobs.remove(jobId);
    }

    void clear() {
        checkWriteHeld();
        jobs.clear();
    }

    private void checkHeld() {
        if (!lock.isWriteLockedByCurrentThread() && lock.getReadHoldCount() == 0) {
            throw new IllegalStateException("registry lock not held");
        }
    }

    private void checkWriteHeld() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("registry write lock not held");
        }
    }
}
