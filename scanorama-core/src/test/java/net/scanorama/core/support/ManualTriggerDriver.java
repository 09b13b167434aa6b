package net.scanorama.core.support;

import net.scanorama.core.spi.TriggerDriver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Trigger driver the test fires by hand. {@link #fire} runs the task on the caller thread,
 * {@link #fireAsync} and {@link #submit} on a worker pool.
 */
public final class ManualTriggerDriver implements TriggerDriver {
    private final AtomicLong seq = new AtomicLong();
    private final Map<Handle, Runnable> tasks = new LinkedHashMap<>();
    private final Map<Handle, String> crons = new LinkedHashMap<>();
    private final ExecutorService workers = Executors.newCachedThreadPool();
    private volatile boolean started;
    private volatile boolean rejecting;

    @Override
    public synchronized Handle register(String cronExpr, Runnable task) {
        Handle h = new Handle(seq.incrementAndGet());
        tasks.put(h, task);
        crons.put(h, cronExpr);
        return h;
    }

    @Override
    public synchronized void deregister(Handle handle) {
        tasks.remove(handle);
        crons.remove(handle);
    }

    @Override
    public boolean submit(Runnable task) {
        if (rejecting) return false;
        workers.execute(task);
        return true;
    }

    @Override
    public void start() { started = true; }

    @Override
    public synchronized void stop() {
        started = false;
        tasks.clear();
        crons.clear();
    }

    public boolean started() { return started; }

    public void rejecting(boolean rejecting) { this.rejecting = rejecting; }

    public synchronized int registrations() { return tasks.size(); }

    public synchronized List<Handle> handles() { return List.copyOf(tasks.keySet()); }

    public synchronized String cronOf(Handle h) { return crons.get(h); }

    /** No-op for a handle that is no longer registered, like a cron entry that was removed. */
    public void fire(Handle h) {
        Runnable task;
        synchronized (this) { task = tasks.get(h); }
        if (task != null) task.run();
    }

    public void fireAsync(Handle h) {
        workers.execute(() -> fire(h));
    }

    public void shutdown() { workers.shutdownNow(); }
}
