package net.scanorama.integration.spring.sched;

import net.scanorama.core.spi.TriggerDriver;
import net.scanorama.integration.spring.cron.CronUtilsTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Cron driver on Spring's {@link TaskScheduler}. The scheduler thread only enqueues: each due
 * trigger hands its task to the bounded worker executor, and a firing the executor rejects is
 * dropped with a warning.
 */
public final class TaskSchedulerTriggerDriver implements TriggerDriver {
    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerTriggerDriver.class);

    private static final class Registration {
        final String cronExpr;
        final Runnable task;
        ScheduledFuture<?> future;

        Registration(String cronExpr, Runnable task) {
            this.cronExpr = cronExpr;
            this.task = task;
        }
    }

    private final TaskScheduler scheduler;
    private final TaskExecutor workers;
    private final Function<String, Trigger> triggers;
    private final AtomicLong seq = new AtomicLong();
    private final Map<Handle, Registration> registrations = new LinkedHashMap<>();
    private boolean started;

    public TaskSchedulerTriggerDriver(TaskScheduler scheduler, TaskExecutor workers, ZoneId zone) {
        this(scheduler, workers, expr -> new CronUtilsTrigger(expr, zone));
    }

    public TaskSchedulerTriggerDriver(TaskScheduler scheduler, TaskExecutor workers, Function<String, Trigger> triggers) {
        this.scheduler = scheduler;
        this.workers = workers;
        this.triggers = triggers;
    }

    @Override
    public synchronized Handle register(String cronExpr, Runnable task) {
        Handle handle = new Handle(seq.incrementAndGet());
        Registration r = new Registration(cronExpr, task);
        registrations.put(handle, r);
        if (started) schedule(handle, r);
        return handle;
    }

    @Override
    public synchronized void deregister(Handle handle) {
        Registration r = registrations.remove(handle);
        if (r != null && r.future != null) r.future.cancel(false);
    }

    @Override
    public boolean submit(Runnable task) {
        try {
            workers.execute(task);
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Worker queue full, rejecting immediate run: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void start() {
        if (started) return;
        started = true;
        registrations.forEach(this::schedule);
        log.info("Trigger driver started with {} registrations", registrations.size());
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            registrations.clear();
            return;
        }
        started = false;
        for (Registration r : registrations.values()) {
            if (r.future != null) r.future.cancel(false);
        }
        registrations.clear();
        log.info("Trigger driver stopped");
    }

    public synchronized int registrations() { return registrations.size(); }

    private void schedule(Handle handle, Registration r) {
        r.future = scheduler.schedule(() -> enqueue(handle, r), triggers.apply(r.cronExpr));
    }

    private void enqueue(Handle handle, Registration r) {
        try {
            workers.execute(r.task);
        } catch (TaskRejectedException e) {
            log.warn("Worker queue full, dropping firing of trigger {} ({})", handle.id(), r.cronExpr);
        }
    }
}
