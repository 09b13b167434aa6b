package net.scanorama.bootstrap.lifecycle;

import net.scanorama.core.service.JobScheduler;
import net.scanorama.core.service.SchedulerException;
import org.springframework.context.SmartLifecycle;

/** Starts the scheduler after the context is refreshed, stops it before the executors shut down. */
public class SchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;

    public SchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        try {
            scheduler.start();
        } catch (SchedulerException e) {
            throw new IllegalStateException("Failed to start job scheduler: " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }
}
