package net.scanorama.core.spi;

/**
 * Cron driver. Each due trigger enqueues its task on a bounded worker pool; a firing that
 * cannot be queued is dropped.
 */
public interface TriggerDriver {
    /** Registrations made while stopped start firing on {@link #start()}. */
    Handle register(String cronExpr, Runnable task);

    /** Unknown or already removed handles are ignored. */
    void deregister(Handle handle);

    /** Enqueue a one-off execution. false when the worker queue rejected it. */
    boolean submit(Runnable task);

    void start();

    /** Stops firing and drops every registration. Running tasks are not interrupted. */
    void stop();

    record Handle(long id) {}
}
