package net.scanorama.core.service;

/** Management-API and profile resolution failures. Execution-time failures are never thrown as this. */
public class SchedulerException extends Exception {
    public enum Reason {
        INVALID_CRON_EXPRESSION,
        INVALID_JOB_CONFIG,
        ALREADY_RUNNING,
        NOT_RUNNING,
        JOB_NOT_FOUND,
        PERSISTENCE_FAILED,
        FAILED_TO_LOAD_JOBS,
        PROFILE_NOT_FOUND,
        NO_PROFILE_AVAILABLE
    }

    private final Reason reason;

    public SchedulerException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SchedulerException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
