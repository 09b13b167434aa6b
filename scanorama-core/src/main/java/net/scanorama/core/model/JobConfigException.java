package net.scanorama.core.model;

public class JobConfigException extends Exception {
    public JobConfigException(String message) {
        super(message);
    }

    public JobConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
