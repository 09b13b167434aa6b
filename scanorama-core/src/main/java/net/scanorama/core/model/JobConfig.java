package net.scanorama.core.model;

/**
 * Type specific payload of a scheduled job.
 * Stored as an opaque blob, decoded once into {@link DiscoveryJobConfig} or {@link ScanJobConfig}.
 */
public interface JobConfig {
    JobType type();

    /** Rejects configs that can never run. Called before a job is persisted. */
    void validate() throws JobConfigException;
}
