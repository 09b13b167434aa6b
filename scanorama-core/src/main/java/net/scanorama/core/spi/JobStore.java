package net.scanorama.core.spi;

import net.scanorama.core.model.JobRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Durable scheduled_jobs rows. Implementations may require an active {@link TxRunner} transaction. */
public interface JobStore {
    void create(JobRecord job) throws Exception;

    List<JobRecord> findAll() throws Exception;

    Optional<JobRecord> findById(UUID id) throws Exception;

    /** Definition and run bookkeeping columns. The enabled flag is only written by {@link #setEnabled}. */
    void update(JobRecord job) throws Exception;

    /** Deleting a row that is already gone is not an error. */
    void delete(UUID id) throws Exception;

    void setEnabled(UUID id, boolean enabled) throws Exception;
}
