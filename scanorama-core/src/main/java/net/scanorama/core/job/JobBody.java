package net.scanorama.core.job;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.RunStatus;
import net.scanorama.core.model.ScheduledJob;

/** Executable logic bound to one job type. */
public interface JobBody {
    JobType type();

    /**
     * Runs one execution. Returns {@link RunStatus#SUCCESS} or {@link RunStatus#CANCELLED};
     * any thrown exception is recorded as a failure by the engine.
     */
    RunStatus run(ScheduledJob job, CancellationSignal signal) throws Exception;
}
