package net.scanorama.core.job;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.DiscoveryJobConfig;
import net.scanorama.core.model.DiscoveryRequest;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.RunStatus;
import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.spi.DiscoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DiscoveryJobBody implements JobBody {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryJobBody.class);

    private final DiscoveryService discovery;

    public DiscoveryJobBody(DiscoveryService discovery) {
        this.discovery = discovery;
    }

    @Override
    public JobType type() { return JobType.DISCOVERY; }

    /** No retry here; a failed discovery waits for the next firing. */
    @Override
    public RunStatus run(ScheduledJob job, CancellationSignal signal) throws Exception {
        DiscoveryJobConfig config = (DiscoveryJobConfig) job.config();
        log.info("Executing discovery job '{}' for network {} (method={}, detectOs={})",
                job.name(), config.network(), config.method(), config.detectOs());

        discovery.discover(signal, DiscoveryRequest.from(config));

        if (signal.isCancelled()) {
            log.info("Discovery job '{}' returned after cancellation", job.name());
            return RunStatus.CANCELLED;
        }
        return RunStatus.SUCCESS;
    }
}
