package net.scanorama.bootstrap.catalog;

import net.scanorama.bootstrap.props.ScanoramaProperties;
import net.scanorama.core.model.DiscoveryJobConfig;
import net.scanorama.core.model.JobRecord;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.service.JobScheduler;
import net.scanorama.core.spi.JobStore;
import net.scanorama.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Seeds the jobs listed under {@code scanorama.catalog.jobs}. A job whose name is already
 * stored is left alone, so edits made at runtime survive restarts.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobScheduler scheduler;
    private final JobStore store;
    private final TxRunner tx;

    public CatalogRegistrar(JobScheduler scheduler, JobStore store, TxRunner tx) {
        this.scheduler = scheduler;
        this.store = store;
        this.tx = tx;
    }

    /** @return number of jobs added */
    public int register(ScanoramaProperties.Catalog catalog) throws Exception {
        List<JobRecord> stored = tx.required(store::findAll);
        Set<String> known = new HashSet<>();
        for (JobRecord r : stored) known.add(r.name());

        int added = 0;
        for (var def : catalog.getJobs()) {
            if (def.getName() == null || def.getCronExpr() == null) {
                throw new IllegalArgumentException("catalog job name and cronExpr are required: " + def);
            }
            if (!known.add(def.getName())) {
                log.debug("Catalog job '{}' already stored, skipping", def.getName());
                continue;
            }
            ScheduledJob job = add(def);
            if (!def.isEnabled()) scheduler.disableJob(job.id());
            added++;
        }
        log.info("Catalog registered: {} of {} jobs added", added, catalog.getJobs().size());
        return added;
    }

    private ScheduledJob add(ScanoramaProperties.JobDef def) throws Exception {
        JobType type = JobType.from(def.getType());
        if (type == JobType.DISCOVERY) {
            return scheduler.addDiscoveryJob(def.getName(), def.getCronExpr(), new DiscoveryJobConfig(
                    def.getNetwork(), def.getMethod(), def.isDetectOs(), def.getTimeoutSeconds(), def.getConcurrency()));
        }
        if (type == JobType.SCAN) {
            return scheduler.addScanJob(def.getName(), def.getCronExpr(), new ScanJobConfig(
                    def.isLiveHostsOnly(), def.getNetworks(), def.getOsFamilies(), def.getMaxAgeHours(),
                    def.getProfileId(), null));
        }
        throw new IllegalArgumentException("Unknown job type '" + def.getType() + "' for catalog job " + def.getName());
    }
}
