package net.scanorama.core.job;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.Host;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.RunStatus;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.model.ScanProfile;
import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.selection.HostSelector;
import net.scanorama.core.selection.ProfileResolver;
import net.scanorama.core.service.SchedulerException;
import net.scanorama.core.spi.ScanningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Select hosts → scan them in fixed-size batches. Hosts of one batch run in parallel on the
 * scan executor; the next batch starts when the previous one is done. A host that fails or has
 * no usable profile is logged and skipped, the run still counts as a success.
 */
public final class ScanJobBody implements JobBody {
    private static final Logger log = LoggerFactory.getLogger(ScanJobBody.class);

    public static final int DEFAULT_BATCH_SIZE = 10;

    enum HostOutcome { SCANNED, FAILED, SKIPPED }

    private final HostSelector hostSelector;
    private final ProfileResolver profileResolver;
    private final ScanningService scanner;
    private final Executor scanExecutor;
    private final int batchSize;

    public ScanJobBody(HostSelector hostSelector,
                       ProfileResolver profileResolver,
                       ScanningService scanner,
                       Executor scanExecutor,
                       int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        this.hostSelector = hostSelector;
        this.profileResolver = profileResolver;
        this.scanner = scanner;
        this.scanExecutor = scanExecutor;
        this.batchSize = batchSize;
    }

    @Override
    public JobType type() { return JobType.SCAN; }

    @Override
    public RunStatus run(ScheduledJob job, CancellationSignal signal) throws Exception {
        ScanJobConfig config = (ScanJobConfig) job.config();
        log.info("Executing scan job '{}'", job.name());

        List<Host> hosts = hostSelector.select(config);
        if (hosts.isEmpty()) {
            log.info("Scan job '{}' found no hosts to scan", job.name());
            return RunStatus.SUCCESS;
        }
        log.info("Scan job '{}' found {} hosts to scan", job.name(), hosts.size());

        Map<HostOutcome, Integer> tally = new EnumMap<>(HostOutcome.class);
        int done = 0;
        for (List<Host> batch : partition(hosts, batchSize)) {
            if (signal.isCancelled()) {
                log.info("Scan job '{}' cancelled after {} of {} hosts", job.name(), done, hosts.size());
                return RunStatus.CANCELLED;
            }
            List<CompletableFuture<HostOutcome>> inFlight = new ArrayList<>(batch.size());
            for (Host host : batch) {
                inFlight.add(CompletableFuture.supplyAsync(() -> scanHost(job, config, host), scanExecutor));
            }
            // every host of the batch is awaited, a crashed one counts as failed
            for (int i = 0; i < inFlight.size(); i++) {
                tally.merge(outcome(job, batch.get(i), inFlight.get(i)), 1, Integer::sum);
                done++;
            }
        }

        log.info("Scan job '{}' completed: {} scanned, {} failed, {} skipped", job.name(),
                tally.getOrDefault(HostOutcome.SCANNED, 0),
                tally.getOrDefault(HostOutcome.FAILED, 0),
                tally.getOrDefault(HostOutcome.SKIPPED, 0));
        return RunStatus.SUCCESS;
    }

    private static HostOutcome outcome(ScheduledJob job, Host host, CompletableFuture<HostOutcome> scan) {
        try {
            return scan.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Scan job '{}' crashed on host {}", job.name(), host.ipAddress(), cause);
            return HostOutcome.FAILED;
        }
    }

    private HostOutcome scanHost(ScheduledJob job, ScanJobConfig config, Host host) {
        ScanProfile profile;
        try {
            profile = profileResolver.resolve(host, config.profileId());
        } catch (SchedulerException e) {
            log.warn("Scan job '{}' skipping host {}: {}", job.name(), host.ipAddress(), e.getMessage());
            return HostOutcome.SKIPPED;
        }
        try {
            scanner.scan(host, profile, config.options());
            log.debug("Scanned host {} with profile {}", host.ipAddress(), profile.id());
            return HostOutcome.SCANNED;
        } catch (Exception e) {
            log.warn("Scan job '{}' failed to scan host {} with profile {}: {}",
                    job.name(), host.ipAddress(), profile.id(), e.getMessage());
            return HostOutcome.FAILED;
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            batches.add(items.subList(from, Math.min(from + size, items.size())));
        }
        return batches;
    }
}
