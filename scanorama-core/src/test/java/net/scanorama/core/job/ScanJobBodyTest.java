package net.scanorama.core.job;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.Host;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.RunStatus;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.model.ScanOptions;
import net.scanorama.core.model.ScheduledJob;
import net.scanorama.core.selection.HostSelector;
import net.scanorama.core.selection.ProfileResolver;
import net.scanorama.core.spi.ScanningService;
import net.scanorama.core.support.DirectTxRunner;
import net.scanorama.core.support.Hosts;
import net.scanorama.core.support.InMemoryHostInventory;
import net.scanorama.core.support.InMemoryProfileRepository;
import net.scanorama.core.support.MutableClock;
import net.scanorama.core.support.RecordingScanningService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

import static net.scanorama.core.support.InMemoryProfileRepository.profile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScanJobBodyTest {

    static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    InMemoryHostInventory inventory;
    InMemoryProfileRepository profiles;
    ExecutorService scanPool;

    @BeforeEach
    void setUp() {
        inventory = new InMemoryHostInventory();
        profiles = new InMemoryProfileRepository()
                .add(profile(InMemoryProfileRepository.DEFAULT_ID, 0))
                .add(profile("linux-basic", 10, "linux"));
        scanPool = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() {
        scanPool.shutdownNow();
    }

    ScanJobBody body(RecordingScanningService scanner, int batchSize) {
        var tx = new DirectTxRunner();
        return new ScanJobBody(new HostSelector(inventory, tx, new MutableClock(NOW)),
                new ProfileResolver(profiles, tx), scanner, scanPool, batchSize);
    }

    static ScheduledJob job(ScanJobConfig config) {
        return new ScheduledJob(UUID.randomUUID(), "weekly-scan", JobType.SCAN, "0 2 * * 0", config, true, null, null, NOW);
    }

    @Test
    void noHosts_isASuccessfulRun() throws Exception {
        var scanner = new RecordingScanningService();

        assertEquals(RunStatus.SUCCESS, body(scanner, 10).run(job(ScanJobConfig.allHosts()), new CancellationSignal()));
        assertTrue(scanner.calls().isEmpty());
    }

    @Test
    void hostsAreScannedInBoundedBatches() throws Exception {
        for (int i = 1; i <= 25; i++) inventory.add(Hosts.up("10.0.0." + i, "linux", NOW));
        var scanner = new RecordingScanningService(Set.of(), 20);

        RunStatus status = body(scanner, 10).run(job(ScanJobConfig.allHosts()), new CancellationSignal());

        assertEquals(RunStatus.SUCCESS, status);
        assertEquals(25, scanner.calls().size());
        assertThat(scanner.peakConcurrency()).isBetween(1, 10);
    }

    @Test
    void crashingHost_doesNotAbortTheRestOfItsBatch() throws Exception {
        for (int i = 1; i <= 4; i++) inventory.add(Hosts.up("10.0.0." + i, "linux", NOW));
        List<String> finished = new CopyOnWriteArrayList<>();
        ScanningService scanner = (host, profile, options) -> {
            if (host.ipAddress().equals("10.0.0.1")) throw new AssertionError("scanner bug");
            Thread.sleep(50);
            finished.add(host.ipAddress());
        };
        var tx = new DirectTxRunner();
        var body = new ScanJobBody(new HostSelector(inventory, tx, new MutableClock(NOW)),
                new ProfileResolver(profiles, tx), scanner, scanPool, 10);

        RunStatus status = body.run(job(ScanJobConfig.allHosts()), new CancellationSignal());

        assertEquals(RunStatus.SUCCESS, status);
        // the run returned only after the other hosts of the batch were done
        assertThat(finished).containsExactlyInAnyOrder("10.0.0.2", "10.0.0.3", "10.0.0.4");
    }

    @Test
    void failingHostsAndMissingProfiles_doNotFailTheRun() throws Exception {
        inventory.add(Hosts.up("10.0.0.1", "linux", NOW))
                .add(Hosts.up("10.0.0.2", "linux", NOW))
                .add(Hosts.up("10.0.0.3", null, NOW));
        var scanner = new RecordingScanningService(Set.of("10.0.0.2"), 0);

        // explicit profile that does not exist: every host is skipped
        var missingProfile = new ScanJobConfig(false, List.of(), List.of(), 0, "deleted-profile", null);
        assertEquals(RunStatus.SUCCESS, body(scanner, 2).run(job(missingProfile), new CancellationSignal()));
        assertTrue(scanner.calls().isEmpty());

        assertEquals(RunStatus.SUCCESS, body(scanner, 2).run(job(ScanJobConfig.allHosts()), new CancellationSignal()));
        assertEquals(3, scanner.calls().size());
    }

    @Test
    void resolvedProfileAndJobOptions_reachTheScanner() throws Exception {
        inventory.add(Hosts.up("10.0.0.1", "linux", NOW)).add(Hosts.up("10.0.0.9", null, NOW));
        var scanner = new RecordingScanningService();
        var options = new ScanOptions("1-1024", "syn", 30);

        body(scanner, 10).run(job(new ScanJobConfig(false, List.of(), List.of(), 0, "auto", options)), new CancellationSignal());

        assertThat(scanner.calls())
                .extracting(c -> c.host().ipAddress() + "=" + c.profile().id())
                .containsExactlyInAnyOrder("10.0.0.1=linux-basic", "10.0.0.9=" + InMemoryProfileRepository.DEFAULT_ID);
        assertThat(scanner.calls()).allMatch(c -> c.options().equals(options));
    }

    @Test
    void cancelledSignal_stopsBeforeTheNextBatch() throws Exception {
        for (int i = 1; i <= 5; i++) inventory.add(Hosts.up("10.0.0." + i, "linux", NOW));
        var scanner = new RecordingScanningService();
        var signal = new CancellationSignal();
        signal.cancel();

        assertEquals(RunStatus.CANCELLED, body(scanner, 2).run(job(ScanJobConfig.allHosts()), signal));
        assertTrue(scanner.calls().isEmpty());
    }

    @Test
    void partition_keepsOrderAndRemainder() {
        List<List<Host>> batches = ScanJobBody.partition(
                List.of(Hosts.up("10.0.0.1", null, NOW), Hosts.up("10.0.0.2", null, NOW), Hosts.up("10.0.0.3", null, NOW)), 2);

        assertEquals(2, batches.size());
        assertEquals("10.0.0.3", batches.get(1).get(0).ipAddress());
    }
}
