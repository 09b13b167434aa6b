package net.scanorama.core.selection;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.HostSelectionFilter;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.support.DirectTxRunner;
import net.scanorama.core.support.Hosts;
import net.scanorama.core.support.InMemoryHostInventory;
import net.scanorama.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HostSelectorTest {

    static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    MutableClock clock;
    InMemoryHostInventory inventory;
    HostSelector selector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        inventory = new InMemoryHostInventory();
        selector = new HostSelector(inventory, new DirectTxRunner(), clock);
    }

    @Test
    void liveOnlyWithMaxAge_dropsStaleHosts() throws Exception {
        Host fresh = Hosts.up("10.0.0.1", "linux", NOW.minus(Duration.ofHours(2)));
        Host stale = Hosts.up("10.0.0.2", "linux", NOW.minus(Duration.ofHours(48)));
        inventory.add(fresh).add(stale);

        var config = new ScanJobConfig(true, List.of(), List.of(), 24, null, null);
        List<Host> selected = selector.select(config);

        assertEquals(List.of(fresh), selected);
        assertEquals(NOW.minus(Duration.ofHours(24)), inventory.lastFilter().seenSince());
    }

    @Test
    void emptyConfig_selectsEveryHost_mostRecentFirst() throws Exception {
        Host older = Hosts.down("192.168.1.10", NOW.minus(Duration.ofDays(30)));
        Host newer = Hosts.up("10.1.2.3", "windows", NOW.minus(Duration.ofMinutes(5)));
        inventory.add(older).add(newer);

        assertEquals(List.of(newer, older), selector.select(ScanJobConfig.allHosts()));
        assertTrue(inventory.lastFilter().unrestricted());
    }

    @Test
    void networksAndOsFamilies_areConjunctive() throws Exception {
        inventory.add(Hosts.up("10.0.0.1", "linux", NOW))
                .add(Hosts.up("10.0.0.2", "windows", NOW))
                .add(Hosts.up("172.16.0.1", "linux", NOW))
                .add(Hosts.up("192.168.0.1", "linux", NOW));

        var config = new ScanJobConfig(false, List.of("10.0.0.0/24", "172.16.0.0/12"), List.of("linux"), 0, null, null);

        assertThat(selector.select(config))
                .extracting(Host::ipAddress)
                .containsExactlyInAnyOrder("10.0.0.1", "172.16.0.1");
    }

    @Test
    void filterFor_withoutMaxAge_hasNoStalenessBound() {
        HostSelectionFilter f = selector.filterFor(new ScanJobConfig(true, List.of("10.0.0.0/8"), List.of(), 0, "auto", null));

        assertNull(f.seenSince());
        assertTrue(f.liveOnly());
        assertEquals(List.of("10.0.0.0/8"), f.networks());
    }
}
