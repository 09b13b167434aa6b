package net.scanorama.core.selection;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.HostSelectionFilter;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.spi.Clock;
import net.scanorama.core.spi.HostInventory;
import net.scanorama.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Turns a scan job's config into a host filter and runs it against the inventory. */
public final class HostSelector {
    private final HostInventory inventory;
    private final TxRunner tx;
    private final Clock clock;

    public HostSelector(HostInventory inventory, TxRunner tx, Clock clock) {
        this.inventory = inventory;
        this.tx = tx;
        this.clock = clock;
    }

    public HostSelectionFilter filterFor(ScanJobConfig config) {
        Duration maxAge = config.maxAge();
        Instant seenSince = maxAge == null ? null : clock.now().minus(maxAge);
        return new HostSelectionFilter(config.liveHostsOnly(), config.networks(), config.osFamilies(), seenSince);
    }

    public List<Host> select(ScanJobConfig config) throws Exception {
        HostSelectionFilter filter = filterFor(config);
        return tx.required(() -> inventory.findHosts(filter));
    }
}
