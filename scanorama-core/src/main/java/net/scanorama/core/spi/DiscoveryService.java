package net.scanorama.core.spi;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.DiscoveryRequest;

/** Network discovery engine. Persists the hosts it finds on its own. */
public interface DiscoveryService {
    void discover(CancellationSignal signal, DiscoveryRequest request) throws Exception;
}
