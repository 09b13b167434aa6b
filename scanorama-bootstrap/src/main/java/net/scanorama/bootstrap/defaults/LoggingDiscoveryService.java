package net.scanorama.bootstrap.defaults;

import net.scanorama.core.model.CancellationSignal;
import net.scanorama.core.model.DiscoveryRequest;
import net.scanorama.core.spi.DiscoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stand-in until a discovery engine bean is provided: logs the request and finds nothing. */
public class LoggingDiscoveryService implements DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiscoveryService.class);

    @Override
    public void discover(CancellationSignal signal, DiscoveryRequest request) {
        log.info("Would discover {} (method={}, detectOs={}, timeout={}, concurrency={})",
                request.network(), request.method(), request.detectOs(), request.timeout(), request.concurrency());
    }
}
