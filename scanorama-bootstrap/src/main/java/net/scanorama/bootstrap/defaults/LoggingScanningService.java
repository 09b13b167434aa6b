package net.scanorama.bootstrap.defaults;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.ScanOptions;
import net.scanorama.core.model.ScanProfile;
import net.scanorama.core.spi.ScanningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stand-in until a scanner bean is provided. */
public class LoggingScanningService implements ScanningService {
    private static final Logger log = LoggerFactory.getLogger(LoggingScanningService.class);

    @Override
    public void scan(Host host, ScanProfile profile, ScanOptions options) {
        String ports = options.ports() != null ? options.ports() : profile.ports();
        log.info("Would scan host {} with profile {} (ports={})", host.ipAddress(), profile.id(), ports);
    }
}
