package net.scanorama.core.spi;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.ScanOptions;
import net.scanorama.core.model.ScanProfile;

/** Port/service scanner. Persists its own results; one call per host. */
public interface ScanningService {
    void scan(Host host, ScanProfile profile, ScanOptions options) throws Exception;
}
