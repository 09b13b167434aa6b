package net.scanorama.core.model;

import java.time.Duration;

public record DiscoveryRequest(
        String network,
        String method,
        boolean detectOs,
        Duration timeout,
        int concurrency
) {
    public static DiscoveryRequest from(DiscoveryJobConfig c) {
        return new DiscoveryRequest(c.network(), c.method(), c.detectOs(), c.timeout(), c.concurrency());
    }
}
