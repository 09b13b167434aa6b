package net.scanorama.core.model;

import java.time.Duration;

public record DiscoveryJobConfig(
        String network,         // CIDR, e.g. "10.0.0.0/8"
        String method,          // tcp / ping / arp
        boolean detectOs,
        int timeoutSeconds,
        int concurrency
) implements JobConfig {
    public static final String DEFAULT_METHOD = "tcp";
    public static final int DEFAULT_TIMEOUT_SECONDS = 3;
    public static final int DEFAULT_CONCURRENCY = 50;

    public DiscoveryJobConfig {
        if (method == null || method.isBlank()) method = DEFAULT_METHOD;
        if (timeoutSeconds <= 0) timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        if (concurrency <= 0) concurrency = DEFAULT_CONCURRENCY;
    }

    public static DiscoveryJobConfig ofNetwork(String network) {
        return new DiscoveryJobConfig(network, null, false, 0, 0);
    }

    @Override
    public JobType type() { return JobType.DISCOVERY; }

    @Override
    public void validate() throws JobConfigException {
        if (network == null || network.isBlank()) {
            throw new JobConfigException("discovery job requires a network");
        }
    }

    public Duration timeout() { return Duration.ofSeconds(timeoutSeconds); }
}
