package net.scanorama.core.model;

import java.time.Duration;
import java.util.List;

public record ScanJobConfig(
        boolean liveHostsOnly,
        List<String> networks,      // CIDR scopes, empty = every network
        List<String> osFamilies,    // empty = any family
        int maxAgeHours,            // 0 = no staleness bound
        String profileId,           // null / blank / "auto" = resolve per host
        ScanOptions options
) implements JobConfig {
    public static final String AUTO_PROFILE = "auto";

    public ScanJobConfig {
        networks = networks == null ? List.of() : List.copyOf(networks);
        osFamilies = osFamilies == null ? List.of() : List.copyOf(osFamilies);
        if (options == null) options = ScanOptions.defaults();
    }

    public static ScanJobConfig allHosts() {
        return new ScanJobConfig(false, List.of(), List.of(), 0, null, null);
    }

    @Override
    public JobType type() { return JobType.SCAN; }

    @Override
    public void validate() throws JobConfigException {
        if (maxAgeHours < 0) throw new JobConfigException("maxAgeHours must not be negative");
        if (options.timeoutSeconds() < 0) throw new JobConfigException("options.timeoutSeconds must not be negative");
        for (String n : networks) {
            if (n == null || n.isBlank()) throw new JobConfigException("networks must not contain blank entries");
        }
    }

    /** null when unbounded */
    public Duration maxAge() {
        return maxAgeHours > 0 ? Duration.ofHours(maxAgeHours) : null;
    }
}
