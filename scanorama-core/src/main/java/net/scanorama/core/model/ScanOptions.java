package net.scanorama.core.model;

/**
 * Per-job overrides handed to the scanning service together with the resolved profile.
 * Null / zero fields mean "use the profile's value".
 */
public record ScanOptions(
        String ports,
        String scanType,
        int timeoutSeconds
) {
    public static ScanOptions defaults() {
        return new ScanOptions(null, null, 0);
    }
}
