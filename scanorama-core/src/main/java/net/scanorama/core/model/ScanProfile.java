package net.scanorama.core.model;

import java.util.List;

/** Read-only scan parameter bundle, owned by profile management. */
public record ScanProfile(
        String id,
        String name,
        String description,
        List<String> osFamilies,
        String ports,
        String scanType,
        String timing,
        int priority,
        boolean builtIn
) {
    public ScanProfile {
        osFamilies = osFamilies == null ? List.of() : List.copyOf(osFamilies);
    }
}
