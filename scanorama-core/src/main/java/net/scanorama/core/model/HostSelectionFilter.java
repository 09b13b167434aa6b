package net.scanorama.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Conjunctive host predicates of one scan run. An empty filter selects every known host.
 *
 * @param liveOnly   only hosts with status up
 * @param networks   CIDR scopes, a host matches if it lies in any of them; empty = unrestricted
 * @param osFamilies empty = any family
 * @param seenSince  lower bound for last_seen; null = unbounded
 */
public record HostSelectionFilter(
        boolean liveOnly,
        List<String> networks,
        List<String> osFamilies,
        Instant seenSince
) {
    public HostSelectionFilter {
        networks = networks == null ? List.of() : List.copyOf(networks);
        osFamilies = osFamilies == null ? List.of() : List.copyOf(osFamilies);
    }

    public static HostSelectionFilter all() {
        return new HostSelectionFilter(false, List.of(), List.of(), null);
    }

    public boolean unrestricted() {
        return !liveOnly && networks.isEmpty() && osFamilies.isEmpty() && seenSince == null;
    }
}
