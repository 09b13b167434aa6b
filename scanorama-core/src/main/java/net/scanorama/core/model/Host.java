package net.scanorama.core.model;

import java.time.Instant;
import java.util.UUID;

public record Host(
        UUID id,
        String ipAddress,
        String hostname,
        String osFamily,    // null when OS detection never ran
        Status status,
        Instant lastSeen
) {
    public enum Status {
        UP, DOWN, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name().toLowerCase(); }
    }

    public boolean hasOsFamily() {
        return osFamily != null && !osFamily.isBlank();
    }
}
