package net.scanorama.core.model;

/** Outcome of one execution of a job body. */
public enum RunStatus {
    SUCCESS, FAILED, CANCELLED, UNKNOWN;

    public static RunStatus from(String s) {
        if (s == null) return null;
        try { return RunStatus.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name().toLowerCase(); }
}
