package net.scanorama.core.model;

public enum JobType {
    DISCOVERY, SCAN, UNKNOWN;

    public static JobType from(String s) {
        if (s == null) return UNKNOWN;
        try { return JobType.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name().toLowerCase(); }
}
