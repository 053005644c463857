package net.kairos.core.model;

/** NORMAL: one record per schedule call. SINGLE: one record per name, saved as an upsert. */
public enum JobType {
    NORMAL, SINGLE;

    public static JobType from(String s) {
        if (s == null) return NORMAL;
        try { return JobType.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return NORMAL; }
    }
    public String code() { return name(); }
}
