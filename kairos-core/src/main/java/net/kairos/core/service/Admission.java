package net.kairos.core.service;

public record Admission(boolean admitted, String reason) {

    private static final Admission ADMITTED = new Admission(true, null);

    public static Admission ok() {
        return ADMITTED;
    }

    public static Admission rejected(String reason) {
        return new Admission(false, reason);
    }
}
