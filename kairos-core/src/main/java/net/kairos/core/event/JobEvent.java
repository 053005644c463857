package net.kairos.core.event;

public record JobEvent(
        String jobName,
        Long jobId,
        Kind kind,
        Throwable error      // set for FAILED only
) {
    public enum Kind { STARTED, SUCCEEDED, FAILED }

    public static JobEvent started(String jobName, Long jobId) {
        return new JobEvent(jobName, jobId, Kind.STARTED, null);
    }

    public static JobEvent succeeded(String jobName, Long jobId) {
        return new JobEvent(jobName, jobId, Kind.SUCCEEDED, null);
    }

    public static JobEvent failed(String jobName, Long jobId, Throwable error) {
        return new JobEvent(jobName, jobId, Kind.FAILED, error);
    }
}
