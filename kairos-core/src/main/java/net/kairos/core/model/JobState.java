package net.kairos.core.model;

/** Run state derived from the bookkeeping fields of a {@link JobRecord}. */
public enum JobState {
    NEVER_RAN, RUNNING, SUCCEEDED, FAILED
}
