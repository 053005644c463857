package net.kairos.core.model;

public enum FailureKind {
    /** no handler registered for the job name at dispatch time; not retried */
    NO_SUCH_DEFINITION,
    /** the handler threw */
    HANDLER_FAILURE,
    /** the handler did not finish within the definition's timeout */
    HANDLER_TIMEOUT
}
