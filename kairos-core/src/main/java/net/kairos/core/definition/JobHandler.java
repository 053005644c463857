package net.kairos.core.definition;

/**
 * User code bound to a job name. Runs on a worker thread; a thrown exception marks the run failed.
 */
@FunctionalInterface
public interface JobHandler {
    void handle(JobContext context) throws Exception;
}
