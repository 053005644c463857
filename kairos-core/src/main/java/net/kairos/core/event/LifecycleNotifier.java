package net.kairos.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Fans an event out to the registered listeners; a failing listener never affects the job. */
public final class LifecycleNotifier {
    private static final Logger log = LoggerFactory.getLogger(LifecycleNotifier.class);

    private final List<JobLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public void add(JobLifecycleListener listener) {
        listeners.add(listener);
    }

    public void remove(JobLifecycleListener listener) {
        listeners.remove(listener);
    }

    public void fire(JobEvent event) {
        for (JobLifecycleListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed on {} for job '{}' (id={})",
                        event.kind(), event.jobName(), event.jobId(), e);
            }
        }
    }
}
