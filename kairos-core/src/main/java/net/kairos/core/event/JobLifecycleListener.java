package net.kairos.core.event;

@FunctionalInterface
public interface JobLifecycleListener {
    void onEvent(JobEvent event);
}
