package net.kairos.core.definition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Job name to definition lookup shared by the lock manager, admission and dispatch. */
public final class JobDefinitionRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobDefinitionRegistry.class);

    private final ConcurrentMap<String, JobDefinition> definitions = new ConcurrentHashMap<>();
    private final Duration defaultLockLifetime;

    public JobDefinitionRegistry(Duration defaultLockLifetime) {
        this.defaultLockLifetime = defaultLockLifetime;
    }

    public void define(JobDefinition definition) {
        JobDefinition previous = definitions.put(definition.name(), definition);
        if (previous != null) {
            log.info("Job definition replaced: name='{}'", definition.name());
        } else {
            log.debug("Job defined: name='{}' concurrency={} timeout={}",
                    definition.name(), definition.concurrency(), definition.timeout());
        }
    }

    public Optional<JobDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(definitions.keySet());
    }

    public Duration lockLifetimeFor(String name) {
        JobDefinition d = definitions.get(name);
        return d == null || d.lockLifetime() == null ? defaultLockLifetime : d.lockLifetime();
    }

    /** Shortest lifetime in effect; the scan query uses it so that no expired lock is missed. */
    public Duration shortestLockLifetime() {
        Duration shortest = defaultLockLifetime;
        for (JobDefinition d : definitions.values()) {
            if (d.lockLifetime() != null && d.lockLifetime().compareTo(shortest) < 0) shortest = d.lockLifetime();
        }
        return shortest;
    }

    /** Longest lifetime in effect; maintenance only clears locks older than this. */
    public Duration longestLockLifetime() {
        Duration longest = defaultLockLifetime;
        for (JobDefinition d : definitions.values()) {
            if (d.lockLifetime() != null && d.lockLifetime().compareTo(longest) > 0) longest = d.lockLifetime();
        }
        return longest;
    }
}
