package net.kairos.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parses and evaluates cron expressions with cron-utils. Five fields are read as Unix cron,
 * six or seven as Quartz (seconds first, optional year). Parsed expressions are kept in a small LRU.
 */
public final class CronExpressions {
    private CronExpressions() {}

    private static final CronParser UNIX =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser QUARTZ =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));
    private static final CronParser SPRING =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private static final int CACHE_SIZE = 256;
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(CACHE_SIZE);

    /** First occurrence strictly after {@code from}. IllegalArgumentException when the expression is invalid or exhausted. */
    public static Instant next(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(from);

        var base = from.atZone(zone);
        return executionTime(cronExpr).nextExecution(base)
                .orElseThrow(() -> new IllegalArgumentException("No next execution for [" + cronExpr + "] after " + base))
                .toInstant();
    }

    static ExecutionTime executionTime(String cronExpr) {
        String key = cronExpr.trim();
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(key);
            if (cached != null) return cached;
        }
        ExecutionTime parsed = ExecutionTime.forCron(parse(key));
        synchronized (CACHE) {
            CACHE.put(key, parsed);
        }
        return parsed;
    }

    private static com.cronutils.model.Cron parse(String expr) {
        int fields = expr.split("\\s+").length;
        if (fields == 5) return UNIX.parse(expr).validate();
        if (fields == 6 || fields == 7) {
            try {
                return QUARTZ.parse(expr).validate();
            } catch (IllegalArgumentException quartzRejected) {
                // Quartz wants '?' in one of the day fields; accept "0 0 12 * * *" the way Spring does
                if (fields == 7) throw quartzRejected;
                return SPRING.parse(expr).validate();
            }
        }
        throw new IllegalArgumentException("Cron expression must have 5, 6 or 7 fields: [" + expr + "]");
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    static int cached() { synchronized (CACHE) { return CACHE.size(); } }

    // --- LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
