package net.scanorama.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** 5-field (minute hour day-of-month month day-of-week) cron on cron-utils, parsed schedules cached LRU. */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** First fire time strictly after {@code from}, evaluated in {@code zone}. */
    public static Instant next(String cronExpr, ZoneId zone, Instant from) {
        return nextExecution(cronExpr, zone, from)
                .orElseThrow(() -> new IllegalArgumentException("No next execution for [" + cronExpr + "] after " + from));
    }

    /** Empty when the schedule has no slot after {@code from}, e.g. February 30th. */
    public static Optional<Instant> nextExecution(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(zone); Objects.requireNonNull(from);
        return executionTime(cronExpr).nextExecution(from.atZone(zone)).map(ZonedDateTime::toInstant);
    }

    /** IllegalArgumentException for anything cron-utils cannot parse or that never fires. */
    public static void validate(String cronExpr) {
        if (nextExecution(cronExpr, ZoneOffset.UTC, Instant.now()).isEmpty()) {
            throw new IllegalArgumentException("Cron expression [" + cronExpr + "] never fires");
        }
    }

    static ExecutionTime executionTime(String cronExpr) {
        Objects.requireNonNull(cronExpr);
        synchronized (CACHE) {
            ExecutionTime et = CACHE.get(cronExpr);
            if (et != null) return et;
        }
        // parse outside the lock; a bad expression is never cached
        ExecutionTime parsed = ExecutionTime.forCron(PARSER.parse(cronExpr.trim()));
        synchronized (CACHE) {
            CACHE.put(cronExpr, parsed);
        }
        return parsed;
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    // --- LRU ---
    private static final class LruMap<K,V> extends LinkedHashMap<K,V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K,V> eldest) { return size() > max; }
    }
}
