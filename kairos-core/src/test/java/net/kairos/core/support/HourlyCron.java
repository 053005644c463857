package net.kairos.core.support;

import net.kairos.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/** Understands only {@code "0 * * * *"} (top of every hour); anything else is rejected like a bad cron. */
public final class HourlyCron implements CronCalculator {
    public static final String EXPR = "0 * * * *";

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        if (!EXPR.equals(cronExpr)) throw new IllegalArgumentException("invalid cron: " + cronExpr);
        return ZonedDateTime.ofInstant(from, zone).truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
    }
}
