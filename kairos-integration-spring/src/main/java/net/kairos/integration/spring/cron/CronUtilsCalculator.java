package net.kairos.integration.spring.cron;

import net.kairos.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronExpressions.next(cronExpr, zone, from);
    }
}
