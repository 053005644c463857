package net.kairos.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** First occurrence strictly after {@code from}; IllegalArgumentException for an invalid expression. */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
