package net.scanorama.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public interface CronCalculator {
    /** First fire time strictly after {@code from}. IllegalArgumentException on a malformed expression. */
    Instant next(Instant from, String cronExpr, ZoneId zone);

    /** IllegalArgumentException when the expression does not parse to a schedule. */
    default void validate(String cronExpr) {
        next(Instant.EPOCH, cronExpr, ZoneOffset.UTC);
    }
}
