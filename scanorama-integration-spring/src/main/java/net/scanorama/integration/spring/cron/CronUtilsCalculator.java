package net.scanorama.integration.spring.cron;

import net.scanorama.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

/** Core SPI on top of {@link CronSlotPlanner}. */
public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.next(cronExpr, zone, from);
    }

    @Override
    public void validate(String cronExpr) {
        CronSlotPlanner.validate(cronExpr);
    }
}
