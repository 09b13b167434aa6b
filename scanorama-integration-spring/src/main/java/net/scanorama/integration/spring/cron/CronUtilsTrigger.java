package net.scanorama.integration.spring.cron;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Spring {@link Trigger} for the 5-field dialect. Spring's own CronTrigger wants a seconds
 * field, stored expressions do not have one.
 */
public final class CronUtilsTrigger implements Trigger {
    private final String cronExpr;
    private final ZoneId zone;

    public CronUtilsTrigger(String cronExpr, ZoneId zone) {
        CronSlotPlanner.validate(cronExpr);
        this.cronExpr = cronExpr;
        this.zone = zone;
    }

    @Override
    public Instant nextExecution(TriggerContext ctx) {
        Instant base = ctx.lastCompletion();
        if (base != null) {
            Instant scheduled = ctx.lastScheduledExecution();
            if (scheduled != null && base.isBefore(scheduled)) base = scheduled;
        } else {
            base = ctx.getClock().instant();
        }
        // null ends the schedule
        return CronSlotPlanner.nextExecution(cronExpr, zone, base).orElse(null);
    }

    @Override
    public String toString() { return cronExpr + " [" + zone + "]"; }
}
