package net.scanorama.core.support;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.scanorama.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

/** 5-field cron through cron-utils, same dialect the Spring module wires in. */
public final class UnixCronCalculator implements CronCalculator {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        var et = ExecutionTime.forCron(PARSER.parse(cronExpr));
        return et.nextExecution(from.atZone(zone))
                .orElseThrow(() -> new IllegalArgumentException("no next execution for " + cronExpr))
                .toInstant();
    }
}
