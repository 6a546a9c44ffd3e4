package in.fxledger.service.job;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Unix cron pattern, e.g. {@code 0 0 * * 1-5} for midnight on weekdays.
 */
public final class CronSchedule implements RepeatSchedule {

    private static final CronParser PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String pattern;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    public CronSchedule(String pattern, ZoneId zone) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Cron pattern must not be blank");
        }
        Cron cron;
        try {
            cron = PARSER.parse(pattern.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron pattern '" + pattern + "': " + e.getMessage(), e);
        }
        this.pattern = pattern.trim();
        this.zone = zone;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    @Override
    public Instant nextAfter(Instant time) {
        ZonedDateTime after = time.atZone(zone);
        return executionTime.nextExecution(after)
            .map(ZonedDateTime::toInstant)
            .orElseThrow(() -> new IllegalStateException("Cron pattern '" + pattern + "' has no execution after " + time));
    }

    @Override
    public String describe() {
        return "cron " + pattern;
    }

    public String pattern() {
        return pattern;
    }
}
