package in.fxledger.service.job;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * When a repeatable job fires.
 *
 * Fire times are wall-clock instants. Each firing is identified by its
 * scheduled time, not by the time the timer actually ran.
 */
public interface RepeatSchedule {

    /**
     * First fire time strictly after {@code time}.
     */
    Instant nextAfter(Instant time);

    /** Human readable form for logs and the admin API. */
    String describe();

    /**
     * Every {@code every}, aligned on multiples of the interval since the epoch.
     */
    static RepeatSchedule every(Duration every) {
        return new IntervalSchedule(every);
    }

    /**
     * Standard 5-field cron pattern ({@code minute hour day-of-month month day-of-week}),
     * evaluated in UTC.
     *
     * @throws IllegalArgumentException if the pattern does not parse
     */
    static RepeatSchedule cron(String pattern) {
        return new CronSchedule(pattern, ZoneOffset.UTC);
    }
}
