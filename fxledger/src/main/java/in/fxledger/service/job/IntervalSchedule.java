package in.fxledger.service.job;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed interval, fire times on multiples of the interval since the epoch.
 */
public final class IntervalSchedule implements RepeatSchedule {

    private final long everyMillis;

    public IntervalSchedule(Duration every) {
        if (every == null || every.isNegative() || every.isZero()) {
            throw new IllegalArgumentException("Repeat interval must be positive: " + every);
        }
        this.everyMillis = every.toMillis();
    }

    @Override
    public Instant nextAfter(Instant time) {
        return Instant.ofEpochMilli(Math.floorDiv(time.toEpochMilli(), everyMillis) * everyMillis + everyMillis);
    }

    @Override
    public String describe() {
        return "every " + everyMillis + "ms";
    }

    public long everyMillis() {
        return everyMillis;
    }
}
