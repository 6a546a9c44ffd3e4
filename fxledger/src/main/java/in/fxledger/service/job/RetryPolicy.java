package in.fxledger.service.job;

import java.time.Duration;

/**
 * Retry policy with exponential backoff for queued jobs.
 *
 * Immutable; the attempt count lives on the job. With the defaults a job is
 * attempted 3 times, waiting 60s and then 120s between attempts.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(60))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * if (policy.shouldRetry(job.attemptsMade())) {
 *     schedule(job, policy.delayAfter(job.attemptsMade()));
 * }
 * </pre>
 */
public final class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param attemptsMade attempts already made, including the one that just failed
     * @return true if another attempt is allowed
     */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay before the next attempt, after {@code attemptsMade} failed attempts.
     * initialDelay * multiplier^(attemptsMade - 1), capped at maxDelay.
     */
    public Duration delayAfter(int attemptsMade) {
        if (attemptsMade < 1) {
            throw new IllegalArgumentException("attemptsMade must be >= 1: " + attemptsMade);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attemptsMade - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy for crawl and import jobs: 3 attempts, 60s base delay doubling.
     */
    public static RetryPolicy forIngestionJobs() {
        return builder()
            .initialDelay(Duration.ofSeconds(60))
            .maxDelay(Duration.ofMinutes(30))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(60);
        private Duration maxDelay = Duration.ofMinutes(30);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("Initial delay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
