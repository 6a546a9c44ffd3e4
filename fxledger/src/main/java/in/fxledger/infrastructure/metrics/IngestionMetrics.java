package in.fxledger.infrastructure.metrics;

import java.time.Duration;

/**
 * Pipeline metrics.
 */
public interface IngestionMetrics {

    /**
     * Record a committed ingestion run.
     */
    void recordIngestion(String source, int upserted, int deduplicated, int skipped);

    /**
     * Record the end of one job attempt.
     *
     * @param status SUCCEEDED, FAILED_RETRYING or FAILED_TERMINAL
     */
    void recordJob(String queue, String status, Duration duration);

    void setQueueDepth(String queue, String state, int depth);

    /**
     * No-op implementation for tests and tools.
     */
    IngestionMetrics NOOP = new IngestionMetrics() {
        @Override
        public void recordIngestion(String source, int upserted, int deduplicated, int skipped) {}

        @Override
        public void recordJob(String queue, String status, Duration duration) {}

        @Override
        public void setQueueDepth(String queue, String state, int depth) {}
    };
}
