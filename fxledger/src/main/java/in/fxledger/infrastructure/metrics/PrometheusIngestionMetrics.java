package in.fxledger.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of IngestionMetrics.
 *
 * Key Metrics:
 * - fx_ticks_upserted_total{source}
 * - fx_ticks_deduplicated_total{source}
 * - fx_samples_skipped_total{source}
 * - fx_jobs_total{queue, status}
 * - fx_job_duration_seconds{queue}
 * - fx_queue_depth{queue, state}
 */
public class PrometheusIngestionMetrics implements IngestionMetrics {

    private final CollectorRegistry registry;

    private final Counter ticksUpserted;
    private final Counter ticksDeduplicated;
    private final Counter samplesSkipped;
    private final Counter jobs;
    private final Histogram jobDuration;
    private final Gauge queueDepth;

    public PrometheusIngestionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusIngestionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ticksUpserted = Counter.build()
            .name("fx_ticks_upserted_total")
            .help("Ticks written to fx_ticks")
            .labelNames("source")
            .register(registry);

        this.ticksDeduplicated = Counter.build()
            .name("fx_ticks_deduplicated_total")
            .help("Candidates collapsed onto a duplicate key within a run")
            .labelNames("source")
            .register(registry);

        this.samplesSkipped = Counter.build()
            .name("fx_samples_skipped_total")
            .help("Source samples dropped by normalizers")
            .labelNames("source")
            .register(registry);

        this.jobs = Counter.build()
            .name("fx_jobs_total")
            .help("Job attempts by outcome")
            .labelNames("queue", "status")
            .register(registry);

        this.jobDuration = Histogram.build()
            .name("fx_job_duration_seconds")
            .help("Job attempt duration in seconds")
            .labelNames("queue")
            .buckets(0.05, 0.1, 0.5, 1.0, 5.0, 10.0, 30.0, 60.0, 300.0)
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("fx_queue_depth")
            .help("Jobs held by a queue by state")
            .labelNames("queue", "state")
            .register(registry);
    }

    @Override
    public void recordIngestion(String source, int upserted, int deduplicated, int skipped) {
        ticksUpserted.labels(source).inc(upserted);
        ticksDeduplicated.labels(source).inc(deduplicated);
        samplesSkipped.labels(source).inc(skipped);
    }

    @Override
    public void recordJob(String queue, String status, Duration duration) {
        jobs.labels(queue, status).inc();
        jobDuration.labels(queue).observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void setQueueDepth(String queue, String state, int depth) {
        queueDepth.labels(queue, state).set(depth);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
