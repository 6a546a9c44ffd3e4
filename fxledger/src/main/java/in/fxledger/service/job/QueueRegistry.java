package in.fxledger.service.job;

import in.fxledger.config.IngestConfig;
import in.fxledger.domain.job.JobListener;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide set of queues: one crawl queue (WORKER_*) and one import queue
 * (IMPORTER_*) per source.
 *
 * Created once at startup and passed by reference to the scheduler, workers and
 * admin API. {@link #shutdown()} drains every queue.
 */
public final class QueueRegistry {
    private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

    private final Map<String, JobQueue> queues = new LinkedHashMap<>();
    private final ScheduledExecutorService timer;

    public QueueRegistry(RetryPolicy retryPolicy, Duration lockDuration, Clock clock, IngestionMetrics metrics) {
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-repeat-timer");
            t.setDaemon(true);
            return t;
        });
        for (SourceKind kind : SourceKind.values()) {
            register(new JobQueue(kind.crawlQueue(), retryPolicy, lockDuration, clock, timer, metrics));
            register(new JobQueue(kind.importQueue(), retryPolicy, lockDuration, clock, timer, metrics));
        }
        log.info("✓ Queue registry created: {}", queues.keySet());
    }

    public static QueueRegistry create(IngestConfig config, IngestionMetrics metrics) {
        RetryPolicy retryPolicy = RetryPolicy.builder()
            .initialDelay(config.jobBackoff())
            .maxDelay(config.jobBackoff().multipliedBy(32))
            .multiplier(2.0)
            .maxAttempts(config.jobAttempts())
            .build();
        return new QueueRegistry(retryPolicy, config.jobLock(), Clock.systemUTC(), metrics);
    }

    private void register(JobQueue queue) {
        queues.put(queue.name(), queue);
    }

    public JobQueue crawlQueue(SourceKind kind) {
        return queues.get(kind.crawlQueue());
    }

    public JobQueue importQueue(SourceKind kind) {
        return queues.get(kind.importQueue());
    }

    public Optional<JobQueue> find(String queueName) {
        return Optional.ofNullable(queues.get(queueName));
    }

    public Collection<JobQueue> all() {
        return Collections.unmodifiableCollection(queues.values());
    }

    /**
     * Attach a listener to every crawl queue.
     */
    public void addCrawlListener(JobListener listener) {
        for (SourceKind kind : SourceKind.values()) {
            crawlQueue(kind).addListener(listener);
        }
    }

    public void shutdown() {
        log.info("Stopping all queues...");
        List<JobQueue> all = new ArrayList<>(queues.values());
        for (JobQueue queue : all) {
            queue.shutdown();
        }
        timer.shutdown();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("All queues stopped");
    }
}
