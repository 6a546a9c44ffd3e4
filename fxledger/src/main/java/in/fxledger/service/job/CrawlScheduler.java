package in.fxledger.service.job;

import in.fxledger.config.IngestConfig;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Enqueues crawl jobs for every configured target at a fixed interval.
 *
 * Ticks are aligned on interval slots and job ids are derived from the slot
 * the tick was scheduled for, so a tick that fires twice within one slot (or a
 * second scheduler process) adds nothing new, and a timer that runs slightly
 * early still files its jobs under the right slot.
 */
public final class CrawlScheduler {
    private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

    /**
     * One crawl target: a source plus the identifier and options of its jobs.
     */
    public record CrawlTarget(SourceKind source, String identifier, JobOptions options) {}

    private final QueueRegistry queues;
    private final List<CrawlTarget> targets;
    private final Duration interval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public CrawlScheduler(QueueRegistry queues, List<CrawlTarget> targets, Duration interval, Clock clock) {
        this.queues = queues;
        this.targets = List.copyOf(targets);
        this.interval = interval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crawl-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public static CrawlScheduler create(IngestConfig config, QueueRegistry queues) {
        return new CrawlScheduler(queues, targets(config), config.crawlInterval(), Clock.systemUTC());
    }

    /**
     * Crawl targets for the given configuration: the VCB sheet, each XE pair,
     * each Yahoo symbol and each Reuters symbol.
     */
    public static List<CrawlTarget> targets(IngestConfig config) {
        JobOptions base = JobOptions.empty().with(JobOptions.AUTO_IMPORT, config.autoImport());
        List<CrawlTarget> targets = new ArrayList<>();
        targets.add(new CrawlTarget(SourceKind.VCB, null, base));
        for (String pair : config.xePairs()) {
            String[] parts = pair.toUpperCase(Locale.ROOT).split("/");
            targets.add(new CrawlTarget(SourceKind.XE, parts[0] + parts[1], base
                .with(JobOptions.FROM_CURRENCY, parts[0])
                .with(JobOptions.TO_CURRENCY, parts[1])));
        }
        for (String symbol : config.yahooSymbols()) {
            targets.add(new CrawlTarget(SourceKind.YAHOO, symbol, base.with(JobOptions.SYMBOL, symbol)));
        }
        for (String symbol : config.reutersSymbols()) {
            targets.add(new CrawlTarget(SourceKind.REUTERS, symbol, base
                .with(JobOptions.SYMBOL, symbol)
                .with(JobOptions.XID, config.reutersXids().getOrDefault(symbol, ""))));
        }
        return targets;
    }

    public void start() {
        Instant now = clock.instant();
        log.info("Starting CrawlScheduler ({} target(s), every {}s)", targets.size(), interval.toSeconds());
        scheduler.execute(() -> tick(now));
        arm(nextSlot(now, now, interval));
    }

    /**
     * Enqueue one crawl job per target for the slot containing the current time.
     *
     * @return number of jobs actually added
     */
    public int tick() {
        return tick(clock.instant());
    }

    /**
     * Enqueue one crawl job per target for the slot containing {@code slotTime}.
     *
     * @return number of jobs actually added
     */
    public int tick(Instant slotTime) {
        int added = 0;
        for (CrawlTarget target : targets) {
            String jobId = JobIds.crawl(target.source(), target.identifier(), slotTime, interval);
            try {
                if (queues.crawlQueue(target.source()).add(jobId, target.options())) {
                    added++;
                }
            } catch (RuntimeException e) {
                // Continue with the other targets
                log.error("Failed to enqueue crawl job {}: {}", jobId, e.getMessage(), e);
            }
        }
        log.debug("Crawl tick: {} of {} job(s) added", added, targets.size());
        return added;
    }

    /**
     * Slot start following {@code fired}. When the scheduler fell more than a
     * slot behind {@code now}, missed slots are skipped.
     */
    static Instant nextSlot(Instant fired, Instant now, Duration interval) {
        long millis = interval.toMillis();
        long next = JobIds.slot(fired, interval) + millis;
        if (next + millis <= now.toEpochMilli()) {
            next = JobIds.slot(now, interval);
        }
        return Instant.ofEpochMilli(next);
    }

    private void arm(Instant slotStart) {
        long delay = Math.max(0, slotStart.toEpochMilli() - clock.millis());
        try {
            scheduler.schedule(() -> {
                try {
                    tick(slotStart);
                } finally {
                    arm(nextSlot(slotStart, clock.instant(), interval));
                }
            }, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("CrawlScheduler stopped, slot {} not scheduled", slotStart);
        }
    }

    public void stop() {
        log.info("Stopping CrawlScheduler...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            log.info("CrawlScheduler stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
