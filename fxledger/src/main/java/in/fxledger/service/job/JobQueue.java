package in.fxledger.service.job;

import in.fxledger.domain.common.IngestException;
import in.fxledger.domain.common.TerminalTaskFailureException;
import in.fxledger.domain.job.Job;
import in.fxledger.domain.job.JobHandler;
import in.fxledger.domain.job.JobListener;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.job.JobSnapshot;
import in.fxledger.domain.job.JobStatus;
import in.fxledger.domain.job.QueueCounts;
import in.fxledger.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * In-process job queue with single-flight execution.
 *
 * Semantics:
 * - Job ids are unique within the queue: adding an id that is already held
 *   (waiting, delayed, running or failed) is a no-op.
 * - One dispatcher thread runs at most one attempt at a time; delayed retries
 *   go through the same dispatcher.
 * - Each attempt is bounded by the lock duration. An attempt that exceeds it is
 *   interrupted and counts as failed. The next attempt starts only once the
 *   interrupted one has returned, so its lock duration is never spent waiting.
 * - Failed attempts are retried per {@link RetryPolicy}. Once the budget is spent
 *   the job stays in the queue as FAILED_TERMINAL until removed or cleared.
 * - Succeeded jobs are removed from the queue.
 *
 * Jobs added before {@link #start(JobHandler)} wait until a worker is attached.
 */
public final class JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final String name;
    private final RetryPolicy retryPolicy;
    private final Duration lockDuration;
    private final Clock clock;
    private final ScheduledExecutorService timer;
    private final IngestionMetrics metrics;

    private final ScheduledThreadPoolExecutor dispatcher;
    private final ExecutorService runner;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, Repeatable> repeatables = new ConcurrentHashMap<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();

    private volatile JobHandler handler;
    private volatile boolean closed;
    // Set when a timed-out attempt was cancelled; touched by the dispatcher thread only
    private boolean attemptAbandoned;

    /**
     * @param timer shared timer for repeatable jobs; not owned by this queue
     */
    public JobQueue(String name, RetryPolicy retryPolicy, Duration lockDuration,
                    Clock clock, ScheduledExecutorService timer, IngestionMetrics metrics) {
        this.name = name;
        this.retryPolicy = retryPolicy;
        this.lockDuration = lockDuration;
        this.clock = clock;
        this.timer = timer;
        this.metrics = metrics;

        this.dispatcher = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "queue-" + name + "-dispatcher");
            t.setDaemon(true);
            return t;
        });
        // Pending retries are dropped on shutdown, not awaited
        this.dispatcher.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.dispatcher.setRemoveOnCancelPolicy(true);

        this.runner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "queue-" + name + "-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public String name() {
        return name;
    }

    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    /**
     * Add a job.
     *
     * @return true if added, false if a job with this id is already held
     */
    public boolean add(String jobId, JobOptions options) {
        if (closed) {
            throw new IllegalStateException("Queue " + name + " is shut down");
        }
        Job job = new Job(jobId, name, options, clock.instant());
        Job existing = jobs.putIfAbsent(jobId, job);
        if (existing != null) {
            log.debug("[{}] Job {} already held ({}), not added", name, jobId, existing.status());
            return false;
        }
        synchronized (this) {
            job.markEnqueued();
            if (handler != null) {
                dispatch(job, Duration.ZERO);
            }
        }
        log.info("[{}] Enqueued job {}", name, jobId);
        publishDepth();
        return true;
    }

    /**
     * Attach the worker. Jobs already waiting are dispatched in arrival order.
     */
    public synchronized void start(JobHandler handler) {
        if (this.handler != null) {
            throw new IllegalStateException("Queue " + name + " already has a worker");
        }
        this.handler = handler;
        List<Job> waiting = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.status() == JobStatus.ENQUEUED) {
                waiting.add(job);
            }
        }
        waiting.sort(Comparator.comparing(Job::createdAt));
        waiting.forEach(job -> dispatch(job, Duration.ZERO));
        log.info("✓ [{}] Worker started (concurrency 1, {} waiting job(s))", name, waiting.size());
    }

    public boolean isStarted() {
        return handler != null;
    }

    /**
     * Register a job that is added every {@code every}, aligned on interval slots.
     */
    public void addRepeatable(String repeatName, JobOptions options, Duration every) {
        addRepeatable(repeatName, options, RepeatSchedule.every(every));
    }

    /**
     * Register a job that is added at each fire time of {@code schedule}. Each
     * firing gets the id {@code repeat:<name>:<scheduled fire millis>}.
     * Registering an existing name replaces it.
     */
    public void addRepeatable(String repeatName, JobOptions options, RepeatSchedule schedule) {
        Repeatable repeatable = new Repeatable(repeatName, options, schedule);
        Repeatable previous = repeatables.put(repeatName, repeatable);
        if (previous != null) {
            previous.cancel();
        }
        arm(repeatable, schedule.nextAfter(clock.instant()));
        log.info("[{}] Repeatable job {} registered ({})", name, repeatName, schedule.describe());
    }

    public boolean removeRepeatable(String repeatName) {
        Repeatable repeatable = repeatables.remove(repeatName);
        if (repeatable == null) return false;
        repeatable.cancel();
        log.info("[{}] Repeatable job {} removed", name, repeatName);
        return true;
    }

    public Set<String> repeatableNames() {
        return new TreeSet<>(repeatables.keySet());
    }

    /**
     * Repeatable names mapped to their schedule description.
     */
    public Map<String, String> repeatableSchedules() {
        Map<String, String> schedules = new TreeMap<>();
        repeatables.forEach((repeatName, repeatable) -> schedules.put(repeatName, repeatable.schedule.describe()));
        return schedules;
    }

    /**
     * Remove one job. A running job cannot be removed.
     *
     * @return false if no such job
     * @throws IllegalStateException if the job is running
     */
    public boolean remove(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) return false;
        if (job.status() == JobStatus.RUNNING) {
            throw new IllegalStateException("Job " + jobId + " is running");
        }
        boolean removed = jobs.remove(jobId, job);
        if (removed) {
            log.info("[{}] Removed job {}", name, jobId);
            publishDepth();
        }
        return removed;
    }

    /**
     * Drop every job and repeatable registration. A running attempt finishes
     * but is neither retried nor kept.
     *
     * @return number of jobs dropped
     */
    public int clear() {
        new ArrayList<>(repeatables.keySet()).forEach(this::removeRepeatable);
        int count = jobs.size();
        jobs.clear();
        log.info("[{}] Cleared {} job(s)", name, count);
        publishDepth();
        return count;
    }

    public Optional<Job> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<JobSnapshot> jobs() {
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (Job job : jobs.values()) {
            snapshots.add(job.snapshot());
        }
        snapshots.sort(Comparator.comparing(JobSnapshot::createdAt));
        return snapshots;
    }

    public QueueCounts counts() {
        int waiting = 0, active = 0, delayed = 0, failed = 0;
        for (Job job : jobs.values()) {
            switch (job.status()) {
                case ENQUEUED, SCHEDULED -> waiting++;
                case RUNNING -> active++;
                case FAILED_RETRYING -> delayed++;
                case FAILED_TERMINAL -> failed++;
                default -> { }
            }
        }
        return new QueueCounts(name, waiting, active, delayed, failed, repeatables.size());
    }

    /**
     * Stop dispatching. Waits for a running attempt up to 30s, then interrupts it.
     * Delayed retries are dropped.
     */
    public void shutdown() {
        closed = true;
        new ArrayList<>(repeatables.keySet()).forEach(this::removeRepeatable);
        log.info("[{}] Stopping queue...", name);
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        runner.shutdownNow();
        log.info("[{}] Queue stopped", name);
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    private void dispatch(Job job, Duration delay) {
        try {
            dispatcher.schedule(() -> runAttempt(job), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Job {} not dispatched, queue is shutting down", name, job.id());
        }
    }

    private void runAttempt(Job job) {
        // Removed, cleared or replaced since it was dispatched
        if (jobs.get(job.id()) != job) return;
        JobStatus status = job.status();
        if (status != JobStatus.ENQUEUED && status != JobStatus.FAILED_RETRYING) return;
        if (!awaitAbandonedAttempt(job)) return;

        job.markRunning(clock.instant());
        publishDepth();
        log.info("[{}] Running job {} (attempt {}/{})", name, job.id(), job.attemptsMade(), retryPolicy.getMaxAttempts());

        Future<Object> future;
        try {
            future = runner.submit(() -> handler.handle(job));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Job {} not started, queue is shutting down", name, job.id());
            job.markEnqueued();
            return;
        }

        try {
            Object result = future.get(lockDuration.toMillis(), TimeUnit.MILLISECONDS);
            onSuccess(job, result);
        } catch (TimeoutException e) {
            future.cancel(true);
            attemptAbandoned = true;
            onFailure(job, new IngestException("attempt exceeded lock duration of " + lockDuration.toMillis() + "ms"));
        } catch (ExecutionException e) {
            onFailure(job, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            job.markEnqueued();
            log.warn("[{}] Job {} interrupted by shutdown", name, job.id());
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Block until an attempt abandoned after its lock duration has returned.
     * The runner is single-threaded, so an empty task completes only after it.
     *
     * @return false if the queue is shutting down
     */
    private boolean awaitAbandonedAttempt(Job job) {
        if (!attemptAbandoned) return true;
        log.warn("[{}] Job {} waiting for an abandoned attempt to return", name, job.id());
        try {
            runner.submit(() -> { }).get();
            attemptAbandoned = false;
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Job {} not started, queue is shutting down", name, job.id());
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Empty task failed", e);
        } catch (InterruptedException e) {
            log.warn("[{}] Job {} interrupted by shutdown", name, job.id());
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void onSuccess(Job job, Object result) {
        job.markSucceeded(clock.instant(), result);
        jobs.remove(job.id(), job);
        metrics.recordJob(name, JobStatus.SUCCEEDED.name(), job.lastAttemptDuration());
        log.info("✓ [{}] Job {} completed in {}ms", name, job.id(), job.lastAttemptDuration().toMillis());
        publishDepth();

        for (JobListener listener : listeners) {
            try {
                listener.onCompleted(job, result);
            } catch (RuntimeException e) {
                log.error("[{}] Completion listener failed for job {}: {}", name, job.id(), e.getMessage(), e);
            }
        }
    }

    private void onFailure(Job job, Throwable error) {
        Instant now = clock.instant();
        int attempts = job.attemptsMade();
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        boolean willRetry = retryPolicy.shouldRetry(attempts);

        if (willRetry) {
            Duration delay = retryPolicy.delayAfter(attempts);
            job.markRetrying(now, now.plus(delay), message);
            metrics.recordJob(name, JobStatus.FAILED_RETRYING.name(), job.lastAttemptDuration());
            log.warn("[{}] Job {} attempt {}/{} failed: {} (retry in {}ms)",
                name, job.id(), attempts, retryPolicy.getMaxAttempts(), message, delay.toMillis());
            if (jobs.get(job.id()) == job) {
                dispatch(job, delay);
            }
        } else {
            job.markTerminal(now, message);
            metrics.recordJob(name, JobStatus.FAILED_TERMINAL.name(), job.lastAttemptDuration());
            log.error("[{}] Job {} failed terminally after {} attempt(s): {}", name, job.id(), attempts, message, error);
        }
        publishDepth();

        TerminalTaskFailureException terminal = willRetry
            ? null
            : new TerminalTaskFailureException(name, job.id(), attempts, error);
        for (JobListener listener : listeners) {
            try {
                listener.onFailed(job, error, willRetry);
                if (terminal != null) {
                    listener.onTerminalFailure(job, terminal);
                }
            } catch (RuntimeException e) {
                log.error("[{}] Failure listener failed for job {}: {}", name, job.id(), e.getMessage(), e);
            }
        }
    }

    private void arm(Repeatable repeatable, Instant fireAt) {
        long delay = Math.max(0, fireAt.toEpochMilli() - clock.millis());
        synchronized (repeatable) {
            if (repeatable.cancelled) return;
            try {
                repeatable.future = timer.schedule(() -> fireRepeatable(repeatable, fireAt), delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("[{}] Repeatable job {} not scheduled, timer is shut down", name, repeatable.name);
            }
        }
    }

    private void fireRepeatable(Repeatable repeatable, Instant fireAt) {
        if (repeatable.cancelled) return;
        try {
            add(JobIds.repeatable(repeatable.name, fireAt.toEpochMilli()), repeatable.options);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to add repeatable job {}: {}", name, repeatable.name, e.getMessage(), e);
        }

        Instant now = clock.instant();
        Instant next;
        try {
            next = repeatable.schedule.nextAfter(fireAt);
            if (next.isBefore(now)) {
                // Missed fire times are skipped, not replayed
                log.warn("[{}] Repeatable job {} fell behind, skipping to the next fire time", name, repeatable.name);
                next = repeatable.schedule.nextAfter(now);
            }
        } catch (IllegalStateException e) {
            log.error("[{}] Repeatable job {} has no further fire time: {}", name, repeatable.name, e.getMessage());
            repeatables.remove(repeatable.name, repeatable);
            return;
        }
        arm(repeatable, next);
    }

    private void publishDepth() {
        QueueCounts counts = counts();
        metrics.setQueueDepth(name, "waiting", counts.waiting());
        metrics.setQueueDepth(name, "active", counts.active());
        metrics.setQueueDepth(name, "delayed", counts.delayed());
        metrics.setQueueDepth(name, "failed", counts.failed());
    }

    private static final class Repeatable {
        private final String name;
        private final JobOptions options;
        private final RepeatSchedule schedule;
        private volatile boolean cancelled;
        private ScheduledFuture<?> future;

        Repeatable(String name, JobOptions options, RepeatSchedule schedule) {
            this.name = name;
            this.options = options;
            this.schedule = schedule;
        }

        synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
