package in.fxledger.domain.job;

import java.time.Duration;
import java.time.Instant;

/**
 * A job held by a queue. State is mutated only by the owning queue.
 */
public final class Job {

    private final String id;
    private final String queue;
    private final JobOptions options;
    private final Instant createdAt;

    private JobStatus status = JobStatus.SCHEDULED;
    private int attemptsMade;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant nextRunAt;
    private String lastError;
    private Object result;

    public Job(String id, String queue, JobOptions options, Instant createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Job id is required");
        }
        this.id = id;
        this.queue = queue;
        this.options = options == null ? JobOptions.empty() : options;
        this.createdAt = createdAt;
    }

    public String id() {
        return id;
    }

    public String queue() {
        return queue;
    }

    public JobOptions options() {
        return options;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized JobStatus status() {
        return status;
    }

    public synchronized int attemptsMade() {
        return attemptsMade;
    }

    public synchronized String lastError() {
        return lastError;
    }

    public synchronized Object result() {
        return result;
    }

    public synchronized Instant nextRunAt() {
        return nextRunAt;
    }

    /** Duration of the last attempt, zero if none finished yet. */
    public synchronized Duration lastAttemptDuration() {
        if (startedAt == null || finishedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, finishedAt);
    }

    public synchronized void markEnqueued() {
        status = JobStatus.ENQUEUED;
    }

    public synchronized void markRunning(Instant now) {
        status = JobStatus.RUNNING;
        attemptsMade++;
        startedAt = now;
        finishedAt = null;
        nextRunAt = null;
    }

    public synchronized void markSucceeded(Instant now, Object result) {
        status = JobStatus.SUCCEEDED;
        finishedAt = now;
        this.result = result;
        lastError = null;
    }

    public synchronized void markRetrying(Instant now, Instant nextRunAt, String error) {
        status = JobStatus.FAILED_RETRYING;
        finishedAt = now;
        this.nextRunAt = nextRunAt;
        lastError = error;
    }

    public synchronized void markTerminal(Instant now, String error) {
        status = JobStatus.FAILED_TERMINAL;
        finishedAt = now;
        nextRunAt = null;
        lastError = error;
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, queue, status, attemptsMade, options.asMap(), createdAt, nextRunAt, lastError);
    }
}
