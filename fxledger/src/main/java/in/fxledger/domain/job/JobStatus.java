package in.fxledger.domain.job;

/**
 * Lifecycle of a queued job.
 *
 * SCHEDULED -> ENQUEUED -> RUNNING -> SUCCEEDED | FAILED_RETRYING | FAILED_TERMINAL.
 * FAILED_RETRYING goes back to RUNNING when the backoff delay has elapsed.
 */
public enum JobStatus {
    SCHEDULED,
    ENQUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED_RETRYING,
    FAILED_TERMINAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL;
    }
}
