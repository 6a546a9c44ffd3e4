package in.fxledger.domain.common;

/**
 * Retry budget exhausted. The job is kept in the queue in FAILED_TERMINAL state.
 */
public class TerminalTaskFailureException extends IngestException {

    private final String queue;
    private final String jobId;
    private final int attempts;

    public TerminalTaskFailureException(String queue, String jobId, int attempts, Throwable cause) {
        super(String.format("[%s:%s] failed after %d attempts: %s",
            queue, jobId, attempts, cause == null ? "unknown" : cause.getMessage()), cause);
        this.queue = queue;
        this.jobId = jobId;
        this.attempts = attempts;
    }

    public String getQueue() {
        return queue;
    }

    public String getJobId() {
        return jobId;
    }

    public int getAttempts() {
        return attempts;
    }
}
