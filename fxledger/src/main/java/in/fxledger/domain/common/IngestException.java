package in.fxledger.domain.common;

/**
 * Base of every failure raised by the ingestion pipeline.
 *
 * Per-run failures propagate to the job queue, which decides whether the
 * attempt is retried.
 */
public class IngestException extends RuntimeException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
