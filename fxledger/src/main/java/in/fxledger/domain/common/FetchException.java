package in.fxledger.domain.common;

/**
 * Upstream provider could not be reached or answered with an error status.
 */
public class FetchException extends IngestException {

    private final String source;

    public FetchException(String source, String message) {
        super(String.format("[%s] %s", source, message));
        this.source = source;
    }

    public FetchException(String source, String message, Throwable cause) {
        super(String.format("[%s] %s", source, message), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
