package in.fxledger.domain.common;

/**
 * A payload is missing structurally required fields or yielded no usable sample.
 * Fails the whole batch.
 */
public class MalformedPayloadException extends IngestException {

    private final String source;

    public MalformedPayloadException(String source, String message) {
        super(String.format("[%s] %s", source, message));
        this.source = source;
    }

    public MalformedPayloadException(String source, String message, Throwable cause) {
        super(String.format("[%s] %s", source, message), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
