package in.fxledger.domain.common;

/**
 * Transactional failure. Raised after the transaction has been rolled back.
 */
public class PersistenceException extends IngestException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
