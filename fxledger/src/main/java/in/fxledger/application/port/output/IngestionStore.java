package in.fxledger.application.port.output;

import java.util.function.Function;

/**
 * Transactional access to the dimension and fact tables.
 *
 * Everything done through the session passed to {@code work} commits together,
 * or is rolled back together if {@code work} throws.
 */
public interface IngestionStore {

    /**
     * Run {@code work} in one transaction.
     *
     * @throws in.fxledger.domain.common.PersistenceException on any database failure, after rollback
     */
    <T> T inTransaction(Function<IngestionSession, T> work);
}
