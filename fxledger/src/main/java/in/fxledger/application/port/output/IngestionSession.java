package in.fxledger.application.port.output;

import in.fxledger.domain.model.Tick;

import java.util.List;

/**
 * Operations available inside one ingestion transaction.
 */
public interface IngestionSession {

    /**
     * Get-or-create a source by name. Safe under concurrent callers.
     */
    int getOrCreateSource(String name);

    /**
     * Get-or-create a currency pair by symbol. Safe under concurrent callers.
     */
    int getOrCreatePair(String symbol, String baseCurrency, String quoteCurrency);

    /**
     * Insert or overwrite ticks keyed by (time, pair_id, source_id).
     * The list must not contain duplicate keys.
     *
     * @return number of rows written
     */
    int upsertTicks(List<Tick> ticks);
}
