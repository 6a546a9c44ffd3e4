package in.fxledger.service.ingest;

import in.fxledger.application.port.output.IngestionSession;
import in.fxledger.domain.model.CurrencyPair;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps source names and currency pairs to their dimension ids, creating rows on
 * first reference.
 *
 * Bound to one ingestion transaction; ids are cached for the lifetime of the run.
 */
public final class ReferenceResolver {

    private final IngestionSession session;
    private final Map<String, Integer> sourceIds = new HashMap<>();
    private final Map<String, Integer> pairIds = new HashMap<>();

    public ReferenceResolver(IngestionSession session) {
        this.session = session;
    }

    public int resolveSource(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source name is required");
        }
        return sourceIds.computeIfAbsent(name, session::getOrCreateSource);
    }

    public int resolvePair(String baseCurrency, String quoteCurrency) {
        CurrencyPair pair = CurrencyPair.of(baseCurrency, quoteCurrency);
        return pairIds.computeIfAbsent(pair.symbol(),
            symbol -> session.getOrCreatePair(symbol, pair.baseCurrency(), pair.quoteCurrency()));
    }

    /** Distinct pairs resolved so far. */
    public int pairCount() {
        return pairIds.size();
    }
}
