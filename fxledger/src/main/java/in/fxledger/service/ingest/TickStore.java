package in.fxledger.service.ingest;

import in.fxledger.application.port.output.IngestionStore;
import in.fxledger.domain.model.IngestionReport;
import in.fxledger.domain.model.Tick;
import in.fxledger.domain.model.TickCandidate;
import in.fxledger.infrastructure.metrics.IngestionMetrics;
import in.fxledger.service.normalize.NormalizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Dedup and upsert engine.
 *
 * One call is one run: references are resolved, candidates deduplicated and
 * upserted in fixed-size chunks, all inside a single transaction. Re-running
 * the same input leaves the fact table unchanged.
 */
public final class TickStore {
    private static final Logger log = LoggerFactory.getLogger(TickStore.class);

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    private final IngestionStore store;
    private final IngestionMetrics metrics;
    private final int chunkSize;

    public TickStore(IngestionStore store, IngestionMetrics metrics, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.store = store;
        this.metrics = metrics;
        this.chunkSize = chunkSize;
    }

    public TickStore(IngestionStore store, IngestionMetrics metrics) {
        this(store, metrics, DEFAULT_CHUNK_SIZE);
    }

    public IngestionReport ingest(String sourceName, NormalizationResult normalized) {
        return ingest(sourceName, normalized.candidates(), normalized.skipped().size());
    }

    /**
     * Ingest one run's candidates for one source.
     *
     * @param skipped samples already dropped upstream, reported as-is
     * @throws in.fxledger.domain.common.PersistenceException after rollback
     */
    public IngestionReport ingest(String sourceName, List<TickCandidate> candidates, int skipped) {
        IngestionReport report = store.inTransaction(session -> {
            ReferenceResolver resolver = new ReferenceResolver(session);
            int sourceId = resolver.resolveSource(sourceName);

            List<Tick> ticks = new ArrayList<>(candidates.size());
            for (TickCandidate c : candidates) {
                int pairId = resolver.resolvePair(c.baseCurrency(), c.quoteCurrency());
                ticks.add(new Tick(c.time(), pairId, sourceId, c.bid(), c.mid(), c.ask(), c.volume()));
            }

            TickDeduplicator.Result deduped = TickDeduplicator.deduplicate(ticks);
            int upserted = 0;
            List<Tick> unique = deduped.ticks();
            for (int from = 0; from < unique.size(); from += chunkSize) {
                List<Tick> chunk = unique.subList(from, Math.min(from + chunkSize, unique.size()));
                upserted += session.upsertTicks(chunk);
            }
            return new IngestionReport(sourceName, candidates.size(), deduped.duplicates(),
                upserted, skipped, resolver.pairCount());
        });

        metrics.recordIngestion(sourceName, report.upserted(), report.deduplicated(), report.skipped());
        log.info("✓ [{}] Ingested {} tick(s) across {} pair(s) ({} received, {} duplicate, {} skipped)",
            sourceName, report.upserted(), report.pairs(), report.received(),
            report.deduplicated(), report.skipped());
        return report;
    }
}
