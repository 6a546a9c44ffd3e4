package in.fxledger.service.ingest;

import in.fxledger.application.port.output.IngestionSession;
import in.fxledger.application.port.output.IngestionStore;
import in.fxledger.domain.common.PersistenceException;
import in.fxledger.domain.model.Tick;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Transactional in-memory store for engine tests. Work runs against a copy of
 * the tables that replaces them only on success.
 */
class InMemoryIngestionStore implements IngestionStore {

    final Map<String, Integer> sources = new HashMap<>();
    final Map<String, Integer> pairs = new HashMap<>();
    final Map<Tick.Key, Tick> ticks = new LinkedHashMap<>();
    final List<Integer> chunkSizes = new ArrayList<>();

    int transactions;
    int rollbacks;
    int failOnUpsertCall = -1;

    @Override
    public synchronized <T> T inTransaction(Function<IngestionSession, T> work) {
        transactions++;
        Tables tx = new Tables(new HashMap<>(sources), new HashMap<>(pairs), new LinkedHashMap<>(ticks));
        T result;
        try {
            result = work.apply(tx);
        } catch (RuntimeException e) {
            rollbacks++;
            throw e;
        }
        sources.clear();
        sources.putAll(tx.sources);
        pairs.clear();
        pairs.putAll(tx.pairs);
        ticks.clear();
        ticks.putAll(tx.ticks);
        return result;
    }

    private final class Tables implements IngestionSession {
        private final Map<String, Integer> sources;
        private final Map<String, Integer> pairs;
        private final Map<Tick.Key, Tick> ticks;
        private int upsertCalls;

        Tables(Map<String, Integer> sources, Map<String, Integer> pairs, Map<Tick.Key, Tick> ticks) {
            this.sources = sources;
            this.pairs = pairs;
            this.ticks = ticks;
        }

        @Override
        public int getOrCreateSource(String name) {
            return sources.computeIfAbsent(name, n -> sources.size() + 1);
        }

        @Override
        public int getOrCreatePair(String symbol, String baseCurrency, String quoteCurrency) {
            return pairs.computeIfAbsent(symbol, s -> pairs.size() + 1);
        }

        @Override
        public int upsertTicks(List<Tick> batch) {
            if (upsertCalls++ == failOnUpsertCall) {
                throw new PersistenceException("simulated failure", new RuntimeException("boom"));
            }
            chunkSizes.add(batch.size());
            for (Tick tick : batch) {
                ticks.put(tick.key(), tick);
            }
            return batch.size();
        }
    }
}
