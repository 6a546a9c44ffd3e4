package in.fxledger.service.ingest;

import in.fxledger.domain.model.Tick;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses ticks sharing (time, pair_id, source_id). The last one in input
 * order wins; output keeps the position of the key's first occurrence.
 */
public final class TickDeduplicator {

    public record Result(List<Tick> ticks, int duplicates) {}

    public static Result deduplicate(List<Tick> ticks) {
        Map<Tick.Key, Tick> byKey = new LinkedHashMap<>();
        for (Tick tick : ticks) {
            byKey.put(tick.key(), tick);
        }
        return new Result(new ArrayList<>(byKey.values()), ticks.size() - byKey.size());
    }

    private TickDeduplicator() {}
}
