package in.fxledger.service.job;

import in.fxledger.domain.model.SourceKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Deterministic job ids. Two producers firing in the same interval slot build
 * the same id, so the queue keeps only one of them.
 */
public final class JobIds {

    /**
     * Epoch millis of {@code now} truncated to a multiple of {@code interval}.
     */
    public static long slot(Instant now, Duration interval) {
        long millis = interval.toMillis();
        if (millis <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        return Math.floorDiv(now.toEpochMilli(), millis) * millis;
    }

    /**
     * {@code <code>[-<identifier>]-<slot>}, e.g. {@code vcb-1769678700000} or
     * {@code xe-USDVND-1769678700000}. Non alphanumeric characters of the
     * identifier are dropped.
     */
    public static String crawl(SourceKind source, String identifier, Instant now, Duration interval) {
        StringBuilder id = new StringBuilder(source.code());
        if (identifier != null) {
            String compact = identifier.replaceAll("[^A-Za-z0-9]", "");
            if (!compact.isEmpty()) {
                id.append('-').append(compact);
            }
        }
        return id.append('-').append(slot(now, interval)).toString();
    }

    public static String repeatable(String name, long slot) {
        return "repeat:" + name + ":" + slot;
    }

    /** Id of the import job chained after a crawl job. */
    public static String chainedImport(String crawlJobId) {
        return "import:" + crawlJobId;
    }

    private JobIds() {}
}
