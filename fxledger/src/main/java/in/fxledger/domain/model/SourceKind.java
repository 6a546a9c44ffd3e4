package in.fxledger.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of upstream quote providers.
 *
 * Each provider owns one crawl queue (WORKER_*) and one import queue (IMPORTER_*),
 * a snapshot directory and a row in the sources dimension table.
 */
public enum SourceKind {
    VCB("VietcomBank", "vcb"),
    XE("XE.com", "xe"),
    YAHOO("Yahoo Finance", "yahoo"),
    REUTERS("Reuters", "reuters");

    private static final String CRAWL_PREFIX = "WORKER_";
    private static final String IMPORT_PREFIX = "IMPORTER_";

    private final String sourceName;
    private final String code;

    SourceKind(String sourceName, String code) {
        this.sourceName = sourceName;
        this.code = code;
    }

    /** Name stored in the sources table. */
    public String sourceName() {
        return sourceName;
    }

    /** Lower-case code used for snapshot directories, file prefixes and job ids. */
    public String code() {
        return code;
    }

    public String crawlQueue() {
        return CRAWL_PREFIX + name();
    }

    public String importQueue() {
        return IMPORT_PREFIX + name();
    }

    public boolean isCrawlQueue(String queueName) {
        return crawlQueue().equals(queueName);
    }

    public static Optional<SourceKind> fromQueue(String queueName) {
        if (queueName == null) return Optional.empty();
        return Arrays.stream(values())
            .filter(k -> k.crawlQueue().equals(queueName) || k.importQueue().equals(queueName))
            .findFirst();
    }

    public static Optional<SourceKind> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(k -> k.name().equals(normalized))
            .findFirst();
    }
}
