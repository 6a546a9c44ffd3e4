package in.fxledger.config;

import in.fxledger.domain.model.SourceKind;
import in.fxledger.util.Env;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration of the ingestion pipeline.
 *
 * Read once at startup from the environment (see {@link #fromEnv()}) and passed
 * by reference to the components that need it.
 */
public record IngestConfig(
    Path dataDir,                   // snapshot root, one sub-directory per source
    BigDecimal syntheticSpread,     // relative spread for mid-only sources (0.0001 = 1bp)
    BigDecimal rateFloor,           // XE chart samples at or below this are skipped
    int upsertChunkSize,            // rows per JDBC batch
    ZoneId vcbZone,                 // zone of the VCB sheet's local DateTime
    int jobAttempts,
    Duration jobBackoff,            // first retry delay, doubled each attempt
    Duration jobLock,               // max duration of one attempt
    Duration crawlInterval,
    boolean schedulerEnabled,
    boolean autoImport,             // scheduled crawls chain an import on success
    Set<SourceKind> activeWorkers,
    List<String> yahooSymbols,
    List<String> reutersSymbols,
    List<String> xePairs,           // "USD/VND" style
    int adminPort,
    String xeAuthToken,
    String reutersAuthToken,
    Map<String, String> reutersXids // Reuters symbol -> markitdigital xid
) {
    public static final List<String> DEFAULT_YAHOO_SYMBOLS = List.of("VND=X", "EUR=X", "JPY=X");
    public static final List<String> DEFAULT_REUTERS_SYMBOLS = List.of("VND=X");
    public static final List<String> DEFAULT_XE_PAIRS = List.of("USD/VND", "EUR/VND", "JPY/VND");
    public static final String DEFAULT_REUTERS_XID = "611986";
    /** xids known without configuration. */
    public static final Map<String, String> KNOWN_REUTERS_XIDS = Map.of("VND=X", DEFAULT_REUTERS_XID);

    public IngestConfig {
        activeWorkers = activeWorkers.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(SourceKind.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(activeWorkers));
        yahooSymbols = List.copyOf(yahooSymbols);
        reutersSymbols = List.copyOf(reutersSymbols);
        xePairs = List.copyOf(xePairs);
        reutersXids = Collections.unmodifiableMap(new LinkedHashMap<>(reutersXids));
    }

    /**
     * Defaults suitable for local runs and tests.
     */
    public static IngestConfig defaults() {
        return new IngestConfig(
            Path.of("data"),
            new BigDecimal("0.0001"),
            new BigDecimal("0.01"),
            1000,
            ZoneId.of("Asia/Ho_Chi_Minh"),
            3,
            Duration.ofSeconds(60),
            Duration.ofMinutes(5),
            Duration.ofSeconds(60),
            true,
            true,
            EnumSet.allOf(SourceKind.class),
            DEFAULT_YAHOO_SYMBOLS,
            DEFAULT_REUTERS_SYMBOLS,
            DEFAULT_XE_PAIRS,
            9090,
            "",
            "",
            KNOWN_REUTERS_XIDS
        );
    }

    /**
     * Load from environment variables (system properties as fallback).
     * Unparseable values fall back to defaults; {@link #isValid()} catches the rest.
     */
    public static IngestConfig fromEnv() {
        IngestConfig d = defaults();
        Map<String, String> reuters = parseReutersSymbols(
            Env.getList("REUTERS_SYMBOLS", d.reutersSymbols()), Env.get("REUTERS_XID", null));
        return new IngestConfig(
            Path.of(Env.get("FX_DATA_DIR", d.dataDir().toString())),
            decimal("FX_SYNTHETIC_SPREAD", d.syntheticSpread()),
            decimal("FX_RATE_FLOOR", d.rateFloor()),
            Env.getInt("FX_UPSERT_CHUNK_SIZE", d.upsertChunkSize()),
            zone("FX_VCB_ZONE", d.vcbZone()),
            Env.getInt("JOB_ATTEMPTS", d.jobAttempts()),
            Duration.ofMillis(Env.getLong("JOB_BACKOFF_MS", d.jobBackoff().toMillis())),
            Duration.ofMillis(Env.getLong("JOB_LOCK_MS", d.jobLock().toMillis())),
            Duration.ofSeconds(Env.getLong("CRAWL_INTERVAL_SECONDS", d.crawlInterval().toSeconds())),
            Env.getBool("SCHEDULER_ENABLED", d.schedulerEnabled()),
            Env.getBool("AUTO_IMPORT", d.autoImport()),
            parseWorkers(Env.get("ACTIVE_WORKERS", null)),
            Env.getList("YAHOO_SYMBOLS", d.yahooSymbols()),
            new ArrayList<>(reuters.keySet()),
            Env.getList("XE_PAIRS", d.xePairs()),
            Env.getInt("ADMIN_PORT", d.adminPort()),
            Env.get("XE_AUTH_TOKEN", d.xeAuthToken()),
            Env.get("REUTERS_AUTH_TOKEN", d.reutersAuthToken()),
            reuters
        );
    }

    /**
     * Parse {@code ACTIVE_WORKERS}. Unset means all sources; unknown names are rejected.
     */
    public static Set<SourceKind> parseWorkers(String value) {
        if (value == null || value.isBlank()) {
            return EnumSet.allOf(SourceKind.class);
        }
        Set<SourceKind> workers = EnumSet.noneOf(SourceKind.class);
        for (String name : value.split(",")) {
            if (name.isBlank()) continue;
            workers.add(SourceKind.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown worker in ACTIVE_WORKERS: " + name.trim())));
        }
        return workers;
    }

    /**
     * Parse {@code REUTERS_SYMBOLS} entries of the form {@code SYMBOL[:XID]}.
     * A symbol without an xid takes {@code singleXid} when it is the only symbol,
     * else a known xid, else none (rejected by {@link #isValid()}).
     *
     * @return symbol to xid, in configuration order; "" where no xid is known
     */
    public static Map<String, String> parseReutersSymbols(List<String> entries, String singleXid) {
        Map<String, String> xids = new LinkedHashMap<>();
        for (String entry : entries) {
            int colon = entry.lastIndexOf(':');
            String symbol = (colon < 0 ? entry : entry.substring(0, colon)).trim();
            String xid = colon < 0 ? null : entry.substring(colon + 1).trim();
            if (symbol.isEmpty()) continue;
            if (xid == null || xid.isEmpty()) {
                xid = entries.size() == 1 && singleXid != null && !singleXid.isBlank()
                    ? singleXid.trim()
                    : KNOWN_REUTERS_XIDS.getOrDefault(symbol, "");
            }
            xids.put(symbol, xid);
        }
        return xids;
    }

    public boolean isWorkerActive(SourceKind kind) {
        return activeWorkers.contains(kind);
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return syntheticSpread.signum() > 0 && syntheticSpread.compareTo(BigDecimal.ONE) < 0
            && rateFloor.signum() >= 0
            && upsertChunkSize > 0
            && jobAttempts >= 1
            && !jobBackoff.isNegative() && !jobBackoff.isZero()
            && !jobLock.isNegative() && !jobLock.isZero()
            && !crawlInterval.isNegative() && !crawlInterval.isZero()
            && adminPort > 0 && adminPort <= 65535
            && xePairs.stream().allMatch(p -> p.matches("[A-Za-z]{3}/[A-Za-z]{3}"))
            && reutersSymbols.stream().allMatch(symbol -> !reutersXids.getOrDefault(symbol, "").isBlank());
    }

    private static BigDecimal decimal(String key, BigDecimal defaultValue) {
        String value = Env.get(key, null);
        if (value == null) return defaultValue;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static ZoneId zone(String key, ZoneId defaultValue) {
        String value = Env.get(key, null);
        if (value == null) return defaultValue;
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            return defaultValue;
        }
    }
}
