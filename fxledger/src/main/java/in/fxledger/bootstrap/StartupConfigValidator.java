package in.fxledger.bootstrap;

import in.fxledger.config.IngestConfig;
import in.fxledger.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

/**
 * Startup configuration validator.
 *
 * Runs before any component is created. Throws IllegalStateException if the
 * configuration is unusable; App refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(IngestConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (!config.isValid()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: one or more values are out of range\n" +
                "Check FX_SYNTHETIC_SPREAD (0 < k < 1), FX_RATE_FLOOR (>= 0), FX_UPSERT_CHUNK_SIZE (> 0),\n" +
                "JOB_ATTEMPTS (>= 1), JOB_BACKOFF_MS (> 0), JOB_LOCK_MS (> 0), CRAWL_INTERVAL_SECONDS (> 0),\n" +
                "ADMIN_PORT (1-65535), XE_PAIRS (BASE/QUOTE, e.g. USD/VND)\n" +
                "and REUTERS_SYMBOLS (SYMBOL:XID, e.g. VND=X:611986, for symbols without a known xid)"
            );
        }
        log.info("✓ Value ranges valid");

        if (Files.exists(config.dataDir()) && !Files.isDirectory(config.dataDir())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: FX_DATA_DIR is not a directory: " + config.dataDir().toAbsolutePath()
            );
        }
        log.info("✓ Snapshot directory: {}", config.dataDir().toAbsolutePath());

        if (config.activeWorkers().isEmpty()) {
            log.warn("⚠️ ACTIVE_WORKERS selects no source; jobs will be queued but never run");
        } else {
            log.info("✓ Active workers: {}", config.activeWorkers());
        }

        if (config.isWorkerActive(SourceKind.REUTERS) && config.reutersAuthToken().isBlank()) {
            log.warn("⚠️ REUTERS_AUTH_TOKEN not set; Reuters requests will be sent without authorization");
        }
        if (config.isWorkerActive(SourceKind.XE) && config.xeAuthToken().isBlank()) {
            log.warn("⚠️ XE_AUTH_TOKEN not set; XE requests will be sent without authorization");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
