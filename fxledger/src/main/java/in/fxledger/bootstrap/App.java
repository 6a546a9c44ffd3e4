package in.fxledger.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.fxledger.application.port.output.SnapshotStore;
import in.fxledger.application.port.output.SourceAdapter;
import in.fxledger.config.IngestConfig;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.infrastructure.metrics.PrometheusIngestionMetrics;
import in.fxledger.infrastructure.metrics.PrometheusMetricsHandler;
import in.fxledger.infrastructure.persistence.PostgresIngestionStore;
import in.fxledger.infrastructure.persistence.SchemaMigration;
import in.fxledger.infrastructure.snapshot.FileSnapshotStore;
import in.fxledger.infrastructure.source.HttpSourceAdapter;
import in.fxledger.infrastructure.source.ReutersHttpAdapter;
import in.fxledger.infrastructure.source.VcbHttpAdapter;
import in.fxledger.infrastructure.source.XeHttpAdapter;
import in.fxledger.infrastructure.source.YahooHttpAdapter;
import in.fxledger.service.ingest.SnapshotImporter;
import in.fxledger.service.ingest.TickStore;
import in.fxledger.service.job.CrawlJobHandler;
import in.fxledger.service.job.CrawlScheduler;
import in.fxledger.service.job.ImportChainer;
import in.fxledger.service.job.ImportJobHandler;
import in.fxledger.service.job.QueueRegistry;
import in.fxledger.service.normalize.NormalizerRegistry;
import in.fxledger.transport.http.JobAdminHandler;
import in.fxledger.util.Env;
import in.fxledger.util.Json;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the ingestion pipeline:
 * - PostgreSQL store (HikariCP) and schema migration
 * - Snapshot store, source adapters and normalizers
 * - Crawl and import queues with their workers
 * - Crawl scheduler and crawl→import chaining
 * - Admin HTTP API with /health and /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== fxledger Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration + startup validation gate
        // ═══════════════════════════════════════════════════════════════
        IngestConfig config;
        try {
            config = IngestConfig.fromEnv();
            StartupConfigValidator.validate(config);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        new SchemaMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusIngestionMetrics metrics = new PrometheusIngestionMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Ingestion pipeline
        // ═══════════════════════════════════════════════════════════════
        ObjectMapper mapper = Json.newMapper();
        SnapshotStore snapshots = new FileSnapshotStore(config.dataDir(), mapper);
        TickStore tickStore = new TickStore(new PostgresIngestionStore(dataSource), metrics, config.upsertChunkSize());
        SnapshotImporter importer = new SnapshotImporter(snapshots, NormalizerRegistry.create(config), tickStore);
        Map<SourceKind, SourceAdapter> adapters = createAdapters(config, mapper);
        log.info("✓ Ingestion pipeline initialized (data dir {})", config.dataDir().toAbsolutePath());

        // ═══════════════════════════════════════════════════════════════
        // Queues + workers
        // ═══════════════════════════════════════════════════════════════
        QueueRegistry queues = QueueRegistry.create(config, metrics);
        queues.addCrawlListener(new ImportChainer(queues));
        for (SourceKind kind : SourceKind.values()) {
            if (!config.isWorkerActive(kind)) {
                log.info("⏭️ Worker {} inactive (ACTIVE_WORKERS)", kind);
                continue;
            }
            queues.crawlQueue(kind).start(new CrawlJobHandler(adapters.get(kind), snapshots));
            queues.importQueue(kind).start(new ImportJobHandler(kind, importer));
        }

        CrawlScheduler scheduler = CrawlScheduler.create(config, queues);
        if (config.schedulerEnabled()) {
            scheduler.start();
        } else {
            log.info("⏭️ Crawl scheduler disabled (SCHEDULER_ENABLED=false)");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP: admin API, health, metrics
        // ═══════════════════════════════════════════════════════════════
        JobAdminHandler admin = new JobAdminHandler(queues, mapper);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/health", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
                exchange.getResponseSender().send("OK");
            })
            .get("/metrics", metricsHandler)
            .get("/api/queues", admin::listQueues)
            .get("/api/queues/{queue}", admin::getQueue)
            .post("/api/queues/{queue}/jobs", admin::addJob)
            .delete("/api/queues/{queue}", admin::clearQueue)
            .delete("/api/queues/{queue}/jobs/{jobId}", admin::removeJob)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "fxledger\n\n" +
                    "GET    /health, /metrics\n" +
                    "GET    /api/queues, /api/queues/{queue}\n" +
                    "POST   /api/queues/{queue}/jobs\n" +
                    "DELETE /api/queues/{queue}, /api/queues/{queue}/jobs/{jobId}\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.adminPort(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", config.adminPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            scheduler.stop();
            queues.shutdown();
            server.stop();
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown"));

        log.info("=== fxledger started ===");
    }

    private static Map<SourceKind, SourceAdapter> createAdapters(IngestConfig config, ObjectMapper mapper) {
        HttpClient client = HttpSourceAdapter.defaultClient();
        Clock clock = Clock.systemUTC();
        Map<SourceKind, SourceAdapter> adapters = new EnumMap<>(SourceKind.class);
        adapters.put(SourceKind.VCB, new VcbHttpAdapter(client, mapper, clock, VcbHttpAdapter.DEFAULT_URL));
        adapters.put(SourceKind.XE, new XeHttpAdapter(client, mapper, clock,
            XeHttpAdapter.DEFAULT_BASE_URL, config.xeAuthToken()));
        adapters.put(SourceKind.YAHOO, new YahooHttpAdapter(client, mapper, clock, YahooHttpAdapter.DEFAULT_BASE_URL));
        adapters.put(SourceKind.REUTERS, new ReutersHttpAdapter(client, mapper, clock,
            ReutersHttpAdapter.DEFAULT_URL, config.reutersAuthToken(), config.reutersXids()));
        return adapters;
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/timeseries");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("fxledger-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
