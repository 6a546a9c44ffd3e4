package in.fxledger.service.job;

import in.fxledger.application.port.output.SnapshotStore;
import in.fxledger.application.port.output.SourceAdapter;
import in.fxledger.domain.job.CrawlResult;
import in.fxledger.domain.job.Job;
import in.fxledger.domain.job.JobHandler;
import in.fxledger.domain.model.CapturedSnapshot;
import in.fxledger.domain.model.SnapshotRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Crawl worker: fetch one payload and store it as a snapshot.
 */
public final class CrawlJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobHandler.class);

    private final SourceAdapter adapter;
    private final SnapshotStore snapshots;

    public CrawlJobHandler(SourceAdapter adapter, SnapshotStore snapshots) {
        this.adapter = adapter;
        this.snapshots = snapshots;
    }

    @Override
    public CrawlResult handle(Job job) {
        CapturedSnapshot captured = adapter.fetch(job.options());
        if (captured.original() != null) {
            snapshots.saveOriginal(adapter.kind(), captured.identifier(), captured.snapshot().capturedAt(), captured.original());
        }
        SnapshotRef ref = snapshots.save(adapter.kind(), captured.identifier(), captured.snapshot());
        log.info("✓ [{}] Captured {} -> {}", adapter.kind().sourceName(), captured.identifier(), ref.path());
        return new CrawlResult(adapter.kind(), captured.identifier(), ref.path(), captured.snapshot().capturedAt());
    }
}
