package in.fxledger.service.ingest;

import in.fxledger.application.port.output.SnapshotStore;
import in.fxledger.domain.common.ImportException;
import in.fxledger.domain.model.ImportMode;
import in.fxledger.domain.model.ImportOutcome;
import in.fxledger.domain.model.ImportSummary;
import in.fxledger.domain.model.IngestionReport;
import in.fxledger.domain.model.RawSnapshot;
import in.fxledger.domain.model.SnapshotRef;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.service.normalize.NormalizationResult;
import in.fxledger.service.normalize.NormalizerRegistry;
import in.fxledger.service.normalize.SourceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads stored snapshots into the fact table.
 *
 * Each snapshot file is its own ingestion run (own transaction).
 */
public final class SnapshotImporter {
    private static final Logger log = LoggerFactory.getLogger(SnapshotImporter.class);

    private final SnapshotStore snapshots;
    private final NormalizerRegistry normalizers;
    private final TickStore tickStore;

    public SnapshotImporter(SnapshotStore snapshots, NormalizerRegistry normalizers, TickStore tickStore) {
        this.snapshots = snapshots;
        this.normalizers = normalizers;
        this.tickStore = tickStore;
    }

    /**
     * Import the latest snapshot of one identifier, or of every identifier when
     * {@code identifier} is null. All files are attempted; if any failed the
     * whole import fails so the job is retried.
     *
     * @throws ImportException when at least one snapshot failed
     */
    public ImportSummary importLatest(SourceKind source, String identifier) {
        List<SnapshotRef> refs;
        if (identifier != null) {
            Optional<SnapshotRef> latest = snapshots.findLatest(source, identifier);
            refs = latest.map(List::of).orElse(List.of());
            if (latest.isEmpty()) {
                log.warn("[{}] No latest snapshot for identifier {}", source.sourceName(), identifier);
            }
        } else {
            refs = snapshots.listLatest(source);
        }

        ImportSummary summary = run(source, ImportMode.LATEST, refs);
        if (summary.failed() > 0) {
            throw new ImportException(summary);
        }
        return summary;
    }

    /**
     * Import every retained timestamped snapshot. A failing file is recorded and
     * the run continues.
     */
    public ImportSummary importAll(SourceKind source) {
        return run(source, ImportMode.ALL, snapshots.listHistorical(source));
    }

    public ImportSummary importSnapshots(SourceKind source, ImportMode mode, String identifier) {
        return mode == ImportMode.ALL ? importAll(source) : importLatest(source, identifier);
    }

    private ImportSummary run(SourceKind source, ImportMode mode, List<SnapshotRef> refs) {
        log.info("[{}] Importing {} snapshot(s) in {} mode", source.sourceName(), refs.size(), mode);
        SourceNormalizer normalizer = normalizers.forKind(source);

        List<ImportOutcome> outcomes = new ArrayList<>();
        for (SnapshotRef ref : refs) {
            try {
                RawSnapshot snapshot = snapshots.read(ref);
                NormalizationResult normalized = normalizer.normalize(snapshot.payload(), snapshot.capturedAt());
                IngestionReport report = tickStore.ingest(source.sourceName(), normalized);
                outcomes.add(ImportOutcome.success(ref, report));
            } catch (RuntimeException e) {
                log.error("[{}] Failed to import {}: {}", source.sourceName(), ref.path().getFileName(), e.getMessage());
                outcomes.add(ImportOutcome.failure(ref, e));
            }
        }

        ImportSummary summary = new ImportSummary(source, mode, outcomes);
        log.info("[{}] Import finished: {} ok, {} failed, {} tick(s) upserted",
            source.sourceName(), summary.succeeded(), summary.failed(), summary.totalUpserted());
        return summary;
    }
}
