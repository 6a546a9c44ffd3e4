package in.fxledger.service.job;

import in.fxledger.domain.job.Job;
import in.fxledger.domain.job.JobHandler;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.ImportMode;
import in.fxledger.domain.model.ImportSummary;
import in.fxledger.domain.model.SnapshotIdentifiers;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.service.ingest.SnapshotImporter;

/**
 * Import worker.
 *
 * Options: {@code mode} ({@code latest} by default, or {@code all}) and an
 * optional snapshot {@code identifier}. For jobs enqueued by hand the
 * identifier may also be given as {@code symbol} or {@code fromCurrency}/{@code toCurrency}.
 */
public final class ImportJobHandler implements JobHandler {

    private final SourceKind source;
    private final SnapshotImporter importer;

    public ImportJobHandler(SourceKind source, SnapshotImporter importer) {
        this.source = source;
        this.importer = importer;
    }

    @Override
    public ImportSummary handle(Job job) {
        JobOptions options = job.options();
        ImportMode mode = ImportMode.fromOption(options.getString(JobOptions.MODE, null));
        return importer.importSnapshots(source, mode, identifier(options));
    }

    String identifier(JobOptions options) {
        if (options.getString(JobOptions.IDENTIFIER).isPresent()) {
            return SnapshotIdentifiers.sanitize(options.getString(JobOptions.IDENTIFIER).get());
        }
        boolean hasPair = options.getString(JobOptions.FROM_CURRENCY).isPresent()
            && options.getString(JobOptions.TO_CURRENCY).isPresent();
        if (options.getString(JobOptions.SYMBOL).isPresent() || hasPair) {
            return SnapshotIdentifiers.forOptions(source, options);
        }
        return null;
    }
}
