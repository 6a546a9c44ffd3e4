package in.fxledger.domain.common;

import in.fxledger.domain.model.ImportSummary;

/**
 * An import in {@code latest} mode where at least one snapshot failed.
 */
public class ImportException extends IngestException {

    private final ImportSummary summary;

    public ImportException(ImportSummary summary) {
        super(String.format("[%s] %d of %d snapshot(s) failed to import",
            summary.source(), summary.failed(), summary.outcomes().size()), summary.firstFailure());
        this.summary = summary;
    }

    public ImportSummary getSummary() {
        return summary;
    }
}
