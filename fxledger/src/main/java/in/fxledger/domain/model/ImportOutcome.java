package in.fxledger.domain.model;

/**
 * Result of importing one snapshot file. Exactly one of report/error is set.
 */
public record ImportOutcome(
    SnapshotRef snapshot,
    IngestionReport report,
    Exception error
) {
    public static ImportOutcome success(SnapshotRef snapshot, IngestionReport report) {
        return new ImportOutcome(snapshot, report, null);
    }

    public static ImportOutcome failure(SnapshotRef snapshot, Exception error) {
        return new ImportOutcome(snapshot, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
