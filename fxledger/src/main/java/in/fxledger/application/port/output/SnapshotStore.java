package in.fxledger.application.port.output;

import in.fxledger.domain.model.CapturedSnapshot;
import in.fxledger.domain.model.RawSnapshot;
import in.fxledger.domain.model.SnapshotRef;
import in.fxledger.domain.model.SourceKind;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage of raw source payloads.
 *
 * Each save writes a timestamped file and replaces the identifier's latest file.
 */
public interface SnapshotStore {

    /**
     * @return reference to the timestamped file that was written
     */
    SnapshotRef save(SourceKind source, String identifier, RawSnapshot snapshot);

    /**
     * Store the unconverted response body a snapshot was built from, as a
     * timestamped file plus the identifier's latest file.
     *
     * @return the timestamped file that was written
     */
    Path saveOriginal(SourceKind source, String identifier, Instant capturedAt, CapturedSnapshot.Original original);

    RawSnapshot read(SnapshotRef ref);

    Optional<SnapshotRef> findLatest(SourceKind source, String identifier);

    /** Latest file of every identifier of a source. */
    List<SnapshotRef> listLatest(SourceKind source);

    /** All timestamped files of a source, oldest first. */
    List<SnapshotRef> listHistorical(SourceKind source);
}
