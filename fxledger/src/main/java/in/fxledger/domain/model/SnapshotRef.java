package in.fxledger.domain.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Location of one stored snapshot file.
 *
 * @param capturedAt from the file name; null for "latest" files
 * @param latest true for the per-identifier latest file
 */
public record SnapshotRef(
    SourceKind source,
    String identifier,
    Path path,
    Instant capturedAt,
    boolean latest
) {}
