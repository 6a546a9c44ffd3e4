package in.fxledger.domain.job;

import in.fxledger.domain.model.SourceKind;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of a successful crawl attempt.
 */
public record CrawlResult(
    SourceKind source,
    String identifier,
    Path snapshotPath,
    Instant capturedAt
) {}
