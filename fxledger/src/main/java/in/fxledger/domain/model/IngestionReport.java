package in.fxledger.domain.model;

/**
 * Counts for one ingestion run.
 *
 * @param received candidates handed to the engine
 * @param deduplicated candidates collapsed onto an earlier key in the same run
 * @param upserted rows sent to the fact table
 * @param skipped samples the normalizer rejected
 * @param pairs distinct currency pairs touched
 */
public record IngestionReport(
    String source,
    int received,
    int deduplicated,
    int upserted,
    int skipped,
    int pairs
) {}
