package in.fxledger.domain.model;

import java.util.List;

/**
 * Aggregated result of an import job.
 */
public record ImportSummary(
    SourceKind source,
    ImportMode mode,
    List<ImportOutcome> outcomes
) {
    public ImportSummary {
        outcomes = List.copyOf(outcomes);
    }

    public int succeeded() {
        return (int) outcomes.stream().filter(ImportOutcome::succeeded).count();
    }

    public int failed() {
        return outcomes.size() - succeeded();
    }

    public int totalUpserted() {
        return outcomes.stream()
            .filter(ImportOutcome::succeeded)
            .mapToInt(o -> o.report().upserted())
            .sum();
    }

    public int totalDeduplicated() {
        return outcomes.stream()
            .filter(ImportOutcome::succeeded)
            .mapToInt(o -> o.report().deduplicated())
            .sum();
    }

    public int totalSkipped() {
        return outcomes.stream()
            .filter(ImportOutcome::succeeded)
            .mapToInt(o -> o.report().skipped())
            .sum();
    }

    public Exception firstFailure() {
        return outcomes.stream()
            .filter(o -> !o.succeeded())
            .map(ImportOutcome::error)
            .findFirst()
            .orElse(null);
    }
}
