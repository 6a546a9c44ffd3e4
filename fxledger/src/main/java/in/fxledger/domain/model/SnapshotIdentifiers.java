package in.fxledger.domain.model;

import in.fxledger.domain.job.JobOptions;

/**
 * Identifier a snapshot is filed under, derived from crawl options.
 *
 * VCB publishes a single sheet ({@code rates}); XE is keyed by currency pair
 * ({@code USD_VND}); Yahoo and Reuters by symbol ({@code VND=X} becomes {@code VND_X}).
 */
public final class SnapshotIdentifiers {
    public static final String VCB_SHEET = "rates";

    public static String forOptions(SourceKind source, JobOptions options) {
        switch (source) {
            case VCB:
                return VCB_SHEET;
            case XE: {
                String from = options.getString(JobOptions.FROM_CURRENCY)
                    .orElseThrow(() -> new IllegalArgumentException("fromCurrency is required"));
                String to = options.getString(JobOptions.TO_CURRENCY)
                    .orElseThrow(() -> new IllegalArgumentException("toCurrency is required"));
                return sanitize(from + "_" + to);
            }
            default: {
                String symbol = options.getString(JobOptions.SYMBOL)
                    .orElseThrow(() -> new IllegalArgumentException("symbol is required"));
                return sanitize(symbol);
            }
        }
    }

    /**
     * Replace anything outside [A-Za-z0-9] with '_' so the identifier is file-name safe.
     */
    public static String sanitize(String raw) {
        return raw.trim().replaceAll("[^A-Za-z0-9]", "_");
    }

    private SnapshotIdentifiers() {}
}
