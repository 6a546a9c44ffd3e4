package in.fxledger.domain.model;

import java.util.Locale;

public enum ImportMode {
    /** Only the latest snapshot per identifier. */
    LATEST,
    /** Every retained timestamped snapshot. */
    ALL;

    public static ImportMode fromOption(String value) {
        if (value == null || value.isBlank()) return LATEST;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown import mode: " + value, e);
        }
    }
}
