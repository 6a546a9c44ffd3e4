package in.fxledger.domain.model;

import java.util.Locale;

/**
 * Currency pair dimension row. The symbol (base + quote) is the natural key.
 */
public record CurrencyPair(
    Integer id,
    String symbol,
    String baseCurrency,
    String quoteCurrency
) {
    public CurrencyPair {
        if (baseCurrency == null || baseCurrency.length() != 3) {
            throw new IllegalArgumentException("Base currency must be a 3-letter code: " + baseCurrency);
        }
        if (quoteCurrency == null || quoteCurrency.length() != 3) {
            throw new IllegalArgumentException("Quote currency must be a 3-letter code: " + quoteCurrency);
        }
    }

    /**
     * Unresolved pair (no id yet).
     */
    public static CurrencyPair of(String base, String quote) {
        String b = base == null ? null : base.trim().toUpperCase(Locale.ROOT);
        String q = quote == null ? null : quote.trim().toUpperCase(Locale.ROOT);
        return new CurrencyPair(null, b + q, b, q);
    }
}
