package in.fxledger.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Normalizer output: a tick not yet resolved to dimension ids.
 */
public record TickCandidate(
    String baseCurrency,
    String quoteCurrency,
    Instant time,
    BigDecimal bid,
    BigDecimal mid,
    BigDecimal ask,
    BigDecimal volume
) {
    public static TickCandidate of(String base, String quote, Instant time, Quote q, BigDecimal volume) {
        return new TickCandidate(base, quote, time, q.bid(), q.mid(), q.ask(), volume);
    }

    public String symbol() {
        return baseCurrency + quoteCurrency;
    }
}
