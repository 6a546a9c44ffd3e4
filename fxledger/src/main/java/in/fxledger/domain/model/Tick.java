package in.fxledger.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fact row of fx_ticks. Primary key is (time, pairId, sourceId).
 */
public record Tick(
    Instant time,
    int pairId,
    int sourceId,
    BigDecimal bid,
    BigDecimal mid,
    BigDecimal ask,
    BigDecimal volume
) {
    public Key key() {
        return new Key(time, pairId, sourceId);
    }

    /**
     * Composite primary key.
     */
    public record Key(Instant time, int pairId, int sourceId) {}
}
