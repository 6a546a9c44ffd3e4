package in.fxledger.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Derives bid/mid/ask when a source does not quote all three.
 *
 * Rules:
 * - Single mid rate: bid = mid - mid*k/2, ask = mid + mid*k/2 for a relative spread k
 *   (default 1 basis point). The result is an approximation, not a tradable quote.
 * - Institution buy/sell: Buy maps to bid, Sell to ask, the transfer rate to mid.
 *   A missing mid falls back to (bid + ask) / 2; a missing side falls back to transfer.
 */
public final class SpreadPolicy {
    public static final BigDecimal DEFAULT_RELATIVE_SPREAD = new BigDecimal("0.0001");

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final BigDecimal relativeSpread;
    private final BigDecimal halfSpread;

    public SpreadPolicy(BigDecimal relativeSpread) {
        if (relativeSpread == null || relativeSpread.signum() <= 0) {
            throw new IllegalArgumentException("Relative spread must be positive: " + relativeSpread);
        }
        this.relativeSpread = relativeSpread;
        this.halfSpread = relativeSpread.divide(TWO, MC);
    }

    public static SpreadPolicy defaults() {
        return new SpreadPolicy(DEFAULT_RELATIVE_SPREAD);
    }

    public BigDecimal relativeSpread() {
        return relativeSpread;
    }

    /**
     * Synthesize bid/ask around a single mid rate.
     */
    public Quote fromMid(BigDecimal mid) {
        if (mid == null) {
            throw new IllegalArgumentException("mid is required");
        }
        BigDecimal half = mid.multiply(halfSpread, MC);
        return new Quote(mid.subtract(half, MC), mid, mid.add(half, MC));
    }

    /**
     * Map an institution's buy/transfer/sell columns. Empty when no complete
     * triple can be derived.
     */
    public Optional<Quote> fromBuySell(BigDecimal buy, BigDecimal transfer, BigDecimal sell) {
        BigDecimal bid = buy != null ? buy : transfer;
        BigDecimal ask = sell != null ? sell : transfer;
        BigDecimal mid = transfer;
        if (mid == null && buy != null && sell != null) {
            mid = buy.add(sell, MC).divide(TWO, MC);
        }
        if (bid == null || mid == null || ask == null) {
            return Optional.empty();
        }
        return Optional.of(new Quote(bid, mid, ask));
    }
}
