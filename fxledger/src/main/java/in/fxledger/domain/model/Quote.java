package in.fxledger.domain.model;

import java.math.BigDecimal;

/**
 * A bid/mid/ask triple. May be synthesized, see {@link SpreadPolicy}.
 */
public record Quote(
    BigDecimal bid,
    BigDecimal mid,
    BigDecimal ask
) {}
