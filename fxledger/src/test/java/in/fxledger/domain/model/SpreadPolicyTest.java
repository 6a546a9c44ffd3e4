package in.fxledger.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SpreadPolicyTest {

    private final SpreadPolicy policy = SpreadPolicy.defaults();

    @Test
    void fromMidSynthesizesSymmetricSpread() {
        Quote q = policy.fromMid(new BigDecimal("25000"));

        assertEquals(0, new BigDecimal("24998.75").compareTo(q.bid()));
        assertEquals(0, new BigDecimal("25000").compareTo(q.mid()));
        assertEquals(0, new BigDecimal("25001.25").compareTo(q.ask()));
    }

    @Test
    void fromMidKeepsOrdering() {
        Quote q = policy.fromMid(new BigDecimal("0.92345"));

        assertTrue(q.bid().compareTo(q.mid()) < 0);
        assertTrue(q.mid().compareTo(q.ask()) < 0);
    }

    @Test
    void customSpreadIsApplied() {
        SpreadPolicy wide = new SpreadPolicy(new BigDecimal("0.01"));
        Quote q = wide.fromMid(new BigDecimal("100"));

        assertEquals(0, new BigDecimal("99.5").compareTo(q.bid()));
        assertEquals(0, new BigDecimal("100.5").compareTo(q.ask()));
    }

    @Test
    void nonPositiveSpreadRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SpreadPolicy(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new SpreadPolicy(null));
    }

    @Test
    void buySellMapsToBidAskAndTransferToMid() {
        Optional<Quote> q = policy.fromBuySell(
            new BigDecimal("25350"), new BigDecimal("25380"), new BigDecimal("25410"));

        assertTrue(q.isPresent());
        assertEquals(new BigDecimal("25350"), q.get().bid());
        assertEquals(new BigDecimal("25380"), q.get().mid());
        assertEquals(new BigDecimal("25410"), q.get().ask());
    }

    @Test
    void missingTransferFallsBackToAverage() {
        Quote q = policy.fromBuySell(new BigDecimal("100"), null, new BigDecimal("102")).orElseThrow();

        assertEquals(0, new BigDecimal("101").compareTo(q.mid()));
    }

    @Test
    void missingSideFallsBackToTransfer() {
        Quote q = policy.fromBuySell(null, new BigDecimal("16500"), new BigDecimal("16800")).orElseThrow();

        assertEquals(new BigDecimal("16500"), q.bid());
        assertEquals(new BigDecimal("16500"), q.mid());
        assertEquals(new BigDecimal("16800"), q.ask());
    }

    @Test
    void nothingUsableIsEmpty() {
        assertTrue(policy.fromBuySell(null, null, null).isEmpty());
        assertTrue(policy.fromBuySell(new BigDecimal("1"), null, null).isEmpty());
    }
}
