package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.SpreadPolicy;
import in.fxledger.domain.model.TickCandidate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ReutersQuoteNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ReutersQuoteNormalizer normalizer = new ReutersQuoteNormalizer(SpreadPolicy.defaults());

    private JsonNode quote(String lastTrade) throws Exception {
        return mapper.readTree("""
            { "data": { "data": { "elements": [
                { "resource": "Xref", "data": { "symbol": "VND=" } },
                { "resource": "Quote", "data": { "lastTrade": %s } }
            ] } } }
            """.formatted(lastTrade));
    }

    @Test
    void openDifferentFromLastAddsBackdatedTick() throws Exception {
        NormalizationResult result = normalizer.normalize(
            quote("{ \"date\": \"2026-01-29T09:00:00Z\", \"last\": 26150, \"open\": 26100 }"), Instant.now());

        assertEquals(2, result.candidates().size());
        TickCandidate last = result.candidates().get(0);
        TickCandidate open = result.candidates().get(1);
        assertEquals("USDVND", last.symbol());
        assertEquals(Instant.parse("2026-01-29T09:00:00Z"), last.time());
        assertEquals(0, new BigDecimal("26150").compareTo(last.mid()));
        assertEquals(Instant.parse("2026-01-29T08:00:00Z"), open.time());
        assertEquals(0, new BigDecimal("26100").compareTo(open.mid()));
    }

    @Test
    void openEqualToLastYieldsSingleTick() throws Exception {
        NormalizationResult result = normalizer.normalize(
            quote("{ \"date\": \"2026-01-29T09:00:00Z\", \"last\": 26150, \"open\": 26150.0 }"), Instant.now());

        assertEquals(1, result.candidates().size());
    }

    @Test
    void closeUsedWhenLastMissing() throws Exception {
        NormalizationResult result = normalizer.normalize(
            quote("{ \"date\": 1769677200000, \"close\": 26140 }"), Instant.now());

        assertEquals(1, result.candidates().size());
        assertEquals(0, new BigDecimal("26140").compareTo(result.candidates().get(0).mid()));
        assertEquals(Instant.ofEpochMilli(1769677200000L), result.candidates().get(0).time());
    }

    @Test
    void noPriceIsMalformed() throws Exception {
        JsonNode payload = quote("{ \"date\": \"2026-01-29T09:00:00Z\" }");

        assertThrows(MalformedPayloadException.class, () -> normalizer.normalize(payload, Instant.now()));
    }

    @Test
    void noDateIsMalformed() throws Exception {
        JsonNode payload = quote("{ \"last\": 26150 }");

        assertThrows(MalformedPayloadException.class, () -> normalizer.normalize(payload, Instant.now()));
    }

    @Test
    void elementsAtRootAccepted() throws Exception {
        JsonNode payload = mapper.readTree("""
            { "elements": [
                { "resource": "Quote", "data": { "lastTrade": { "date": "2026-01-29T09:00:00Z", "last": 1.08 } } },
                { "resource": "Xref", "data": { "symbol": "EURUSD=" } } ] }
            """);

        assertEquals("EURUSD", normalizer.normalize(payload, Instant.now()).candidates().get(0).symbol());
    }

    @Test
    void missingElementsIsMalformed() throws Exception {
        assertThrows(MalformedPayloadException.class,
            () -> normalizer.normalize(mapper.readTree("{\"data\":{}}"), Instant.now()));
    }
}
