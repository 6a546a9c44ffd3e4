package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.CurrencyPair;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.domain.model.SpreadPolicy;
import in.fxledger.domain.model.TickCandidate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Reuters single quote (markitdigital universal app response).
 *
 * Produces one tick for the last trade and, when the session open differs from
 * it, one more tick for the open. The open tick's time is approximated as one
 * hour before the last trade; the payload carries no open timestamp.
 */
public final class ReutersQuoteNormalizer implements SourceNormalizer {
    static final Duration OPEN_OFFSET = Duration.ofHours(1);

    private final SpreadPolicy spreadPolicy;

    public ReutersQuoteNormalizer(SpreadPolicy spreadPolicy) {
        this.spreadPolicy = spreadPolicy;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.REUTERS;
    }

    @Override
    public NormalizationResult normalize(JsonNode payload, Instant captureTime) {
        String source = kind().sourceName();
        JsonNode elements = elements(payload);
        if (elements == null) {
            throw new MalformedPayloadException(source, "no elements list");
        }
        JsonNode lastTrade = null;
        String symbol = null;
        for (JsonNode element : elements) {
            String resource = element.path("resource").asText("");
            if ("Quote".equals(resource) && element.path("data").path("lastTrade").isObject()) {
                lastTrade = element.path("data").path("lastTrade");
            } else if ("Xref".equals(resource) && element.path("data").path("symbol").isTextual()) {
                symbol = element.path("data").path("symbol").asText();
            }
        }
        if (lastTrade == null || symbol == null) {
            throw new MalformedPayloadException(source, "no quote data found");
        }
        CurrencyPair pair = SymbolDecoder.decode(source, symbol);

        Instant time = Timestamps.parse(lastTrade.get("date"));
        if (time == null) {
            throw new MalformedPayloadException(source, "lastTrade has no usable date");
        }
        BigDecimal last = RateParser.parse(lastTrade.get("last"));
        if (last == null) {
            last = RateParser.parse(lastTrade.get("close"));
        }
        if (last == null) {
            throw new MalformedPayloadException(source, "no price data available");
        }

        NormalizationResult.Builder result = NormalizationResult.builder(source);
        result.add(TickCandidate.of(pair.baseCurrency(), pair.quoteCurrency(), time,
            spreadPolicy.fromMid(last), null));

        BigDecimal open = RateParser.parse(lastTrade.get("open"));
        if (open != null && open.compareTo(last) != 0) {
            result.add(TickCandidate.of(pair.baseCurrency(), pair.quoteCurrency(), time.minus(OPEN_OFFSET),
                spreadPolicy.fromMid(open), null));
        }
        return result.build();
    }

    private static JsonNode elements(JsonNode payload) {
        if (payload == null) return null;
        JsonNode[] candidates = {
            payload.path("elements"),
            payload.path("data").path("elements"),
            payload.path("data").path("data").path("elements")
        };
        for (JsonNode candidate : candidates) {
            if (candidate.isArray()) return candidate;
        }
        return null;
    }
}
