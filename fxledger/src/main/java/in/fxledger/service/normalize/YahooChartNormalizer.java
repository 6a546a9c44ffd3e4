package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.CurrencyPair;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.domain.model.SpreadPolicy;
import in.fxledger.domain.model.TickCandidate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

/**
 * Yahoo Finance v8 chart (OHLCV bars).
 *
 * mid is the bar's close, falling back to open, then to (high + low) / 2.
 */
public final class YahooChartNormalizer implements SourceNormalizer {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final SpreadPolicy spreadPolicy;

    public YahooChartNormalizer(SpreadPolicy spreadPolicy) {
        this.spreadPolicy = spreadPolicy;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.YAHOO;
    }

    @Override
    public NormalizationResult normalize(JsonNode payload, Instant captureTime) {
        String source = kind().sourceName();
        JsonNode result0 = payload == null ? null : payload.path("chart").path("result").path(0);
        if (result0 == null || !result0.isObject()) {
            throw new MalformedPayloadException(source, "missing chart.result[0]");
        }
        JsonNode symbol = result0.path("meta").path("symbol");
        if (!symbol.isTextual()) {
            throw new MalformedPayloadException(source, "missing meta.symbol");
        }
        CurrencyPair pair = SymbolDecoder.decode(source, symbol.asText());

        JsonNode timestamps = result0.path("timestamp");
        if (!timestamps.isArray()) {
            throw new MalformedPayloadException(source, "missing timestamp array");
        }
        JsonNode quote = result0.path("indicators").path("quote").path(0);
        if (!quote.isObject()) {
            throw new MalformedPayloadException(source, "missing indicators.quote[0]");
        }

        NormalizationResult.Builder result = NormalizationResult.builder(source);
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode ts = timestamps.get(i);
            if (ts == null || !ts.canConvertToLong()) {
                result.skip(i, "missing timestamp");
                continue;
            }
            BigDecimal mid = mid(quote, i);
            if (mid == null) {
                result.skip(i, "no open/high/low/close");
                continue;
            }
            BigDecimal volume = RateParser.parse(quote.path("volume").path(i));
            Instant time = Instant.ofEpochSecond(ts.asLong());
            result.add(TickCandidate.of(pair.baseCurrency(), pair.quoteCurrency(), time,
                spreadPolicy.fromMid(mid), volume));
        }
        return result.build();
    }

    private static BigDecimal mid(JsonNode quote, int i) {
        BigDecimal close = RateParser.parse(quote.path("close").path(i));
        if (close != null) return close;
        BigDecimal open = RateParser.parse(quote.path("open").path(i));
        if (open != null) return open;
        BigDecimal high = RateParser.parse(quote.path("high").path(i));
        BigDecimal low = RateParser.parse(quote.path("low").path(i));
        if (high == null || low == null) return null;
        return high.add(low, MathContext.DECIMAL64).divide(TWO, MathContext.DECIMAL64);
    }
}
