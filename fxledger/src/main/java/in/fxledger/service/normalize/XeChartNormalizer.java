package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.domain.model.SpreadPolicy;
import in.fxledger.domain.model.TickCandidate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * XE.com charting series plus optional mid-market spot rate.
 *
 * Sample {@code i} of a batch is stamped {@code startTime + i * interval}.
 * XE only publishes a single rate, so bid/ask are synthesized.
 */
public final class XeChartNormalizer implements SourceNormalizer {

    private final SpreadPolicy spreadPolicy;
    private final BigDecimal rateFloor;

    public XeChartNormalizer(SpreadPolicy spreadPolicy, BigDecimal rateFloor) {
        this.spreadPolicy = spreadPolicy;
        this.rateFloor = rateFloor;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.XE;
    }

    @Override
    public NormalizationResult normalize(JsonNode payload, Instant captureTime) {
        String source = kind().sourceName();
        if (payload == null || !payload.isObject()) {
            throw new MalformedPayloadException(source, "payload is not an object");
        }
        String from = currency(source, payload, "fromCurrency");
        String to = currency(source, payload, "toCurrency");

        NormalizationResult.Builder result = NormalizationResult.builder(source);
        int index = 0;
        JsonNode batches = payload.path("charting").path("batchList");
        if (batches.isArray()) {
            for (JsonNode batch : batches) {
                JsonNode start = batch.get("startTime");
                JsonNode interval = batch.get("interval");
                if (start == null || !start.canConvertToLong() || interval == null || !interval.canConvertToLong()) {
                    throw new MalformedPayloadException(source, "chart batch without startTime/interval");
                }
                long startMillis = start.asLong();
                long intervalMillis = interval.asLong();
                JsonNode rates = batch.path("rates");
                for (int i = 0; i < rates.size(); i++, index++) {
                    BigDecimal rate = RateParser.parse(rates.get(i));
                    if (rate == null || rate.compareTo(rateFloor) <= 0) {
                        result.skip(index, "rate missing or below floor");
                        continue;
                    }
                    Instant time = Instant.ofEpochMilli(startMillis + i * intervalMillis);
                    result.add(TickCandidate.of(from, to, time, spreadPolicy.fromMid(rate), null));
                }
            }
        }

        JsonNode spot = payload.path("midmarket").path("rates").path(to);
        if (!spot.isMissingNode()) {
            BigDecimal rate = RateParser.parse(spot.get("rate"));
            if (rate == null || rate.compareTo(rateFloor) <= 0) {
                result.skip(index, "mid-market rate missing or below floor");
            } else {
                Instant captured = Timestamps.parse(payload.get("capturedAt"));
                Instant time = captured != null ? captured : captureTime;
                result.add(TickCandidate.of(from, to, time, spreadPolicy.fromMid(rate), null));
            }
        }
        return result.build();
    }

    private static String currency(String source, JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual() || node.asText().trim().length() != 3) {
            throw new MalformedPayloadException(source, "missing or invalid " + field);
        }
        return node.asText().trim().toUpperCase(Locale.ROOT);
    }
}
