package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.Quote;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.domain.model.SpreadPolicy;
import in.fxledger.domain.model.TickCandidate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * VietcomBank rate sheet.
 *
 * <pre>
 * { "ExrateList": {
 *     "DateTime": "1/29/2026 4:45:00 PM",
 *     "Exrate": [ { "@_CurrencyCode": "USD", "@_Buy": "25,100.00",
 *                   "@_Transfer": "25,130.00", "@_Sell": "25,400.00" } ] } }
 * </pre>
 *
 * Every row is quoted against VND. All rows of a sheet share the sheet's DateTime,
 * which is local time of the bank.
 */
public final class VcbNormalizer implements SourceNormalizer {
    static final String QUOTE_CURRENCY = "VND";

    private static final DateTimeFormatter SHEET_TIME =
        DateTimeFormatter.ofPattern("M/d/yyyy h:mm:ss a", Locale.US);

    private final SpreadPolicy spreadPolicy;
    private final ZoneId sheetZone;

    public VcbNormalizer(SpreadPolicy spreadPolicy, ZoneId sheetZone) {
        this.spreadPolicy = spreadPolicy;
        this.sheetZone = sheetZone;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.VCB;
    }

    @Override
    public NormalizationResult normalize(JsonNode payload, Instant captureTime) {
        String source = kind().sourceName();
        JsonNode list = payload == null ? null : payload.get("ExrateList");
        if (list == null || !list.isObject()) {
            throw new MalformedPayloadException(source, "missing ExrateList");
        }
        Instant sheetTime = parseSheetTime(source, text(list, "DateTime"));

        NormalizationResult.Builder result = NormalizationResult.builder(source);
        List<JsonNode> rows = rows(list.get("Exrate"));
        for (int i = 0; i < rows.size(); i++) {
            JsonNode row = rows.get(i);
            String code = text(row, "CurrencyCode");
            if (code == null || code.isBlank()) {
                result.skip(i, "missing currency code");
                continue;
            }
            code = code.trim().toUpperCase(Locale.ROOT);
            if (code.length() != 3 || QUOTE_CURRENCY.equals(code)) {
                result.skip(i, "unsupported currency code " + code);
                continue;
            }
            BigDecimal buy = RateParser.parse(text(row, "Buy"));
            BigDecimal transfer = RateParser.parse(text(row, "Transfer"));
            BigDecimal sell = RateParser.parse(text(row, "Sell"));

            Optional<Quote> quote = spreadPolicy.fromBuySell(buy, transfer, sell);
            if (quote.isEmpty()) {
                result.skip(i, "no usable rate for " + code);
                continue;
            }
            result.add(TickCandidate.of(code, QUOTE_CURRENCY, sheetTime, quote.get(), null));
        }
        return result.build();
    }

    private Instant parseSheetTime(String source, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedPayloadException(source, "missing ExrateList.DateTime");
        }
        try {
            return LocalDateTime.parse(raw.trim(), SHEET_TIME).atZone(sheetZone).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException(source, "unparseable DateTime: " + raw, e);
        }
    }

    // XML converted attributes carry an "@_" prefix; plain names are accepted too.
    private static String text(JsonNode node, String name) {
        JsonNode value = node.get("@_" + name);
        if (value == null || value.isNull()) {
            value = node.get(name);
        }
        if (value == null || value.isNull()) return null;
        if (value.isObject() && value.has("#text")) {
            value = value.get("#text");
        }
        return value.isValueNode() ? value.asText() : null;
    }

    private static List<JsonNode> rows(JsonNode exrate) {
        List<JsonNode> rows = new ArrayList<>();
        if (exrate == null || exrate.isNull()) return rows;
        if (exrate.isArray()) {
            exrate.forEach(rows::add);
        } else if (exrate.isObject()) {
            rows.add(exrate);
        }
        return rows;
    }
}
