package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Lenient numeric parsing for provider rate fields.
 *
 * Returns null for anything that is not a usable rate: missing, JSON null,
 * blank, "-" (no quote), non-numeric, zero or negative.
 */
public final class RateParser {

    public static BigDecimal parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) {
            return positive(node.decimalValue());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        return null;
    }

    public static BigDecimal parse(String raw) {
        if (raw == null) return null;
        String cleaned = raw.trim().replace(",", "");
        if (cleaned.isEmpty() || "-".equals(cleaned)) return null;
        try {
            return positive(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal positive(BigDecimal value) {
        return value.signum() > 0 ? value : null;
    }

    private RateParser() {}
}
