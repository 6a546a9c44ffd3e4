package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Timestamp fields as providers send them: epoch millis, or ISO-8601 with or
 * without an offset (no offset means UTC).
 */
final class Timestamps {

    static Instant parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        return node.isTextual() ? parse(node.asText()) : null;
    }

    static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value + "Z");
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private Timestamps() {}
}
