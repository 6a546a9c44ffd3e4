package in.fxledger.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Source payload exactly as captured, plus when and how it was captured.
 */
public record RawSnapshot(
    JsonNode payload,
    Instant capturedAt,
    CaptureMethod method
) {}
