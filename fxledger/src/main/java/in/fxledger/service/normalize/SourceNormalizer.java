package in.fxledger.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import in.fxledger.domain.model.SourceKind;

import java.time.Instant;

/**
 * Turns one provider's raw payload into canonical tick candidates.
 *
 * Implementations are pure: no I/O, no shared state. A payload missing
 * structurally required fields, or yielding zero candidates, raises
 * {@link in.fxledger.domain.common.MalformedPayloadException}; individual bad
 * samples are recorded as {@link SampleSkipped}.
 */
public interface SourceNormalizer {

    SourceKind kind();

    /**
     * @param payload raw payload tree
     * @param captureTime when the payload was captured; used where the payload carries no time
     */
    NormalizationResult normalize(JsonNode payload, Instant captureTime);
}
