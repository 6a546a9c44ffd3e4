package in.fxledger.service.normalize;

import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.TickCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidates produced from one payload, plus the samples that were skipped.
 */
public record NormalizationResult(
    List<TickCandidate> candidates,
    List<SampleSkipped> skipped
) {
    public NormalizationResult {
        candidates = List.copyOf(candidates);
        skipped = List.copyOf(skipped);
    }

    public static Builder builder(String source) {
        return new Builder(source);
    }

    /**
     * Accumulates candidates. {@link #build()} rejects a payload that produced nothing.
     */
    public static final class Builder {
        private static final Logger log = LoggerFactory.getLogger(NormalizationResult.class);

        private final String source;
        private final List<TickCandidate> candidates = new ArrayList<>();
        private final List<SampleSkipped> skipped = new ArrayList<>();

        private Builder(String source) {
            this.source = source;
        }

        public Builder add(TickCandidate candidate) {
            candidates.add(candidate);
            return this;
        }

        public Builder skip(int index, String reason) {
            log.debug("[{}] skipped sample {}: {}", source, index, reason);
            skipped.add(new SampleSkipped(index, reason));
            return this;
        }

        public NormalizationResult build() {
            if (candidates.isEmpty()) {
                throw new MalformedPayloadException(source,
                    "payload produced no tick candidates (" + skipped.size() + " sample(s) skipped)");
            }
            return new NormalizationResult(candidates, skipped);
        }
    }
}
