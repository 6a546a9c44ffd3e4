package in.fxledger.service.normalize;

import in.fxledger.config.IngestConfig;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.domain.model.SpreadPolicy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One normalizer per {@link SourceKind}.
 */
public final class NormalizerRegistry {

    private final Map<SourceKind, SourceNormalizer> normalizers = new EnumMap<>(SourceKind.class);

    public NormalizerRegistry(List<SourceNormalizer> normalizers) {
        for (SourceNormalizer n : normalizers) {
            if (this.normalizers.put(n.kind(), n) != null) {
                throw new IllegalArgumentException("Duplicate normalizer for " + n.kind());
            }
        }
        for (SourceKind kind : SourceKind.values()) {
            if (!this.normalizers.containsKey(kind)) {
                throw new IllegalArgumentException("No normalizer for " + kind);
            }
        }
    }

    public static NormalizerRegistry create(IngestConfig config) {
        SpreadPolicy spread = new SpreadPolicy(config.syntheticSpread());
        return new NormalizerRegistry(List.of(
            new VcbNormalizer(spread, config.vcbZone()),
            new XeChartNormalizer(spread, config.rateFloor()),
            new YahooChartNormalizer(spread),
            new ReutersQuoteNormalizer(spread)
        ));
    }

    public SourceNormalizer forKind(SourceKind kind) {
        return normalizers.get(kind);
    }
}
