package in.fxledger.service.normalize;

/**
 * A sample the normalizer dropped. Counted, never inserted.
 *
 * @param index position of the sample in the source payload
 */
public record SampleSkipped(int index, String reason) {}
