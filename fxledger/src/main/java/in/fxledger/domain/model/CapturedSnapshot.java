package in.fxledger.domain.model;

/**
 * Adapter result: the snapshot and the identifier it is filed under
 * (e.g. {@code rates}, {@code USD_VND}, {@code VND_X}).
 *
 * @param original the response body as received when the snapshot payload is
 *                 a conversion of it (the VCB XML sheet); null otherwise
 */
public record CapturedSnapshot(
    String identifier,
    RawSnapshot snapshot,
    Original original
) {
    public CapturedSnapshot(String identifier, RawSnapshot snapshot) {
        this(identifier, snapshot, null);
    }

    /**
     * Unconverted response body, stored next to the snapshot.
     *
     * @param extension file extension without the dot, e.g. {@code xml}
     */
    public record Original(String extension, String content) {}
}
