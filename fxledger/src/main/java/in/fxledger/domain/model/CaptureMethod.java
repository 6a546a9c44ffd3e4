package in.fxledger.domain.model;

/**
 * How a raw snapshot was captured. Normalizers treat both shapes identically.
 */
public enum CaptureMethod {
    DIRECT_API("direct-api"),
    BROWSER("browser");

    private final String wireName;

    CaptureMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parse the tag written by the source adapter. Unknown or missing tags are
     * treated as direct API captures.
     */
    public static CaptureMethod fromWire(String value) {
        if (value == null) return DIRECT_API;
        for (CaptureMethod m : values()) {
            if (m.wireName.equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        return DIRECT_API;
    }
}
