package in.fxledger.domain.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable job payload: a string-keyed map serialized as a JSON object.
 *
 * Well-known keys: {@code autoImport}, {@code identifier}, {@code mode},
 * {@code symbol}, {@code fromCurrency}, {@code toCurrency}, {@code interval}, {@code xid}.
 */
public final class JobOptions {
    public static final String AUTO_IMPORT = "autoImport";
    public static final String IDENTIFIER = "identifier";
    public static final String MODE = "mode";
    public static final String SYMBOL = "symbol";
    public static final String FROM_CURRENCY = "fromCurrency";
    public static final String TO_CURRENCY = "toCurrency";
    public static final String INTERVAL = "interval";
    public static final String XID = "xid";

    private static final JobOptions EMPTY = new JobOptions(Map.of());

    private final Map<String, Object> values;

    private JobOptions(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @JsonCreator
    public static JobOptions of(Map<String, Object> values) {
        return values == null || values.isEmpty() ? EMPTY : new JobOptions(values);
    }

    public static JobOptions empty() {
        return EMPTY;
    }

    public JobOptions with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new JobOptions(copy);
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        if (value == null) return Optional.empty();
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public String getString(String key, String defaultValue) {
        return getString(key).orElse(defaultValue);
    }

    public boolean getBoolean(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean) return (Boolean) value;
        return value != null && ("true".equalsIgnoreCase(value.toString()) || "1".equals(value.toString()));
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobOptions)) return false;
        return values.equals(((JobOptions) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
