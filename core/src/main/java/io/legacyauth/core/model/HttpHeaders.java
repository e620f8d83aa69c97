package io.legacyauth.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, case-insensitive HTTP header collection.
 *
 * <p>
 * A core-owned port type with zero third-party dependencies. Unlike a map, it
 * keeps every field in arrival order, preserves the original spelling of each
 * name and never merges duplicates: two {@code Authorization} fields stay two
 * fields.
 *
 * <p>
 * The class is immutable. {@link #append(String, String)} returns a new
 * instance and leaves the receiver untouched, so a header set handed to the
 * pipeline can be shared freely.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(List.of());

    /** A single header line. Name matching is case-insensitive. */
    public record Field(String name, String value) {

        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        /** True if this field has the given name, ignoring case. */
        public boolean hasName(String other) {
            return name.equalsIgnoreCase(other);
        }
    }

    private final List<Field> fields;

    private HttpHeaders(List<Field> fields) {
        this.fields = fields;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        for (Field field : fields) {
            if (field.hasName(name)) {
                return field.value();
            }
        }
        return null;
    }

    /**
     * All values for a header name (case-insensitive), in arrival order.
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = new ArrayList<>();
        for (Field field : fields) {
            if (field.hasName(name)) {
                values.add(field.value());
            }
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * True if at least one field with this name exists (case-insensitive).
     * Values are not inspected.
     */
    public boolean contains(String name) {
        for (Field field : fields) {
            if (field.hasName(name)) {
                return true;
            }
        }
        return false;
    }

    /** All fields in arrival order. */
    public List<Field> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns a copy with one more field at the end. Existing fields with the
     * same name are kept.
     *
     * @param name  header name
     * @param value header value
     * @return a new {@code HttpHeaders}
     */
    public HttpHeaders append(String name, String value) {
        List<Field> copy = new ArrayList<>(fields.size() + 1);
        copy.addAll(fields);
        copy.add(new Field(name, value));
        return new HttpHeaders(Collections.unmodifiableList(copy));
    }

    /**
     * All-values-per-name view with lowercase keys, ordered by first
     * appearance.
     *
     * @return an unmodifiable map
     */
    public Map<String, List<String>> toMultiValueMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Field field : fields) {
            result.computeIfAbsent(field.name().toLowerCase(), k -> new ArrayList<>())
                    .add(field.value());
        }
        result.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(result);
    }

    // ── Factory methods ──

    /**
     * Creates headers from an ordered list of fields.
     *
     * @param fields header fields in arrival order
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(List<Field> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new HttpHeaders(List.copyOf(fields));
    }

    /**
     * Creates headers from a multi-value map. Map iteration order decides the
     * field order, so pass a {@link LinkedHashMap} when order matters.
     *
     * @param multiValue header name → list of values
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        List<Field> list = new ArrayList<>();
        multiValue.forEach((name, values) -> values.forEach(value -> list.add(new Field(name, value))));
        return new HttpHeaders(Collections.unmodifiableList(list));
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>(fields.size());
        fields.forEach(f -> names.add(f.name()));
        return "HttpHeaders" + names;
    }
}
