package com.github.dimitryivaniuta.canvas.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-request options: an open, immutable string-keyed map threaded through the pipeline.
 * Middleware read the keys they understand (see {@link RequestOptionKeys}) and pass the rest along.
 */
public final class RequestOptions {

    private static final RequestOptions EMPTY = new RequestOptions(Map.of());

    private final Map<String, Object> values;

    private RequestOptions(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RequestOptions empty() {
        return EMPTY;
    }

    public static RequestOptions of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (v != null) copy.put(k, v);
        });
        return new RequestOptions(copy);
    }

    /** Copy with {@code key} set; a null value removes the key. */
    public RequestOptions with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new RequestOptions(copy);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<String> getString(String key) {
        Object v = values.get(key);
        return (v instanceof String s && !s.isEmpty()) ? Optional.of(s) : Optional.empty();
    }

    /** True only when the option is present and boolean true. */
    public boolean isTrue(String key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    /** True only when the option is present and boolean false. */
    public boolean isFalse(String key) {
        return Boolean.FALSE.equals(values.get(key));
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object v = values.get(key);
        return (v instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "RequestOptions" + values.keySet();
    }
}
