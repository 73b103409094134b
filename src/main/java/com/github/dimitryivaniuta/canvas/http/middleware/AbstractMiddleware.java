package com.github.dimitryivaniuta.canvas.http.middleware;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layered configuration shared by all middleware: defaults, then construction-time options, then
 * every later {@link #configure(Map)} call, newest winning.
 */
public abstract class AbstractMiddleware implements Middleware {

    private volatile Map<String, Object> config = Map.of();

    protected AbstractMiddleware(Map<String, ?> config) {
        configure(config);
    }

    @Override
    public void configure(Map<String, ?> options) {
        Map<String, Object> merged = new LinkedHashMap<>(getDefaultConfig());
        merged.putAll(this.config);
        if (options != null) {
            options.forEach((k, v) -> {
                if (v != null) merged.put(k, v);
            });
        }
        this.config = Collections.unmodifiableMap(merged);
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        return Map.of();
    }

    @Override
    public Map<String, Object> getConfig() {
        return config;
    }

    protected Object getConfig(String key, Object defaultValue) {
        Object v = config.get(key);
        return (v == null) ? defaultValue : v;
    }

    protected boolean getBoolean(String key, boolean defaultValue) {
        Object v = config.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s && !s.isBlank()) return Boolean.parseBoolean(s.trim());
        return defaultValue;
    }

    protected long getLong(String key, long defaultValue) {
        Object v = config.get(key);
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    protected int getInt(String key, int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    protected double getDouble(String key, double defaultValue) {
        Object v = config.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    protected List<String> getStringList(String key) {
        Object v = config.get(key);
        if (!(v instanceof Collection<?> c)) return List.of();
        return c.stream().filter(e -> e != null).map(Object::toString).toList();
    }

    protected Set<Integer> getIntSet(String key) {
        Object v = config.get(key);
        if (!(v instanceof Collection<?> c)) return Set.of();
        Set<Integer> out = new LinkedHashSet<>();
        for (Object e : c) {
            if (e instanceof Number n) {
                out.add(n.intValue());
            } else if (e != null && e.toString().trim().matches("\\d+")) {
                out.add(Integer.parseInt(e.toString().trim()));
            }
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + "]";
    }
}
