package com.github.dimitryivaniuta.canvas.cache;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * TTL by URL path. Rules are regexes tried in insertion order against the path (case-insensitive,
 * unanchored); the first match wins.
 *
 * <p>Per-request overrides: {@code cache_ttl} sets the TTL outright, {@code cache=false} gives 0.
 */
public class PathTtlStrategy implements TtlStrategy {

    public static final long DEFAULT_TTL = 300;

    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private volatile long defaultTtl;

    private record Rule(Pattern pattern, long ttl) {}

    public PathTtlStrategy() {
        this(DEFAULT_TTL);
    }

    public PathTtlStrategy(long defaultTtl) {
        this.defaultTtl = defaultTtl;

        // static: 1h
        addRule("/courses$", 3600);
        addRule("/accounts", 3600);
        addRule("/terms", 3600);
        addRule("/roles", 3600);

        // semi-static: 15 min
        addRule("/enrollments", 900);
        addRule("/sections", 900);
        addRule("/users$", 900);
        addRule("/groups$", 900);

        // dynamic: 5 min
        addRule("/assignments", 300);
        addRule("/modules", 300);
        addRule("/pages", 300);
        addRule("/discussions", 300);
        addRule("/announcements", 300);
        addRule("/files", 300);
        addRule("/folders", 300);

        // real-time: 1 min or never
        addRule("/submissions", 60);
        addRule("/grades", 0);
        addRule("/quiz_submissions", 0);
        addRule("/progress", 0);
        addRule("/live_assessments", 0);

        addRule("/courses/\\d+$", 900);
        addRule("/courses/\\d+/students", 300);
        addRule("/courses/\\d+/activity_stream", 60);
    }

    @Override
    public long getTtl(CanvasRequest request, RequestOptions options) {
        if (options.has(RequestOptionKeys.CACHE_TTL)) {
            return options.getInt(RequestOptionKeys.CACHE_TTL, 0);
        }
        if (options.isFalse(RequestOptionKeys.CACHE)) {
            return 0;
        }
        String path = request.getUri().getPath();
        return getTtlForPath(path == null ? "" : path);
    }

    public synchronized long getTtlForPath(String path) {
        for (Rule rule : rules.values()) {
            if (rule.pattern().matcher(path).find()) {
                return rule.ttl();
            }
        }
        return defaultTtl;
    }

    /** Adds a rule, or changes the TTL of an existing one in place. New rules go last. */
    public synchronized void addRule(String regex, long ttl) {
        rules.put(regex, new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), ttl));
    }

    public synchronized void removeRule(String regex) {
        rules.remove(regex);
    }

    /** Rule regex to TTL, in match order. */
    public synchronized Map<String, Long> getRules() {
        Map<String, Long> out = new LinkedHashMap<>();
        rules.forEach((regex, rule) -> out.put(regex, rule.ttl()));
        return Collections.unmodifiableMap(out);
    }

    public long getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(long defaultTtl) {
        this.defaultTtl = defaultTtl;
    }
}
