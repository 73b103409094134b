package com.github.dimitryivaniuta.canvas.http.middleware.cache;

import com.github.dimitryivaniuta.canvas.cache.CacheAdapter;
import com.github.dimitryivaniuta.canvas.cache.CacheKeyGenerator;
import com.github.dimitryivaniuta.canvas.cache.CacheStats;
import com.github.dimitryivaniuta.canvas.cache.CachedResponse;
import com.github.dimitryivaniuta.canvas.cache.DefaultCacheKeyGenerator;
import com.github.dimitryivaniuta.canvas.cache.InMemoryCacheAdapter;
import com.github.dimitryivaniuta.canvas.cache.PathTtlStrategy;
import com.github.dimitryivaniuta.canvas.cache.ResponseSerializer;
import com.github.dimitryivaniuta.canvas.cache.TtlStrategy;
import com.github.dimitryivaniuta.canvas.http.CanvasHeaders;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.http.middleware.AbstractMiddleware;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import com.github.dimitryivaniuta.canvas.support.CanvasJson;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Response cache for GET requests, opt-in via {@code enabled}.
 *
 * <p>Mutations (POST/PUT/PATCH/DELETE) on {@code /api/v1/{resource}/{id}} purge cached reads of
 * that resource, its list and, for courses and users, everything beneath it.
 */
@Slf4j
public class CacheMiddleware extends AbstractMiddleware {

    public static final String NAME = "cache";

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final Pattern RESOURCE_PATH = Pattern.compile("/api/v1/(\\w+)/(\\d+)");
    private static final Pattern PARENT_COURSE = Pattern.compile("/courses/(\\d+)/");

    private volatile CacheAdapter adapter;
    private final CacheKeyGenerator keyGenerator;
    private final TtlStrategy ttlStrategy;
    private final PathTtlStrategy ownedTtlStrategy;
    private final ResponseSerializer serializer;
    private final MiddlewareMetrics metrics;

    /** In-memory adapter and default collaborators. */
    public CacheMiddleware(Map<String, ?> config) {
        this(config, new InMemoryCacheAdapter(), null, null, new ResponseSerializer(), MiddlewareMetrics.standalone());
    }

    /**
     * @param keyGenerator null for {@link DefaultCacheKeyGenerator}
     * @param ttlStrategy  null for {@link PathTtlStrategy} with {@code default_ttl}
     */
    public CacheMiddleware(Map<String, ?> config,
                           CacheAdapter adapter,
                           CacheKeyGenerator keyGenerator,
                           TtlStrategy ttlStrategy,
                           ResponseSerializer serializer,
                           MiddlewareMetrics metrics) {
        super(config);
        this.adapter = adapter;
        this.keyGenerator = (keyGenerator != null) ? keyGenerator : new DefaultCacheKeyGenerator(CanvasJson.newMapper());
        this.ownedTtlStrategy = (ttlStrategy != null) ? null : new PathTtlStrategy(getLong("default_ttl", PathTtlStrategy.DEFAULT_TTL));
        this.ttlStrategy = (ttlStrategy != null) ? ttlStrategy : ownedTtlStrategy;
        this.serializer = serializer;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /** A changed {@code default_ttl} also reaches the built-in {@link PathTtlStrategy}. */
    @Override
    public void configure(Map<String, ?> options) {
        super.configure(options);
        // null while the super constructor applies the initial options
        if (ownedTtlStrategy != null) {
            ownedTtlStrategy.setDefaultTtl(getLong("default_ttl", PathTtlStrategy.DEFAULT_TTL));
        }
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        return Map.of(
                "enabled", false,
                "default_ttl", 300,     // seconds
                "cache_get_only", true,
                "cache_success_only", true,
                "invalidate_on_mutation", true
        );
    }

    @Override
    public HttpHandler wrap(HttpHandler next) {
        return (request, options) -> {
            if (!isCachingEnabled(options)) {
                return next.handle(request, options);
            }

            if (getBoolean("cache_get_only", true) && !"GET".equals(request.getMethod())) {
                if (getBoolean("invalidate_on_mutation", true)) {
                    invalidateOnMutation(request);
                }
                return next.handle(request, options);
            }

            String key = keyGenerator.generate(request, options);

            if (!options.isTrue(RequestOptionKeys.CACHE_REFRESH)) {
                Optional<CanvasResponse> cached = adapter.get(key).flatMap(serializer::deserialize);
                if (cached.isPresent()) {
                    log.debug("Cache hit {}", key);
                    metrics.cacheHit();
                    return cached.get().withHeader(CanvasHeaders.CACHE_STATUS, CanvasHeaders.CACHE_HIT);
                }
                metrics.cacheMiss();
            }

            CanvasResponse response = next.handle(request, options);
            store(key, request, options, response);
            return response;
        };
    }

    /** Glob patterns purged by a mutating request on {@code path}. */
    public static List<String> invalidationPatterns(String path) {
        List<String> patterns = new ArrayList<>();
        Matcher m = RESOURCE_PATH.matcher(path);
        if (!m.find()) return patterns;

        String resource = m.group(1);
        String id = m.group(2);
        patterns.add("*:GET:/api/v1/" + resource + "*");
        patterns.add("*:GET:/api/v1/" + resource + "/" + id + "*");

        switch (resource) {
            case "courses" -> patterns.add("*:GET:/api/v1/courses/" + id + "/*");
            case "users" -> patterns.add("*:GET:/api/v1/users/" + id + "/*");
            case "assignments", "modules", "pages" -> {
                Matcher course = PARENT_COURSE.matcher(path);
                if (course.find()) {
                    patterns.add("*:GET:/api/v1/courses/" + course.group(1) + "/*");
                }
            }
            default -> {
                // no related subtrees
            }
        }
        return patterns;
    }

    public CacheStats getStatistics() {
        return adapter.getStats();
    }

    public void clearCache() {
        adapter.clear();
    }

    public CacheAdapter getAdapter() {
        return adapter;
    }

    public void setAdapter(CacheAdapter adapter) {
        this.adapter = adapter;
    }

    private boolean isCachingEnabled(RequestOptions options) {
        if (options.isFalse(RequestOptionKeys.CACHE)) return false;
        return getBoolean("enabled", false);
    }

    private void store(String key, CanvasRequest request, RequestOptions options, CanvasResponse response) {
        if (getBoolean("cache_success_only", true) && !response.isSuccessful()) return;

        long ttl = ttlStrategy.getTtl(request, options);
        if (ttl <= 0) return;

        CachedResponse entry = serializer.serialize(response);
        if (!entry.cacheable()) {
            log.debug("Not caching {}: {}", key, entry.notCacheableReason());
            return;
        }
        adapter.set(key, entry, ttl);
    }

    private void invalidateOnMutation(CanvasRequest request) {
        if (!MUTATING_METHODS.contains(request.getMethod())) return;

        String path = request.getUri().getPath();
        List<String> patterns = invalidationPatterns(path == null ? "" : path);
        if (patterns.isEmpty()) return;

        int removed = 0;
        for (String pattern : patterns) {
            removed += adapter.deleteByPattern(pattern);
        }
        Matcher m = RESOURCE_PATH.matcher(path);
        String resource = m.find() ? m.group(1) : "unknown";
        metrics.cacheInvalidated(resource, removed);
        log.debug("Invalidated {} cache entries after {} {}", removed, request.getMethod(), path);
    }
}
