package com.github.dimitryivaniuta.canvas.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.canvas.exception.CanvasApiException;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.support.DigestSupport;
import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Key format (empty parts are left out):
 * <pre>
 *   {prefix}:v1:{METHOD}:{path}?{sorted query}:{md5(Authorization)[0..16]}:{md5(options)[0..16]}
 * </pre>
 * The auth part keeps users from seeing each other's responses. The options part covers extra
 * request headers (except Authorization) and the {@code query} option.
 */
public class DefaultCacheKeyGenerator implements CacheKeyGenerator {

    public static final String DEFAULT_PREFIX = "canvas";

    private static final int HASH_LENGTH = 16;

    private final String prefix;
    private final ObjectMapper objectMapper;

    public DefaultCacheKeyGenerator(ObjectMapper objectMapper) {
        this(DEFAULT_PREFIX, objectMapper);
    }

    public DefaultCacheKeyGenerator(String prefix, ObjectMapper objectMapper) {
        this.prefix = prefix;
        this.objectMapper = objectMapper;
    }

    @Override
    public String generate(CanvasRequest request, RequestOptions options) {
        List<String> parts = new ArrayList<>(List.of(
                prefix,
                "v1",
                request.getMethod(),
                normalizeUrl(request),
                authHash(request),
                optionsHash(options)
        ));
        parts.removeIf(String::isEmpty);
        return String.join(":", parts);
    }

    private static String normalizeUrl(CanvasRequest request) {
        String path = request.getUri().getRawPath();
        String url = (path == null) ? "" : path;

        String query = request.getUri().getRawQuery();
        if (query == null || query.isEmpty()) return url;

        // stable by parameter name; values of repeated names keep their order
        List<String> params = new ArrayList<>(Arrays.asList(query.split("&")));
        params.removeIf(String::isEmpty);
        params.sort((a, b) -> name(a).compareTo(name(b)));

        StringJoiner sorted = new StringJoiner("&");
        params.forEach(sorted::add);
        return url + "?" + sorted;
    }

    private static String name(String param) {
        int eq = param.indexOf('=');
        return eq < 0 ? param : param.substring(0, eq);
    }

    private static String authHash(CanvasRequest request) {
        String auth = request.getHeaderLine(HttpHeaders.AUTHORIZATION);
        if (auth.isEmpty()) return "";
        return DigestSupport.prefix(DigestSupport.md5Hex(auth), HASH_LENGTH);
    }

    private String optionsHash(RequestOptions options) {
        Map<String, Object> affecting = new TreeMap<>();
        options.getMap(RequestOptionKeys.HEADERS).forEach((name, value) -> {
            if (!HttpHeaders.AUTHORIZATION.equalsIgnoreCase(name)) {
                affecting.put("h_" + name, value);
            }
        });
        if (options.has(RequestOptionKeys.QUERY)) {
            affecting.put("query", options.get(RequestOptionKeys.QUERY));
        }
        if (affecting.isEmpty()) return "";

        try {
            return DigestSupport.prefix(DigestSupport.md5Hex(objectMapper.writeValueAsString(affecting)), HASH_LENGTH);
        } catch (JsonProcessingException e) {
            throw new CanvasApiException("Unable to hash request options for cache key", e);
        }
    }
}
