package com.github.dimitryivaniuta.canvas.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.exception.CanvasApiException;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.exception.MissingApiKeyException;
import com.github.dimitryivaniuta.canvas.exception.MissingBaseUrlException;
import com.github.dimitryivaniuta.canvas.exception.MissingOAuthTokenException;
import com.github.dimitryivaniuta.canvas.http.middleware.MiddlewareStack;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Entry point for Canvas REST calls. Builds the request from a path and options, then runs it
 * through the middleware chain composed once at construction.
 *
 * <p>Options (all optional): {@code query} (map), {@code headers} (map), one of {@code json},
 * {@code form_params} (map) or {@code body} (String, byte[], InputStream or {@link RequestBody}),
 * {@code skip_auth}, plus whatever the middleware read.
 */
@Slf4j
public class CanvasHttpClient {

    private final CanvasCredentials credentials;
    private final MiddlewareStack stack;
    private final HttpHandler handler;
    private final ObjectMapper objectMapper;
    private final MiddlewareMetrics metrics;

    public CanvasHttpClient(CanvasCredentials credentials,
                            MiddlewareStack stack,
                            HttpHandler transport,
                            ObjectMapper objectMapper,
                            MiddlewareMetrics metrics) {
        this.credentials = credentials;
        this.stack = stack;
        this.handler = stack.compose(transport);
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public CanvasResponse get(String path) {
        return request("GET", path, Map.of());
    }

    public CanvasResponse get(String path, Map<String, ?> options) {
        return request("GET", path, options);
    }

    public CanvasResponse post(String path, Map<String, ?> options) {
        return request("POST", path, options);
    }

    public CanvasResponse put(String path, Map<String, ?> options) {
        return request("PUT", path, options);
    }

    public CanvasResponse patch(String path, Map<String, ?> options) {
        return request("PATCH", path, options);
    }

    public CanvasResponse delete(String path) {
        return request("DELETE", path, Map.of());
    }

    public CanvasResponse delete(String path, Map<String, ?> options) {
        return request("DELETE", path, options);
    }

    public CanvasResponse request(String method, String path, Map<String, ?> rawOptions) {
        RequestOptions options = RequestOptions.of(rawOptions);
        CanvasRequest request = buildRequest(method, path, options);

        long startNs = System.nanoTime();
        int status = 0;
        try {
            CanvasResponse response = handler.handle(request, options);
            status = response.getStatusCode();
            return response;
        } catch (HttpResponseException e) {
            status = e.getStatusCode();
            throw e;
        } finally {
            metrics.recordDuration(request.getMethod(), status, System.nanoTime() - startNs);
        }
    }

    public MiddlewareStack getStack() {
        return stack;
    }

    CanvasRequest buildRequest(String method, String path, RequestOptions options) {
        boolean skipAuth = options.isTrue(RequestOptionKeys.SKIP_AUTH);

        String token = null;
        if (!skipAuth) {
            token = credentials.activeCredential().orElseThrow(() -> credentials.isOAuth()
                    ? new MissingOAuthTokenException("OAuth access token is not configured")
                    : new MissingApiKeyException());
        }

        URI uri = resolveUri(path, options.getMap(RequestOptionKeys.QUERY));

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        options.getMap(RequestOptionKeys.HEADERS).forEach((name, value) -> {
            if (value instanceof Collection<?> values) {
                values.forEach(v -> headers.add(name, String.valueOf(v)));
            } else if (value != null) {
                headers.set(name, String.valueOf(value));
            }
        });
        if (token != null) {
            headers.setBearerAuth(token);
        }

        RequestBody body = buildBody(options, headers);
        return new CanvasRequest(method, uri, headers, body);
    }

    private URI resolveUri(String path, Map<String, Object> query) {
        String url;
        if (path.startsWith("http://") || path.startsWith("https://")) {
            url = path;
        } else {
            String base = credentials.getBaseUrl();
            if (base == null || base.isBlank()) {
                throw new MissingBaseUrlException();
            }
            url = stripTrailingSlash(base.trim()) + "/" + stripLeadingSlash(path);
        }

        if (query.isEmpty()) return URI.create(url);

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        query.forEach((name, value) -> {
            if (value instanceof Collection<?> values) {
                String key = name.endsWith("[]") ? name : name + "[]";
                values.forEach(v -> builder.queryParam(encode(key), encode(String.valueOf(v))));
            } else {
                builder.queryParam(encode(name), encode(String.valueOf(value)));
            }
        });
        return builder.build(true).toUri();
    }

    private RequestBody buildBody(RequestOptions options, HttpHeaders headers) {
        if (options.has(RequestOptionKeys.JSON)) {
            try {
                byte[] json = objectMapper.writeValueAsBytes(options.get(RequestOptionKeys.JSON));
                headers.setContentType(MediaType.APPLICATION_JSON);
                return RequestBody.of(json);
            } catch (JsonProcessingException e) {
                throw new CanvasApiException("Unable to serialize JSON request body", e);
            }
        }
        if (options.has(RequestOptionKeys.FORM_PARAMS)) {
            headers.set(HttpHeaders.CONTENT_TYPE, FormEncoding.CONTENT_TYPE);
            return RequestBody.of(FormEncoding.encode(options.getMap(RequestOptionKeys.FORM_PARAMS)));
        }

        Object raw = options.get(RequestOptionKeys.BODY);
        if (raw == null) return RequestBody.empty();
        if (raw instanceof RequestBody b) return b;
        if (raw instanceof byte[] bytes) return RequestBody.of(bytes);
        if (raw instanceof InputStream in) return RequestBody.ofStream(in);
        return RequestBody.of(String.valueOf(raw));
    }

    private static String encode(String s) {
        return UriUtils.encodeQueryParam(s, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String s) {
        String out = s;
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }

    private static String stripLeadingSlash(String s) {
        String out = s;
        while (out.startsWith("/")) out = out.substring(1);
        return out;
    }

    public CanvasCredentials getCredentials() {
        return credentials;
    }
}
