package com.github.dimitryivaniuta.canvas.http;

import lombok.Getter;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable outgoing request. {@code with*} methods return copies; the body instance is shared.
 */
@Getter
public final class CanvasRequest {

    private final String method;
    private final URI uri;
    private final HttpHeaders headers;
    private final RequestBody body;

    public CanvasRequest(String method, URI uri, HttpHeaders headers, RequestBody body) {
        this.method = Objects.requireNonNull(method, "method must not be null").toUpperCase(Locale.ROOT);
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        this.headers = HttpHeaders.readOnlyHttpHeaders(copyOf(headers));
        this.body = (body == null) ? RequestBody.empty() : body;
    }

    public static CanvasRequest of(String method, String uri) {
        return new CanvasRequest(method, URI.create(uri), null, null);
    }

    public CanvasRequest withHeader(String name, String value) {
        HttpHeaders copy = copyOf(headers);
        copy.set(name, value);
        return new CanvasRequest(method, uri, copy, body);
    }

    public CanvasRequest withBody(RequestBody newBody) {
        return new CanvasRequest(method, uri, headers, newBody);
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name);
    }

    /** All values of a header joined with ", ", or an empty string. */
    public String getHeaderLine(String name) {
        List<String> values = headers.get(name);
        return (values == null) ? "" : String.join(", ", values);
    }

    private static HttpHeaders copyOf(HttpHeaders source) {
        HttpHeaders copy = new HttpHeaders();
        if (source != null) {
            copy.addAll(source);
        }
        return copy;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
