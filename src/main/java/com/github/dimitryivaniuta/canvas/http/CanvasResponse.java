package com.github.dimitryivaniuta.canvas.http;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Immutable response as seen by middleware and callers.
 */
@Getter
public final class CanvasResponse {

    private final int statusCode;
    private final String reasonPhrase;
    private final HttpHeaders headers;
    private final byte[] body;
    private final String protocolVersion;

    @Builder
    private CanvasResponse(int statusCode,
                           String reasonPhrase,
                           Map<String, List<String>> headers,
                           byte[] body,
                           String protocolVersion) {
        this.statusCode = statusCode;
        this.reasonPhrase = (reasonPhrase == null || reasonPhrase.isBlank()) ? defaultReason(statusCode) : reasonPhrase;
        HttpHeaders copy = new HttpHeaders();
        if (headers != null) {
            headers.forEach((name, values) -> copy.addAll(name, values));
        }
        this.headers = HttpHeaders.readOnlyHttpHeaders(copy);
        this.body = (body == null) ? new byte[0] : body.clone();
        this.protocolVersion = (protocolVersion == null) ? "1.1" : protocolVersion;
    }

    public static CanvasResponse of(int statusCode, String body) {
        return CanvasResponse.builder()
                .statusCode(statusCode)
                .body(body == null ? null : body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    /** Copy of this response with {@code name} set to {@code value}. */
    public CanvasResponse withHeader(String name, String value) {
        HttpHeaders copy = new HttpHeaders();
        copy.putAll(headers);
        copy.set(name, value);
        return new CanvasResponse(statusCode, reasonPhrase, copy, body, protocolVersion);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public int getBodySize() {
        return body.length;
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name);
    }

    public String getHeaderLine(String name) {
        List<String> values = headers.get(name);
        return (values == null) ? "" : String.join(", ", values);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String defaultReason(int statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        return (status == null) ? "" : status.getReasonPhrase();
    }
}
