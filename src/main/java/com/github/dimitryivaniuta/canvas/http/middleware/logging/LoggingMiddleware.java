package com.github.dimitryivaniuta.canvas.http.middleware.logging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.http.CanvasHeaders;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.http.middleware.AbstractMiddleware;
import com.github.dimitryivaniuta.canvas.support.CanvasJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Logs every request, response and failure with secrets masked. Never changes the outcome: the
 * response is returned and errors are rethrown as they came.
 *
 * <p>Each request gets a fresh id, logged as {@code request_id} and kept in the MDC under
 * {@value #MDC_KEY} while the call runs.
 */
public class LoggingMiddleware extends AbstractMiddleware {

    public static final String NAME = "logging";
    public static final String MDC_KEY = "requestId";

    static final String TRUNCATED_SUFFIX = "... (truncated)";

    private final Logger logger;
    private final ObjectMapper objectMapper;

    public LoggingMiddleware(Map<String, ?> config) {
        this(config, LoggerFactory.getLogger(LoggingMiddleware.class), CanvasJson.newMapper());
    }

    public LoggingMiddleware(Map<String, ?> config, Logger logger, ObjectMapper objectMapper) {
        super(config);
        this.logger = logger;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        return Map.of(
                "enabled", true,
                "log_requests", true,
                "log_responses", true,
                "log_errors", true,
                "log_timing", true,
                "log_level", "INFO",
                "error_log_level", "ERROR",
                "sanitize_fields", List.of("password", "token", "api_key", "secret", "authorization"),
                "max_body_length", 1000
        );
    }

    @Override
    public HttpHandler wrap(HttpHandler next) {
        return (request, options) -> {
            if (!getBoolean("enabled", true)) {
                return next.handle(request, options);
            }

            SensitiveDataSanitizer sanitizer = new SensitiveDataSanitizer(getStringList("sanitize_fields"), objectMapper);
            String requestId = newRequestId();
            String previousId = MDC.get(MDC_KEY);
            MDC.put(MDC_KEY, requestId);
            long startNs = System.nanoTime();
            try {
                if (getBoolean("log_requests", true)) {
                    logRequest(request, options, requestId, sanitizer);
                }

                CanvasResponse response;
                try {
                    response = next.handle(request, options);
                } catch (RuntimeException ex) {
                    if (getBoolean("log_errors", true)) {
                        logError(ex, request, requestId, startNs, sanitizer);
                    }
                    throw ex;
                }

                if (getBoolean("log_responses", true)) {
                    logResponse(response, requestId, startNs, sanitizer);
                }
                return response;
            } finally {
                if (previousId == null) {
                    MDC.remove(MDC_KEY);
                } else {
                    MDC.put(MDC_KEY, previousId);
                }
            }
        };
    }

    private void logRequest(CanvasRequest request, RequestOptions options, String requestId, SensitiveDataSanitizer sanitizer) {
        String uri = sanitizer.sanitizeUri(request.getUri());
        LoggingEventBuilder event = logger.atLevel(level("log_level", Level.INFO))
                .addKeyValue("request_id", requestId)
                .addKeyValue("method", request.getMethod())
                .addKeyValue("uri", uri)
                .addKeyValue("headers", sanitizer.sanitizeHeaders(request.getHeaders()));

        Optional<String> body = request.getBody().peekAsString().filter(s -> !s.isEmpty());
        body.ifPresent(b -> addBody(event, "body", b, sanitizer, true));

        options.getString(RequestOptionKeys.RATE_LIMIT_BUCKET)
                .ifPresent(bucket -> event.addKeyValue("rate_limit_bucket", bucket));

        event.log("HTTP Request: {} {}", request.getMethod(), uri);
    }

    private void logResponse(CanvasResponse response, String requestId, long startNs, SensitiveDataSanitizer sanitizer) {
        boolean failed = response.getStatusCode() >= 400;
        LoggingEventBuilder event = logger.atLevel(failed ? level("error_log_level", Level.ERROR) : level("log_level", Level.INFO))
                .addKeyValue("request_id", requestId)
                .addKeyValue("status_code", response.getStatusCode())
                .addKeyValue("reason_phrase", response.getReasonPhrase())
                .addKeyValue("headers", sanitizer.sanitizeHeaders(response.getHeaders()));

        if (getBoolean("log_timing", true)) {
            event.addKeyValue("elapsed_ms", elapsedMillis(startNs));
        }
        if (response.hasHeader(CanvasHeaders.RATE_LIMIT_REMAINING)) {
            event.addKeyValue("rate_limit_remaining", response.getHeaderLine(CanvasHeaders.RATE_LIMIT_REMAINING));
        }
        if (response.hasHeader(CanvasHeaders.REQUEST_COST)) {
            event.addKeyValue("request_cost", response.getHeaderLine(CanvasHeaders.REQUEST_COST));
        }
        if (failed && response.getBodySize() > 0) {
            addBody(event, "body", response.getBodyAsString(), sanitizer, false);
        }

        event.log("HTTP Response: {} {}", response.getStatusCode(), response.getReasonPhrase());
    }

    private void logError(RuntimeException ex, CanvasRequest request, String requestId, long startNs, SensitiveDataSanitizer sanitizer) {
        LoggingEventBuilder event = logger.atLevel(level("error_log_level", Level.ERROR))
                .addKeyValue("request_id", requestId)
                .addKeyValue("method", request.getMethod())
                .addKeyValue("uri", sanitizer.sanitizeUri(request.getUri()))
                .addKeyValue("error_type", ex.getClass().getName())
                .addKeyValue("error_message", ex.getMessage());

        if (getBoolean("log_timing", true)) {
            event.addKeyValue("elapsed_ms", elapsedMillis(startNs));
        }
        if (ex instanceof HttpResponseException e && e.getResponse() != null) {
            CanvasResponse response = e.getResponse();
            event.addKeyValue("status_code", response.getStatusCode())
                    .addKeyValue("headers", sanitizer.sanitizeHeaders(response.getHeaders()));
            if (response.getBodySize() > 0) {
                addBody(event, "response_body", response.getBodyAsString(), sanitizer, false);
            }
        }

        event.log("HTTP Error: {} - {}", ex.getClass().getSimpleName(), ex.getMessage());
    }

    /**
     * Masks first, then truncates, so a cut never exposes a value the mask would have caught.
     */
    private void addBody(LoggingEventBuilder event, String key, String body, SensitiveDataSanitizer sanitizer, boolean withLength) {
        String clean = sanitizer.sanitizeBody(body);
        int max = getInt("max_body_length", 1000);
        if (max > 0 && clean.length() > max) {
            event.addKeyValue(key, clean.substring(0, max) + TRUNCATED_SUFFIX);
            if (withLength) {
                event.addKeyValue("body_length", body.length());
            }
        } else {
            event.addKeyValue(key, clean);
        }
    }

    private Level level(String key, Level fallback) {
        Object v = getConfig(key, null);
        if (v instanceof Level l) return l;
        if (v == null) return fallback;
        return switch (v.toString().trim().toLowerCase(Locale.ROOT)) {
            case "trace" -> Level.TRACE;
            case "debug" -> Level.DEBUG;
            case "info", "notice" -> Level.INFO;
            case "warn", "warning" -> Level.WARN;
            case "error", "critical", "alert", "emergency" -> Level.ERROR;
            default -> fallback;
        };
    }

    private static double elapsedMillis(long startNs) {
        return Math.round((System.nanoTime() - startNs) / 10_000.0) / 100.0;
    }

    private static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
