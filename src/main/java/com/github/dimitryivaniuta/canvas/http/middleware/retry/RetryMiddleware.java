package com.github.dimitryivaniuta.canvas.http.middleware.retry;

import com.github.dimitryivaniuta.canvas.exception.ConnectionException;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.middleware.AbstractMiddleware;
import com.github.dimitryivaniuta.canvas.http.middleware.CanvasRateLimits;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Retries transient failures with exponential backoff.
 *
 * <p>{@code max_attempts} counts retries: with the default of 3 a request is sent at most 4 times.
 * The attempt number travels in the {@code retry_attempt} option so inner handlers can see it.
 * A 403 is retried only when Canvas marks it as a rate limit.
 */
@Slf4j
public class RetryMiddleware extends AbstractMiddleware {

    public static final String NAME = "retry";

    private final MiddlewareMetrics metrics;

    private final ConcurrentHashMap<RetryKey, Retry> retryCache = new ConcurrentHashMap<>();

    public RetryMiddleware() {
        this(Map.of(), MiddlewareMetrics.standalone());
    }

    public RetryMiddleware(Map<String, ?> config) {
        this(config, MiddlewareMetrics.standalone());
    }

    public RetryMiddleware(Map<String, ?> config, MiddlewareMetrics metrics) {
        super(config);
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        return Map.of(
                "max_attempts", 3,
                "delay", 1000,          // ms before the first retry
                "multiplier", 2,
                "max_delay", 16000,     // ms
                "jitter", true,         // adds 0-25%
                "retry_on_status", List.of(500, 502, 503, 504, 403),
                "retry_on_timeout", true
        );
    }

    @Override
    public HttpHandler wrap(HttpHandler next) {
        return (request, options) -> {
            int startAttempt = options.getInt(RequestOptionKeys.RETRY_ATTEMPT, 0);
            int maxAttempts = getInt("max_attempts", 3);
            int retriesLeft = Math.max(0, maxAttempts - startAttempt);

            if (retriesLeft == 0) {
                return next.handle(request, options.with(RequestOptionKeys.RETRY_ATTEMPT, startAttempt));
            }

            Retry retry = retryCache.computeIfAbsent(
                    new RetryKey(getConfig(), startAttempt, retriesLeft),
                    k -> buildRetry(k.startAttempt(), k.retriesLeft())
            );

            AtomicInteger attempt = new AtomicInteger(startAttempt);
            AtomicReference<String> lastOutcome = new AtomicReference<>("none");

            Supplier<CanvasResponse> call = () -> {
                int n = attempt.get();
                if (n > startAttempt) {
                    log.warn("Retrying {} {} (attempt {}/{}) after {}",
                            request.getMethod(), request.getUri(), n, maxAttempts, lastOutcome.get());
                    metrics.retryAttempt(request.getMethod(), lastOutcome.get());
                    request.getBody().rewind();
                }
                try {
                    CanvasResponse response = next.handle(request, options.with(RequestOptionKeys.RETRY_ATTEMPT, n));
                    lastOutcome.set(String.valueOf(response.getStatusCode()));
                    return response;
                } catch (RuntimeException ex) {
                    lastOutcome.set(reasonOf(ex));
                    throw ex;
                } finally {
                    attempt.incrementAndGet();
                }
            };

            try {
                CanvasResponse response = Retry.decorateSupplier(retry, call).get();
                if (attempt.get() - 1 >= maxAttempts && shouldRetryResponse(response)) {
                    exhausted(request, maxAttempts);
                }
                return response;
            } catch (RuntimeException ex) {
                if (attempt.get() - 1 >= maxAttempts && shouldRetryError(ex)) {
                    exhausted(request, maxAttempts);
                }
                throw ex;
            }
        };
    }

    /**
     * Backoff before retry number {@code attempt} (1-based), jitter included when enabled.
     */
    public long calculateDelay(int attempt) {
        long delay = baseDelay(attempt);
        if (delay > 0 && getBoolean("jitter", true)) {
            int percent = ThreadLocalRandom.current().nextInt(0, 26);
            delay += (long) (delay * (percent / 100.0));
        }
        return delay;
    }

    /**
     * {@code min(delay * multiplier^(attempt-1), max_delay)} without jitter.
     */
    public long baseDelay(int attempt) {
        long delay = getLong("delay", 1000);
        double multiplier = getDouble("multiplier", 2);
        long maxDelay = getLong("max_delay", 16000);

        if (delay <= 0) return 0;
        if (delay >= maxDelay) return maxDelay;

        IntervalFunction curve = IntervalFunction.ofExponentialBackoff(
                Duration.ofMillis(delay), Math.max(1.0, multiplier), Duration.ofMillis(maxDelay));
        return curve.apply(Math.max(1, attempt));
    }

    /** Whether a response, on its own, warrants another attempt. */
    public boolean shouldRetryResponse(CanvasResponse response) {
        int status = response.getStatusCode();
        if (!getIntSet("retry_on_status").contains(status)) return false;
        if (status == 403) return CanvasRateLimits.isRateLimited(response);
        return true;
    }

    /** Whether a failure, on its own, warrants another attempt. */
    public boolean shouldRetryError(Throwable error) {
        if (error instanceof ConnectionException) {
            return getBoolean("retry_on_timeout", true);
        }
        if (error instanceof HttpResponseException e && e.getResponse() != null) {
            return shouldRetryResponse(e.getResponse());
        }
        return false;
    }

    private Retry buildRetry(int startAttempt, int retriesLeft) {
        RetryConfig config = RetryConfig.<CanvasResponse>custom()
                .maxAttempts(retriesLeft + 1)
                .intervalFunction(n -> calculateDelay(startAttempt + n))
                .retryOnResult(this::shouldRetryResponse)
                .retryOnException(this::shouldRetryError)
                .failAfterMaxAttempts(false)
                .build();
        return Retry.of("canvas-retry:" + startAttempt + ":" + retriesLeft, config);
    }

    private void exhausted(CanvasRequest request, int maxAttempts) {
        log.warn("Giving up on {} {} after {} retries", request.getMethod(), request.getUri(), maxAttempts);
        metrics.retryExhausted(request.getMethod());
    }

    private static String reasonOf(Throwable ex) {
        if (ex instanceof HttpResponseException e && e.getResponse() != null) {
            return String.valueOf(e.getStatusCode());
        }
        return ex.getClass().getSimpleName();
    }

    private record RetryKey(Map<String, Object> config, int startAttempt, int retriesLeft) {}

    @Override
    public String toString() {
        return "RetryMiddleware" + getConfig();
    }
}
