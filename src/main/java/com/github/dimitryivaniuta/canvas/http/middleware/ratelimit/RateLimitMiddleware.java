package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.http.CanvasHeaders;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.middleware.AbstractMiddleware;
import com.github.dimitryivaniuta.canvas.http.middleware.CanvasRateLimits;
import com.github.dimitryivaniuta.canvas.http.middleware.Sleeper;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * Client-side mirror of the Canvas leaky bucket.
 *
 * <p>Each request pre-charges {@code initial_cost}. Canvas reports the real figures afterwards
 * ({@code X-Rate-Limit-Remaining}, {@code X-Request-Cost}) and the bucket is corrected from them.
 * When the bucket runs low the call waits for it to refill, or fails fast when waiting is disabled
 * or would take longer than {@code max_wait_time}. Responses replayed from the local cache cost
 * nothing and leave the bucket as it was.
 */
@Slf4j
public class RateLimitMiddleware extends AbstractMiddleware {

    public static final String NAME = "rate-limit";

    private final BucketStore store;
    private final BucketKeyResolver keyResolver;
    private final Sleeper sleeper;
    private final MiddlewareMetrics metrics;

    public RateLimitMiddleware(Map<String, ?> config, CanvasCredentials credentials) {
        this(config, BucketStore.shared(), new BucketKeyResolver(credentials), Sleeper.THREAD, MiddlewareMetrics.standalone());
    }

    public RateLimitMiddleware(Map<String, ?> config,
                               BucketStore store,
                               BucketKeyResolver keyResolver,
                               Sleeper sleeper,
                               MiddlewareMetrics metrics) {
        super(config);
        this.store = store;
        this.keyResolver = keyResolver;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        return Map.of(
                "enabled", true,
                "bucket_size", 3000,    // Canvas default
                "leak_rate", 50,        // units per second
                "initial_cost", 50,     // Canvas charges this up front
                "min_remaining", 100,   // throttle below this
                "wait_on_limit", true,
                "max_wait_time", 60     // seconds
        );
    }

    @Override
    public HttpHandler wrap(HttpHandler next) {
        return (request, options) -> {
            if (!getBoolean("enabled", true)) {
                return next.handle(request, options);
            }

            Bucket.Limits limits = limits();
            String key = keyResolver.resolve(request, options);
            Bucket bucket = store.bucket(key, limits);

            long delay = calculateDelay(bucket);
            if (delay > 0) {
                if (!getBoolean("wait_on_limit", true)) {
                    metrics.rateLimitRejected("no_wait");
                    throw new RateLimitExceededException(request, delay);
                }
                long maxWait = getLong("max_wait_time", 60);
                if (delay > maxWait) {
                    metrics.rateLimitRejected("max_wait");
                    throw new RateLimitWaitTimeExceededException(request, delay, maxWait);
                }
                log.atInfo()
                        .addKeyValue("bucket", key)
                        .addKeyValue("wait_seconds", delay)
                        .log("Rate limit bucket low, waiting before {} {}", request.getMethod(), request.getUri());
                metrics.rateLimitWaited(delay);
                sleeper.sleep(Duration.ofSeconds(delay));
            }

            double initialCost = getDouble("initial_cost", 50);
            bucket.consume(initialCost, limits);

            CanvasResponse response;
            try {
                response = next.handle(request, options);
            } catch (RuntimeException ex) {
                // a Canvas 403 throttle means the units really were spent
                if (!CanvasRateLimits.isRateLimitError(ex)) {
                    bucket.refund(initialCost, limits);
                }
                throw ex;
            }

            if (CanvasHeaders.CACHE_HIT.equals(response.getHeaderLine(CanvasHeaders.CACHE_STATUS))) {
                // served locally, Canvas charged nothing
                bucket.refund(initialCost, limits);
                return response;
            }
            reconcile(bucket, limits, response, initialCost);
            return response;
        };
    }

    /**
     * Whole seconds to wait before {@code bucket} can afford another request; 0 when it already can.
     */
    public long calculateDelay(Bucket bucket) {
        double minRemaining = getDouble("min_remaining", 100);
        double initialCost = getDouble("initial_cost", 50);
        double leakRate = getDouble("leak_rate", 50);

        double remaining = bucket.remaining(limits());
        double needed = minRemaining + initialCost - remaining;
        if (needed <= 0) return 0;
        if (leakRate <= 0) return Long.MAX_VALUE;
        return (long) Math.ceil(needed / leakRate);
    }

    public BucketStore getStore() {
        return store;
    }

    private void reconcile(Bucket bucket, Bucket.Limits limits, CanvasResponse response, double initialCost) {
        if (response.hasHeader(CanvasHeaders.RATE_LIMIT_REMAINING)) {
            bucket.overwrite(CanvasRateLimits.parseDouble(response.getHeaderLine(CanvasHeaders.RATE_LIMIT_REMAINING)), limits);
        }

        if (response.hasHeader(CanvasHeaders.REQUEST_COST)) {
            double actualCost = CanvasRateLimits.parseDouble(response.getHeaderLine(CanvasHeaders.REQUEST_COST));
            if (actualCost < initialCost) {
                bucket.refund(initialCost - actualCost, limits);
            } else if (actualCost > initialCost) {
                bucket.consume(actualCost - initialCost, limits);
            }
        }
    }

    private Bucket.Limits limits() {
        return new Bucket.Limits(getDouble("bucket_size", 3000), getDouble("leak_rate", 50));
    }
}
