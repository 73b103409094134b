package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.exception.ConnectionException;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.http.CanvasHeaders;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.http.ScriptedHandler;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import com.github.dimitryivaniuta.canvas.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitMiddlewareTest {

    private static final Bucket.Limits LIMITS = new Bucket.Limits(3000, 50);
    private static final CanvasRequest GET = CanvasRequest.of("GET", "https://school.instructure.com/api/v1/courses");
    private static final CanvasCredentials CREDENTIALS =
            CanvasCredentials.apiKey("https://school.instructure.com", "token-1");

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final BucketStore store = new BucketStore(clock);
    private final BucketKeyResolver resolver = new BucketKeyResolver(CREDENTIALS);
    private final List<Duration> sleeps = new ArrayList<>();
    private final MiddlewareMetrics metrics = MiddlewareMetrics.standalone();

    private RateLimitMiddleware middleware(Map<String, ?> config) {
        return new RateLimitMiddleware(config, store, resolver, d -> {
            sleeps.add(d);
            clock.advance(d);
        }, metrics);
    }

    private Bucket bucket() {
        return store.bucket(resolver.resolve(GET, RequestOptions.empty()), LIMITS);
    }

    @Test
    void shouldChargeInitialCostPerRequest() {
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));

        middleware(Map.of()).wrap(transport).handle(GET, RequestOptions.empty());

        assertThat(bucket().remaining(LIMITS)).isEqualTo(2950);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldWaitForRefillWhenBucketIsLow() {
        bucket().overwrite(100, LIMITS);
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));

        middleware(Map.of()).wrap(transport).handle(GET, RequestOptions.empty());

        // (min_remaining 100 + initial_cost 50 - 100) / leak_rate 50 = 1s
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        assertThat(transport.calls()).isEqualTo(1);
        assertThat(metrics.registry().get("canvas_http_ratelimit_wait_seconds").timer().count()).isEqualTo(1);
    }

    @Test
    void shouldFailFastWhenWaitingIsDisabled() {
        bucket().overwrite(0, LIMITS);
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));
        HttpHandler handler = middleware(Map.of("wait_on_limit", false)).wrap(transport);

        assertThatThrownBy(() -> handler.handle(GET, RequestOptions.empty()))
                .isExactlyInstanceOf(RateLimitExceededException.class)
                .satisfies(ex -> {
                    RateLimitExceededException e = (RateLimitExceededException) ex;
                    assertThat(e.getRetryAfterSeconds()).isEqualTo(3);
                    assertThat(e.getStatusCode()).isEqualTo(429);
                    assertThat(e.getResponse().getHeaderLine(HttpHeaders.RETRY_AFTER)).isEqualTo("3");
                });
        assertThat(transport.calls()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldRefuseWaitsLongerThanMaxWaitTime() {
        bucket().overwrite(0, LIMITS);
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));
        HttpHandler handler = middleware(Map.of("max_wait_time", 1)).wrap(transport);

        assertThatThrownBy(() -> handler.handle(GET, RequestOptions.empty()))
                .isInstanceOf(RateLimitWaitTimeExceededException.class)
                .hasMessageContaining("(3s) exceeds maximum (1s)");
        assertThat(transport.calls()).isZero();
        assertThat(metrics.registry().get("canvas_http_ratelimit_rejected_total").tag("reason", "max_wait").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldTrustServerReportedRemaining() {
        CanvasResponse response = CanvasResponse.builder()
                .statusCode(200)
                .headers(Map.of(CanvasHeaders.RATE_LIMIT_REMAINING, List.of("1234.5")))
                .build();

        middleware(Map.of()).wrap(ScriptedHandler.returning(response)).handle(GET, RequestOptions.empty());

        assertThat(bucket().remaining(LIMITS)).isEqualTo(1234.5);
    }

    @Test
    void shouldReconcileActualRequestCost() {
        CanvasResponse cheap = CanvasResponse.builder()
                .statusCode(200)
                .headers(Map.of(CanvasHeaders.REQUEST_COST, List.of("20")))
                .build();
        CanvasResponse expensive = CanvasResponse.builder()
                .statusCode(200)
                .headers(Map.of(CanvasHeaders.REQUEST_COST, List.of("130")))
                .build();
        HttpHandler handler = middleware(Map.of()).wrap(new ScriptedHandler().then(cheap).then(expensive));

        handler.handle(GET, RequestOptions.empty());
        assertThat(bucket().remaining(LIMITS)).isEqualTo(2980);

        handler.handle(GET, RequestOptions.empty());
        assertThat(bucket().remaining(LIMITS)).isEqualTo(2850);
    }

    @Test
    void shouldRefundWhenRequestFailsBeforeCanvasCharged() {
        ScriptedHandler transport = new ScriptedHandler()
                .thenThrow(new ConnectionException("connection refused", GET, null));
        HttpHandler handler = middleware(Map.of()).wrap(transport);

        assertThatThrownBy(() -> handler.handle(GET, RequestOptions.empty()))
                .isInstanceOf(ConnectionException.class);
        assertThat(bucket().remaining(LIMITS)).isEqualTo(3000);
    }

    @Test
    void shouldKeepChargeWhenCanvasThrottled() {
        CanvasResponse throttled = CanvasResponse.builder()
                .statusCode(403)
                .body("403 Forbidden (Rate Limit Exceeded)".getBytes())
                .build();
        HttpHandler handler = middleware(Map.of()).wrap(ScriptedHandler.returning(throttled));

        assertThatThrownBy(() -> handler.handle(GET, RequestOptions.empty()))
                .isInstanceOf(HttpResponseException.class);
        assertThat(bucket().remaining(LIMITS)).isEqualTo(2950);
    }

    @Test
    void shouldRefundOnPlainForbidden() {
        HttpHandler handler = middleware(Map.of()).wrap(ScriptedHandler.returning(CanvasResponse.of(403, "unauthorized")));

        assertThatThrownBy(() -> handler.handle(GET, RequestOptions.empty()))
                .isInstanceOf(HttpResponseException.class);
        assertThat(bucket().remaining(LIMITS)).isEqualTo(3000);
    }

    @Test
    void shouldIsolateBucketsByKey() {
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));
        HttpHandler handler = middleware(Map.of()).wrap(transport);

        handler.handle(GET, RequestOptions.of(Map.of(RequestOptionKeys.RATE_LIMIT_BUCKET, "reports")));

        assertThat(store.bucket("reports", LIMITS).remaining(LIMITS)).isEqualTo(2950);
        assertThat(bucket().remaining(LIMITS)).isEqualTo(3000);
    }

    @Test
    void shouldNotDelayOrChargeAnotherHostWhenOneBucketIsEmpty() {
        bucket().overwrite(0, LIMITS);
        CanvasRequest otherHost = CanvasRequest.of("GET", "https://district.instructure.com/api/v1/courses");
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));

        middleware(Map.of("wait_on_limit", false)).wrap(transport).handle(otherHost, RequestOptions.empty());

        assertThat(transport.calls()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(store.bucket(resolver.resolve(otherHost, RequestOptions.empty()), LIMITS).remaining(LIMITS))
                .isEqualTo(2950);
        assertThat(bucket().remaining(LIMITS)).isZero();
    }

    @Test
    void shouldNotDelayOrChargeAnotherCredentialOnSameHost() {
        bucket().overwrite(0, LIMITS);
        BucketKeyResolver otherUser = new BucketKeyResolver(
                CanvasCredentials.apiKey("https://school.instructure.com", "token-2"));
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));
        HttpHandler handler = new RateLimitMiddleware(Map.of("wait_on_limit", false), store, otherUser, sleeps::add, metrics)
                .wrap(transport);

        handler.handle(GET, RequestOptions.empty());

        assertThat(transport.calls()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(store.bucket(otherUser.resolve(GET, RequestOptions.empty()), LIMITS).remaining(LIMITS))
                .isEqualTo(2950);
        assertThat(bucket().remaining(LIMITS)).isZero();
    }

    @Test
    void shouldPassThroughWhenDisabled() {
        bucket().overwrite(0, LIMITS);
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "[]"));

        middleware(Map.of("enabled", false)).wrap(transport).handle(GET, RequestOptions.empty());

        assertThat(transport.calls()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(bucket().remaining(LIMITS)).isZero();
    }

    @Test
    void shouldComputeDelayFromDeficitAndLeakRate() {
        RateLimitMiddleware rl = middleware(Map.of());
        Bucket b = bucket();

        b.overwrite(3000, LIMITS);
        assertThat(rl.calculateDelay(b)).isZero();

        b.overwrite(149, LIMITS);
        assertThat(rl.calculateDelay(b)).isEqualTo(1);

        b.overwrite(0, LIMITS);
        assertThat(rl.calculateDelay(b)).isEqualTo(3);
    }
}
