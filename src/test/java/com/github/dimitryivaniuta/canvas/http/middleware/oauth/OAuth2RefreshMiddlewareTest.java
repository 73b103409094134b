package com.github.dimitryivaniuta.canvas.http.middleware.oauth;

import com.github.dimitryivaniuta.canvas.auth.AuthMode;
import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.auth.OAuthToken;
import com.github.dimitryivaniuta.canvas.auth.OAuthTokenRefresher;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.exception.OAuthRefreshFailedException;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.http.ScriptedHandler;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import com.github.dimitryivaniuta.canvas.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OAuth2RefreshMiddlewareTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T12:00:00Z");
    private final MiddlewareMetrics metrics = MiddlewareMetrics.standalone();
    private final AtomicInteger refreshes = new AtomicInteger();

    private CanvasCredentials credentials(Instant expiresAt) {
        return CanvasCredentials.builder()
                .baseUrl("https://canvas.test")
                .authMode(AuthMode.OAUTH)
                .clientId("id")
                .clientSecret("secret")
                .oauthToken(new OAuthToken("old", "refresh", expiresAt))
                .clock(clock)
                .build();
    }

    private OAuthTokenRefresher refresherFor(CanvasCredentials credentials) {
        return () -> {
            OAuthToken token = new OAuthToken("new-" + refreshes.incrementAndGet(), "refresh", null);
            credentials.updateOAuthToken(token);
            return token;
        };
    }

    private static CanvasRequest request(String token) {
        return CanvasRequest.of("GET", "https://canvas.test/api/v1/users/self")
                .withHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    @Test
    void shouldRetryOnceWithFreshTokenAfter401() {
        CanvasCredentials creds = credentials(null);
        ScriptedHandler transport = new ScriptedHandler().then(401, "expired").then(200, "{}");
        HttpHandler handler = new OAuth2RefreshMiddleware(Map.of(), creds, refresherFor(creds), metrics).wrap(transport);

        CanvasResponse response = handler.handle(request("old"), RequestOptions.empty());

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(transport.calls()).isEqualTo(2);
        assertThat(transport.lastRequest().getHeaderLine(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer new-1");
        assertThat(metrics.registry().get("canvas_http_oauth_refresh_total")
                .tag("trigger", "reactive").tag("outcome", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldNotLoopWhenRetryAlsoGets401() {
        CanvasCredentials creds = credentials(null);
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(401, "nope"));
        HttpHandler handler = new OAuth2RefreshMiddleware(Map.of(), creds, refresherFor(creds), metrics).wrap(transport);

        assertThatThrownBy(() -> handler.handle(request("old"), RequestOptions.empty()))
                .isInstanceOf(HttpResponseException.class);
        assertThat(transport.calls()).isEqualTo(2);
        assertThat(refreshes.get()).isEqualTo(1);
    }

    @Test
    void shouldRethrowOriginal401UnchangedWhenRefreshFails() {
        CanvasCredentials creds = credentials(null);
        HttpResponseException expired = HttpResponseException.of(request("old"), CanvasResponse.of(401, "expired"));
        ScriptedHandler transport = new ScriptedHandler().thenThrow(expired);
        OAuthTokenRefresher failing = () -> {
            throw new OAuthRefreshFailedException("invalid_grant");
        };
        HttpHandler handler = new OAuth2RefreshMiddleware(Map.of(), creds, failing, metrics).wrap(transport);

        assertThatThrownBy(() -> handler.handle(request("old"), RequestOptions.empty()))
                .isSameAs(expired)
                .satisfies(ex -> {
                    assertThat(ex.getSuppressed()).isEmpty();
                    assertThat(ex.getCause()).isNull();
                });
        assertThat(transport.calls()).isEqualTo(1);
    }

    @Test
    void shouldRefreshProactivelyWhenTokenIsAboutToExpire() {
        CanvasCredentials creds = credentials(Instant.parse("2024-01-01T12:00:30Z"));
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "{}"));
        HttpHandler handler = new OAuth2RefreshMiddleware(Map.of(), creds, refresherFor(creds), metrics).wrap(transport);

        handler.handle(request("old"), RequestOptions.empty());

        assertThat(transport.lastRequest().getHeaderLine(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer new-1");
        assertThat(transport.calls()).isEqualTo(1);
    }

    @Test
    void shouldSendRequestAnywayWhenProactiveRefreshFails() {
        CanvasCredentials creds = credentials(Instant.parse("2024-01-01T11:00:00Z"));
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(200, "{}"));
        OAuthTokenRefresher failing = () -> {
            throw new OAuthRefreshFailedException("down");
        };
        HttpHandler handler = new OAuth2RefreshMiddleware(Map.of(), creds, failing, metrics).wrap(transport);

        CanvasResponse response = handler.handle(request("old"), RequestOptions.empty());

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(transport.lastRequest().getHeaderLine(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer old");
        assertThat(metrics.registry().get("canvas_http_oauth_refresh_total")
                .tag("trigger", "proactive").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldPassThroughInApiKeyModeAndWhenDisabled() {
        CanvasCredentials apiKey = CanvasCredentials.apiKey("https://canvas.test", "key");
        ScriptedHandler transport = ScriptedHandler.returning(CanvasResponse.of(401, "bad key"));
        HttpHandler handler = new OAuth2RefreshMiddleware(Map.of(), apiKey, refresherFor(apiKey), metrics).wrap(transport);
        assertThatThrownBy(() -> handler.handle(request("key"), RequestOptions.empty()))
                .isInstanceOf(HttpResponseException.class);

        CanvasCredentials oauth = credentials(null);
        HttpHandler noRetry = new OAuth2RefreshMiddleware(Map.of("retry_on_401", false), oauth, refresherFor(oauth), metrics)
                .wrap(transport);
        assertThatThrownBy(() -> noRetry.handle(request("old"), RequestOptions.empty()))
                .isInstanceOf(HttpResponseException.class);

        assertThat(transport.calls()).isEqualTo(2);
        assertThat(refreshes.get()).isZero();
    }
}
