package com.github.dimitryivaniuta.canvas.http.middleware.oauth;

import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.auth.OAuthToken;
import com.github.dimitryivaniuta.canvas.auth.OAuthTokenRefresher;
import com.github.dimitryivaniuta.canvas.exception.CanvasApiException;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.middleware.AbstractMiddleware;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Keeps the OAuth bearer token fresh. Does nothing unless the credentials are in OAuth mode.
 *
 * <ul>
 *   <li>proactive: a token known to be expired is refreshed before the request goes out; if that
 *   fails the request is still sent with the old token</li>
 *   <li>reactive: a 401 triggers one refresh and one retry; if the refresh fails the original
 *   401 is rethrown</li>
 * </ul>
 */
@Slf4j
public class OAuth2RefreshMiddleware extends AbstractMiddleware {

    public static final String NAME = "oauth2_refresh";

    private final CanvasCredentials credentials;
    private final OAuthTokenRefresher refresher;
    private final MiddlewareMetrics metrics;

    public OAuth2RefreshMiddleware(Map<String, ?> config,
                                   CanvasCredentials credentials,
                                   OAuthTokenRefresher refresher,
                                   MiddlewareMetrics metrics) {
        super(config);
        this.credentials = credentials;
        this.refresher = refresher;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        return Map.of(
                "auto_refresh", true,
                "retry_on_401", true
        );
    }

    @Override
    public HttpHandler wrap(HttpHandler next) {
        return (request, options) -> {
            if (credentials == null || !credentials.isOAuth()) {
                return next.handle(request, options);
            }

            CanvasRequest outgoing = request;
            if (getBoolean("auto_refresh", true) && credentials.isOAuthTokenExpired()) {
                try {
                    outgoing = withToken(request, refresh("proactive"));
                } catch (CanvasApiException e) {
                    // the request may still succeed; a 401 lands in the reactive path below
                    log.warn("OAuth: proactive refresh failed, sending request with current token: {}", e.getMessage());
                }
            }

            if (!getBoolean("retry_on_401", true)) {
                return next.handle(outgoing, options);
            }

            try {
                return next.handle(outgoing, options);
            } catch (HttpResponseException unauthorized) {
                if (unauthorized.getStatusCode() != 401) throw unauthorized;

                CanvasRequest retried;
                try {
                    retried = withToken(outgoing, refresh("reactive"));
                } catch (CanvasApiException refreshFailure) {
                    log.warn("OAuth: refresh after 401 failed: {}", refreshFailure.getMessage(), refreshFailure);
                    throw unauthorized;
                }

                log.info("OAuth: retrying {} {} with refreshed token", outgoing.getMethod(), outgoing.getUri());
                outgoing.getBody().rewind();
                return next.handle(retried, options);
            }
        };
    }

    private OAuthToken refresh(String trigger) {
        try {
            OAuthToken token = refresher.refresh();
            metrics.oauthRefresh(trigger, true);
            return token;
        } catch (CanvasApiException e) {
            metrics.oauthRefresh(trigger, false);
            throw e;
        }
    }

    private static CanvasRequest withToken(CanvasRequest request, OAuthToken token) {
        return request.withHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token.accessToken());
    }
}
