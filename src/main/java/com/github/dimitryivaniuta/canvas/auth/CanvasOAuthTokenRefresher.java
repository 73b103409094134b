package com.github.dimitryivaniuta.canvas.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.canvas.exception.ConfigurationException;
import com.github.dimitryivaniuta.canvas.exception.ConnectionException;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.exception.MissingOAuthTokenException;
import com.github.dimitryivaniuta.canvas.exception.OAuthRefreshFailedException;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import com.github.dimitryivaniuta.canvas.http.FormEncoding;
import com.github.dimitryivaniuta.canvas.http.HttpHandler;
import com.github.dimitryivaniuta.canvas.http.RequestBody;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Refresh-token grant against {@code POST /login/oauth2/token}.
 *
 * <p>Talks to the bare transport, not the middleware chain: the refresh must not be rate limited,
 * cached, or trigger another refresh on its own 401.
 */
@Slf4j
public class CanvasOAuthTokenRefresher implements OAuthTokenRefresher {

    public static final String TOKEN_PATH = "/login/oauth2/token";

    private final CanvasCredentials credentials;
    private final HttpHandler transport;
    private final ObjectMapper objectMapper;

    public CanvasOAuthTokenRefresher(CanvasCredentials credentials, HttpHandler transport, ObjectMapper objectMapper) {
        this.credentials = credentials;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public OAuthToken refresh() {
        log.info("OAuth: starting token refresh");

        OAuthToken current = credentials.currentOAuthToken().orElse(null);
        if (current == null || !current.hasRefreshToken()) {
            log.error("OAuth: no refresh token available");
            throw new MissingOAuthTokenException("No refresh token available");
        }
        if (isBlank(credentials.getClientId()) || isBlank(credentials.getClientSecret())) {
            throw new ConfigurationException("OAuth client credentials must be configured");
        }
        if (isBlank(credentials.getBaseUrl())) {
            throw new ConfigurationException("Base URL must be configured");
        }

        CanvasResponse response;
        try {
            response = transport.handle(tokenRequest(current.refreshToken()), RequestOptions.empty());
        } catch (HttpResponseException e) {
            String error = e.getResponse().getBodyAsString();
            log.atError()
                    .addKeyValue("status", e.getStatusCode())
                    .addKeyValue("error", error)
                    .log("OAuth: failed to refresh token");
            throw new OAuthRefreshFailedException("Token refresh failed: " + error, e);
        } catch (ConnectionException e) {
            log.error("OAuth: failed to refresh token: {}", e.getMessage());
            throw new OAuthRefreshFailedException("Token refresh failed: " + e.getMessage(), e);
        }

        OAuthToken refreshed = parse(response, current);
        credentials.updateOAuthToken(refreshed);

        log.atInfo()
                .addKeyValue("expires_at", refreshed.expiresAt())
                .log("OAuth: access token refreshed");
        return refreshed;
    }

    private CanvasRequest tokenRequest(String refreshToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_id", credentials.getClientId());
        form.put("client_secret", credentials.getClientSecret());
        form.put("refresh_token", refreshToken);

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, FormEncoding.CONTENT_TYPE);
        headers.set(HttpHeaders.ACCEPT, "application/json");

        URI uri = URI.create(stripTrailingSlash(credentials.getBaseUrl()) + TOKEN_PATH);
        return new CanvasRequest("POST", uri, headers, RequestBody.of(FormEncoding.encode(form)));
    }

    private OAuthToken parse(CanvasResponse response, OAuthToken current) {
        String body = response.getBodyAsString();
        if (body.isBlank()) {
            throw new OAuthRefreshFailedException("Empty response from token refresh");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new OAuthRefreshFailedException("Invalid response from token refresh", e);
        }

        JsonNode accessToken = (json == null) ? null : json.get("access_token");
        if (accessToken == null || !accessToken.isTextual() || accessToken.asText().isBlank()) {
            throw new OAuthRefreshFailedException("Invalid response from token refresh");
        }

        Instant expiresAt = null;
        JsonNode expiresIn = json.get("expires_in");
        if (expiresIn != null && expiresIn.canConvertToLong()) {
            expiresAt = Instant.now(credentials.getClock()).plusSeconds(expiresIn.asLong());
        }

        // Canvas keeps the refresh token stable across refreshes
        return current.withAccessToken(accessToken.asText(), expiresAt);
    }

    private static String stripTrailingSlash(String url) {
        String s = url.trim();
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
