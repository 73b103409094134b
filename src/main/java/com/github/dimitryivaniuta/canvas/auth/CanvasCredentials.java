package com.github.dimitryivaniuta.canvas.auth;

import lombok.Builder;
import lombok.Getter;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Connection settings and credentials shared by the client and the middleware.
 *
 * <p>Only the OAuth token changes after construction; it is swapped atomically so concurrent
 * requests always see a consistent access token / expiry pair.
 */
@Getter
public class CanvasCredentials {

    /** Tokens are treated as expired this long before their actual expiry. */
    public static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    private final String baseUrl;
    private final AuthMode authMode;
    private final String apiKey;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    private volatile OAuthToken oauthToken;

    @Builder
    private CanvasCredentials(String baseUrl,
                              AuthMode authMode,
                              String apiKey,
                              String clientId,
                              String clientSecret,
                              OAuthToken oauthToken,
                              Clock clock) {
        this.baseUrl = baseUrl;
        this.authMode = (authMode == null) ? AuthMode.API_KEY : authMode;
        this.apiKey = apiKey;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.oauthToken = oauthToken;
        this.clock = (clock == null) ? Clock.systemUTC() : clock;
    }

    public static CanvasCredentials apiKey(String baseUrl, String apiKey) {
        return builder().baseUrl(baseUrl).authMode(AuthMode.API_KEY).apiKey(apiKey).build();
    }

    public boolean isOAuth() {
        return authMode == AuthMode.OAUTH;
    }

    public void updateOAuthToken(OAuthToken token) {
        this.oauthToken = token;
    }

    public Optional<OAuthToken> currentOAuthToken() {
        return Optional.ofNullable(oauthToken);
    }

    /**
     * The secret sent as the bearer token: the OAuth access token in OAuth mode, otherwise the API key.
     */
    public Optional<String> activeCredential() {
        String value = isOAuth()
                ? currentOAuthToken().map(OAuthToken::accessToken).orElse(null)
                : apiKey;
        return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value);
    }

    /** True only when an expiry is known and it has passed (minus {@link #EXPIRY_SKEW}). */
    public boolean isOAuthTokenExpired() {
        OAuthToken t = oauthToken;
        if (t == null || t.expiresAt() == null) return false;
        return !Instant.now(clock).plus(EXPIRY_SKEW).isBefore(t.expiresAt());
    }

    /** Host of the configured base URL, if any. */
    public Optional<String> baseHost() {
        if (baseUrl == null || baseUrl.isBlank()) return Optional.empty();
        try {
            return Optional.ofNullable(URI.create(baseUrl.trim()).getHost());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        // never print secrets
        return "CanvasCredentials[baseUrl=" + baseUrl + ", authMode=" + authMode + "]";
    }
}
