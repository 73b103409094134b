package com.github.dimitryivaniuta.canvas.auth;

import java.time.Instant;

/**
 * OAuth access token with its refresh token and expiry. {@code expiresAt} is null when Canvas did
 * not report a lifetime.
 */
public record OAuthToken(String accessToken, String refreshToken, Instant expiresAt) {

    public OAuthToken withAccessToken(String newAccessToken, Instant newExpiresAt) {
        return new OAuthToken(newAccessToken, refreshToken, newExpiresAt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }
}
