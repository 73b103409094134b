package com.github.dimitryivaniuta.canvas.auth;

/**
 * Exchanges the stored refresh token for a new access token and stores it in the credentials.
 */
@FunctionalInterface
public interface OAuthTokenRefresher {

    /**
     * @return the token now held by the credentials
     * @throws com.github.dimitryivaniuta.canvas.exception.MissingOAuthTokenException no refresh token is stored
     * @throws com.github.dimitryivaniuta.canvas.exception.OAuthRefreshFailedException Canvas rejected the refresh
     */
    OAuthToken refresh();
}
