package com.github.dimitryivaniuta.canvas.auth;

public enum AuthMode {
    API_KEY,
    OAUTH
}
