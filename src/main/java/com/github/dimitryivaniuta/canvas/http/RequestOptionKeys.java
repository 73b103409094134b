package com.github.dimitryivaniuta.canvas.http;

/**
 * Well-known {@link RequestOptions} keys. Options are an open map, anything else is carried along untouched.
 */
public final class RequestOptionKeys {
    private RequestOptionKeys() {}

    public static final String QUERY = "query";
    public static final String HEADERS = "headers";
    public static final String JSON = "json";
    public static final String FORM_PARAMS = "form_params";
    public static final String BODY = "body";

    public static final String HTTP_ERRORS = "http_errors";
    public static final String SKIP_AUTH = "skip_auth";

    public static final String CACHE = "cache";
    public static final String CACHE_REFRESH = "cache_refresh";
    public static final String CACHE_TTL = "cache_ttl";

    public static final String RATE_LIMIT_BUCKET = "rate_limit_bucket";
    public static final String RETRY_ATTEMPT = "retry_attempt";
}
