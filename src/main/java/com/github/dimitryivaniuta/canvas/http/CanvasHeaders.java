package com.github.dimitryivaniuta.canvas.http;

/**
 * Canvas-specific response headers (wire contract).
 */
public final class CanvasHeaders {
    private CanvasHeaders() {}

    /** Units left in the account's bucket after this request. */
    public static final String RATE_LIMIT_REMAINING = "X-Rate-Limit-Remaining";

    /** Units charged for this request. */
    public static final String REQUEST_COST = "X-Request-Cost";

    /** Set on responses replayed from the local cache; such responses never reached Canvas. */
    public static final String CACHE_STATUS = "X-Canvas-Cache";

    public static final String CACHE_HIT = "HIT";

    public static final String RATE_LIMIT_EXCEEDED_BODY = "Rate Limit Exceeded";
}
