package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.support.DigestSupport;

import java.util.Optional;

/**
 * Picks the bucket a request is charged to.
 *
 * Key format, first match wins:
 * - the {@code rate_limit_bucket} option, verbatim
 * - {@code <host>_<first 8 hex chars of sha1(credential)>}
 * - {@code <host>} when no credential is configured
 * - {@code default} when no host is known
 *
 * The host comes from the request URI, falling back to the configured base URL.
 */
public final class BucketKeyResolver {

    public static final String DEFAULT_KEY = "default";

    private static final int FINGERPRINT_LENGTH = 8;

    private final CanvasCredentials credentials;

    /** @param credentials may be null; keys then depend on the request host only */
    public BucketKeyResolver(CanvasCredentials credentials) {
        this.credentials = credentials;
    }

    public String resolve(CanvasRequest request, RequestOptions options) {
        Optional<String> override = options.getString(RequestOptionKeys.RATE_LIMIT_BUCKET);
        if (override.isPresent()) return override.get();

        String host = host(request);
        if (host == null) return DEFAULT_KEY;

        return fingerprint()
                .map(fp -> host + "_" + fp)
                .orElse(host);
    }

    private String host(CanvasRequest request) {
        String h = request.getUri().getHost();
        if (h != null && !h.isBlank()) return h;
        if (credentials == null) return null;
        return credentials.baseHost().filter(s -> !s.isBlank()).orElse(null);
    }

    private Optional<String> fingerprint() {
        if (credentials == null) return Optional.empty();
        return credentials.activeCredential()
                .map(secret -> DigestSupport.prefix(DigestSupport.sha1Hex(secret), FINGERPRINT_LENGTH));
    }
}
