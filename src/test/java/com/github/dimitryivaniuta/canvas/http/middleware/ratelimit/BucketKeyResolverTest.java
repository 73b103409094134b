package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import com.github.dimitryivaniuta.canvas.auth.AuthMode;
import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.auth.OAuthToken;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.support.DigestSupport;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BucketKeyResolverTest {

    private static final CanvasRequest REQUEST = CanvasRequest.of("GET", "https://school.instructure.com/api/v1/courses");

    @Test
    void shouldCombineHostWithCredentialFingerprint() {
        BucketKeyResolver resolver = new BucketKeyResolver(
                CanvasCredentials.apiKey("https://school.instructure.com", "secret-key"));

        String key = resolver.resolve(REQUEST, RequestOptions.empty());

        assertThat(key).isEqualTo("school.instructure.com_" + DigestSupport.sha1Hex("secret-key").substring(0, 8));
        assertThat(key).doesNotContain("secret-key");
    }

    @Test
    void shouldGiveDifferentCredentialsOnSameHostDifferentBuckets() {
        String a = new BucketKeyResolver(CanvasCredentials.apiKey("https://school.instructure.com", "key-a"))
                .resolve(REQUEST, RequestOptions.empty());
        String b = new BucketKeyResolver(CanvasCredentials.apiKey("https://school.instructure.com", "key-b"))
                .resolve(REQUEST, RequestOptions.empty());

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void shouldFingerprintAccessTokenInOAuthMode() {
        CanvasCredentials oauth = CanvasCredentials.builder()
                .baseUrl("https://school.instructure.com")
                .authMode(AuthMode.OAUTH)
                .apiKey("ignored-in-oauth-mode")
                .oauthToken(new OAuthToken("access-1", "refresh-1", null))
                .build();

        String key = new BucketKeyResolver(oauth).resolve(REQUEST, RequestOptions.empty());

        assertThat(key).endsWith("_" + DigestSupport.sha1Hex("access-1").substring(0, 8));
    }

    @Test
    void shouldPreferExplicitOverride() {
        BucketKeyResolver resolver = new BucketKeyResolver(CanvasCredentials.apiKey("https://school.instructure.com", "k"));

        String key = resolver.resolve(REQUEST, RequestOptions.of(Map.of(RequestOptionKeys.RATE_LIMIT_BUCKET, "reports")));

        assertThat(key).isEqualTo("reports");
    }

    @Test
    void shouldFallBackToConfiguredHostThenDefault() {
        CanvasRequest relative = CanvasRequest.of("GET", "/api/v1/courses");

        assertThat(new BucketKeyResolver(CanvasCredentials.builder().baseUrl("https://other.test").build())
                .resolve(relative, RequestOptions.empty()))
                .isEqualTo("other.test");
        assertThat(new BucketKeyResolver(null).resolve(relative, RequestOptions.empty()))
                .isEqualTo(BucketKeyResolver.DEFAULT_KEY);
    }
}
