package com.github.dimitryivaniuta.canvas.http.middleware.logging;

import com.github.dimitryivaniuta.canvas.support.CanvasJson;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static com.github.dimitryivaniuta.canvas.http.middleware.logging.SensitiveDataSanitizer.REDACTED;
import static org.assertj.core.api.Assertions.assertThat;

class SensitiveDataSanitizerTest {

    private final SensitiveDataSanitizer sanitizer = new SensitiveDataSanitizer(
            List.of("password", "token", "api_key", "secret", "authorization"), CanvasJson.newMapper());

    @Test
    void shouldMatchFieldNamesBySubstringIgnoringCase() {
        assertThat(sanitizer.isSensitive("Authorization")).isTrue();
        assertThat(sanitizer.isSensitive("X-Refresh-Token")).isTrue();
        assertThat(sanitizer.isSensitive("client_secret")).isTrue();
        assertThat(sanitizer.isSensitive("Content-Type")).isFalse();
    }

    @Test
    void shouldMaskSensitiveHeaders() {
        Map<String, List<String>> out = sanitizer.sanitizeHeaders(Map.of(
                "Authorization", List.of("Bearer abc"),
                "Accept", List.of("application/json")));

        assertThat(out).containsEntry("Authorization", List.of(REDACTED))
                .containsEntry("Accept", List.of("application/json"));
    }

    @Test
    void shouldMaskNestedJsonFields() {
        String body = "{\"user\":{\"name\":\"ann\",\"password\":\"x\"},\"items\":[{\"access_token\":\"y\"}]}";

        String out = sanitizer.sanitizeBody(body);

        assertThat(out).contains("\"name\":\"ann\"")
                .contains("\"password\":\"" + REDACTED + "\"")
                .contains("\"access_token\":\"" + REDACTED + "\"")
                .doesNotContain("\"x\"")
                .doesNotContain("\"y\"");
    }

    @Test
    void shouldMaskFormEncodedAndPlainText() {
        assertThat(sanitizer.sanitizeBody("grant_type=refresh_token&refresh_token=abc123&client_id=9"))
                .contains("refresh_token=" + REDACTED)
                .contains("client_id=9")
                .doesNotContain("abc123");
        assertThat(sanitizer.sanitizeBody("api_key: s3cr3t")).isEqualTo("api_key: " + REDACTED);
    }

    @Test
    void shouldLeaveHarmlessBodiesAlone() {
        assertThat(sanitizer.sanitizeBody("hello")).isEqualTo("hello");
        assertThat(sanitizer.sanitizeBody("")).isEmpty();
        assertThat(sanitizer.sanitizeBody(null)).isNull();
    }

    @Test
    void shouldMaskSensitiveQueryParametersInUri() {
        URI uri = URI.create("https://canvas.test/api/v1/courses?per_page=10&access_token=abc123&page=2#top");

        assertThat(sanitizer.sanitizeUri(uri))
                .isEqualTo("https://canvas.test/api/v1/courses?per_page=10&access_token=" + REDACTED + "&page=2#top");
        assertThat(sanitizer.sanitizeUri(URI.create("https://canvas.test/api/v1/courses")))
                .isEqualTo("https://canvas.test/api/v1/courses");
    }
}
