package com.github.dimitryivaniuta.canvas.cache;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptionKeys;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;
import com.github.dimitryivaniuta.canvas.support.CanvasJson;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultCacheKeyGeneratorTest {

    private final DefaultCacheKeyGenerator generator = new DefaultCacheKeyGenerator(CanvasJson.newMapper());

    @Test
    void shouldBuildReadableKeyForAnonymousRequest() {
        String key = generator.generate(
                CanvasRequest.of("GET", "https://canvas.test/api/v1/courses"), RequestOptions.empty());

        assertThat(key).isEqualTo("canvas:v1:GET:/api/v1/courses");
    }

    @Test
    void shouldIgnoreQueryParameterOrder() {
        String a = generator.generate(
                CanvasRequest.of("GET", "https://canvas.test/api/v1/courses?per_page=50&include[]=term"),
                RequestOptions.empty());
        String b = generator.generate(
                CanvasRequest.of("GET", "https://canvas.test/api/v1/courses?include[]=term&per_page=50"),
                RequestOptions.empty());

        assertThat(a).isEqualTo(b).endsWith("/api/v1/courses?include[]=term&per_page=50");
    }

    @Test
    void shouldSeparateUsersByAuthorization() {
        CanvasRequest base = CanvasRequest.of("GET", "https://canvas.test/api/v1/users/self");

        String alice = generator.generate(base.withHeader(HttpHeaders.AUTHORIZATION, "Bearer alice"), RequestOptions.empty());
        String bob = generator.generate(base.withHeader(HttpHeaders.AUTHORIZATION, "Bearer bob"), RequestOptions.empty());

        assertThat(alice).isNotEqualTo(bob);
        assertThat(alice).doesNotContain("alice");
    }

    @Test
    void shouldIncludeOptionsThatChangeTheResponse() {
        CanvasRequest request = CanvasRequest.of("GET", "https://canvas.test/api/v1/courses");

        String plain = generator.generate(request, RequestOptions.empty());
        String withQuery = generator.generate(request, RequestOptions.of(Map.of(RequestOptionKeys.QUERY, Map.of("per_page", 10))));
        String withAuthHeaderOnly = generator.generate(request,
                RequestOptions.of(Map.of(RequestOptionKeys.HEADERS, Map.of("Authorization", "Bearer x"))));

        assertThat(withQuery).isNotEqualTo(plain);
        assertThat(withAuthHeaderOnly).isEqualTo(plain);
    }

    @Test
    void shouldUseCustomPrefix() {
        String key = new DefaultCacheKeyGenerator("tenant-a", CanvasJson.newMapper())
                .generate(CanvasRequest.of("GET", "https://canvas.test/api/v1/terms"), RequestOptions.empty());

        assertThat(key).startsWith("tenant-a:v1:GET:");
    }
}
