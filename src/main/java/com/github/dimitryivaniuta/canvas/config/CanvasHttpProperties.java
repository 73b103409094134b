package com.github.dimitryivaniuta.canvas.config;

import com.github.dimitryivaniuta.canvas.auth.AuthMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code canvas.*} settings. Each middleware section is translated into that middleware's
 * snake_case option map by {@code toConfig()}; unset values keep the middleware defaults.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "canvas")
public class CanvasHttpProperties {

    private String baseUrl;
    @NotNull
    private AuthMode authMode = AuthMode.API_KEY;
    private String apiKey;

    @Valid
    private OAuth oauth = new OAuth();
    @Valid
    private Http http = new Http();

    @Valid
    private Retry retry = new Retry();
    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Logging logging = new Logging();
    @Valid
    private OAuthRefresh oauthRefresh = new OAuthRefresh();

    @Getter
    @Setter
    public static class OAuth {
        private String clientId;
        private String clientSecret;
        private String accessToken;
        private String refreshToken;
        private Instant expiresAt;
    }

    @Getter
    @Setter
    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Retry {
        private boolean enabled = true;
        @PositiveOrZero
        private Integer maxAttempts;
        private Duration delay;
        @Min(1)
        private Double multiplier;
        private Duration maxDelay;
        private Boolean jitter;
        private List<Integer> retryOnStatus;
        private Boolean retryOnTimeout;

        public Map<String, Object> toConfig() {
            Map<String, Object> m = new LinkedHashMap<>();
            put(m, "max_attempts", maxAttempts);
            put(m, "delay", delay == null ? null : delay.toMillis());
            put(m, "multiplier", multiplier);
            put(m, "max_delay", maxDelay == null ? null : maxDelay.toMillis());
            put(m, "jitter", jitter);
            put(m, "retry_on_status", retryOnStatus);
            put(m, "retry_on_timeout", retryOnTimeout);
            return m;
        }
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        @Positive
        private Integer bucketSize;
        @Positive
        private Double leakRate;
        @PositiveOrZero
        private Integer initialCost;
        @PositiveOrZero
        private Integer minRemaining;
        private Boolean waitOnLimit;
        private Duration maxWaitTime;

        public Map<String, Object> toConfig() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("enabled", enabled);
            put(m, "bucket_size", bucketSize);
            put(m, "leak_rate", leakRate);
            put(m, "initial_cost", initialCost);
            put(m, "min_remaining", minRemaining);
            put(m, "wait_on_limit", waitOnLimit);
            put(m, "max_wait_time", maxWaitTime == null ? null : maxWaitTime.toSeconds());
            return m;
        }
    }

    @Getter
    @Setter
    public static class Cache {
        public enum Adapter { CAFFEINE, MEMORY, FILESYSTEM }

        private boolean enabled = false;
        private Adapter adapter = Adapter.CAFFEINE;
        private Duration defaultTtl;
        private Boolean cacheGetOnly;
        private Boolean cacheSuccessOnly;
        private Boolean invalidateOnMutation;
        @Positive
        private long maxEntries = 10_000;
        @NotNull
        private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "canvas-cache");

        public Map<String, Object> toConfig() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("enabled", enabled);
            put(m, "default_ttl", defaultTtl == null ? null : defaultTtl.toSeconds());
            put(m, "cache_get_only", cacheGetOnly);
            put(m, "cache_success_only", cacheSuccessOnly);
            put(m, "invalidate_on_mutation", invalidateOnMutation);
            return m;
        }
    }

    @Getter
    @Setter
    public static class Logging {
        private boolean enabled = true;
        private Boolean logRequests;
        private Boolean logResponses;
        private Boolean logErrors;
        private Boolean logTiming;
        private String logLevel;
        private String errorLogLevel;
        private List<String> sanitizeFields;
        @PositiveOrZero
        private Integer maxBodyLength;

        public Map<String, Object> toConfig() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("enabled", enabled);
            put(m, "log_requests", logRequests);
            put(m, "log_responses", logResponses);
            put(m, "log_errors", logErrors);
            put(m, "log_timing", logTiming);
            put(m, "log_level", logLevel);
            put(m, "error_log_level", errorLogLevel);
            put(m, "sanitize_fields", sanitizeFields);
            put(m, "max_body_length", maxBodyLength);
            return m;
        }
    }

    @Getter
    @Setter
    public static class OAuthRefresh {
        private Boolean autoRefresh;
        private Boolean retryOn401;

        public Map<String, Object> toConfig() {
            Map<String, Object> m = new LinkedHashMap<>();
            put(m, "auto_refresh", autoRefresh);
            put(m, "retry_on_401", retryOn401);
            return m;
        }
    }

    private static void put(Map<String, Object> m, String key, Object value) {
        if (value != null) m.put(key, value);
    }
}
