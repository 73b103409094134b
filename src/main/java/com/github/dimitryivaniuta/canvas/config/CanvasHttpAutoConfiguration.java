package com.github.dimitryivaniuta.canvas.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.canvas.auth.CanvasCredentials;
import com.github.dimitryivaniuta.canvas.auth.CanvasOAuthTokenRefresher;
import com.github.dimitryivaniuta.canvas.auth.OAuthToken;
import com.github.dimitryivaniuta.canvas.auth.OAuthTokenRefresher;
import com.github.dimitryivaniuta.canvas.cache.CacheAdapter;
import com.github.dimitryivaniuta.canvas.cache.CaffeineCacheAdapter;
import com.github.dimitryivaniuta.canvas.cache.FileSystemCacheAdapter;
import com.github.dimitryivaniuta.canvas.cache.InMemoryCacheAdapter;
import com.github.dimitryivaniuta.canvas.cache.ResponseSerializer;
import com.github.dimitryivaniuta.canvas.http.CanvasHttpClient;
import com.github.dimitryivaniuta.canvas.http.SpringHttpTransport;
import com.github.dimitryivaniuta.canvas.http.middleware.Middleware;
import com.github.dimitryivaniuta.canvas.http.middleware.MiddlewareStack;
import com.github.dimitryivaniuta.canvas.http.middleware.Sleeper;
import com.github.dimitryivaniuta.canvas.http.middleware.cache.CacheMiddleware;
import com.github.dimitryivaniuta.canvas.http.middleware.logging.LoggingMiddleware;
import com.github.dimitryivaniuta.canvas.http.middleware.oauth.OAuth2RefreshMiddleware;
import com.github.dimitryivaniuta.canvas.http.middleware.ratelimit.BucketKeyResolver;
import com.github.dimitryivaniuta.canvas.http.middleware.ratelimit.BucketStore;
import com.github.dimitryivaniuta.canvas.http.middleware.ratelimit.RateLimitMiddleware;
import com.github.dimitryivaniuta.canvas.http.middleware.retry.RetryMiddleware;
import com.github.dimitryivaniuta.canvas.metrics.MiddlewareMetrics;
import com.github.dimitryivaniuta.canvas.support.CanvasJson;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires a ready-to-use {@link CanvasHttpClient} from {@code canvas.*} properties.
 *
 * Stack order (outer to inner): oauth2_refresh, rate-limit, cache, retry, logging.
 * Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(CanvasHttpProperties.class)
public class CanvasHttpAutoConfiguration {

    // kept private to the toolkit so the application's ObjectMapper is left alone
    private final ObjectMapper objectMapper = CanvasJson.newMapper();

    @Bean
    @ConditionalOnMissingBean
    public CanvasCredentials canvasCredentials(CanvasHttpProperties props) {
        CanvasHttpProperties.OAuth oauth = props.getOauth();
        OAuthToken token = (oauth.getAccessToken() == null && oauth.getRefreshToken() == null)
                ? null
                : new OAuthToken(oauth.getAccessToken(), oauth.getRefreshToken(), oauth.getExpiresAt());
        return CanvasCredentials.builder()
                .baseUrl(props.getBaseUrl())
                .authMode(props.getAuthMode())
                .apiKey(props.getApiKey())
                .clientId(oauth.getClientId())
                .clientSecret(oauth.getClientSecret())
                .oauthToken(token)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public MiddlewareMetrics canvasMiddlewareMetrics(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry r = registry.getIfAvailable();
        return (r != null) ? new MiddlewareMetrics(r) : MiddlewareMetrics.standalone();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpringHttpTransport canvasHttpTransport(CanvasHttpProperties props) {
        return SpringHttpTransport.create(props.getHttp().getConnectTimeout(), props.getHttp().getReadTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public BucketStore canvasBucketStore() {
        return BucketStore.shared();
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheAdapter canvasCacheAdapter(CanvasHttpProperties props) {
        CanvasHttpProperties.Cache cache = props.getCache();
        return switch (cache.getAdapter()) {
            case MEMORY -> new InMemoryCacheAdapter((int) cache.getMaxEntries(), Clock.systemUTC());
            case FILESYSTEM -> new FileSystemCacheAdapter(cache.getDirectory(), objectMapper);
            case CAFFEINE -> new CaffeineCacheAdapter(cache.getMaxEntries(), Ticker.systemTicker());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthTokenRefresher canvasOAuthTokenRefresher(CanvasCredentials credentials, SpringHttpTransport transport) {
        return new CanvasOAuthTokenRefresher(credentials, transport, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuth2RefreshMiddleware canvasOAuth2RefreshMiddleware(CanvasHttpProperties props,
                                                                 CanvasCredentials credentials,
                                                                 OAuthTokenRefresher refresher,
                                                                 MiddlewareMetrics metrics) {
        return new OAuth2RefreshMiddleware(props.getOauthRefresh().toConfig(), credentials, refresher, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitMiddleware canvasRateLimitMiddleware(CanvasHttpProperties props,
                                                         CanvasCredentials credentials,
                                                         BucketStore store,
                                                         MiddlewareMetrics metrics) {
        return new RateLimitMiddleware(props.getRateLimit().toConfig(), store,
                new BucketKeyResolver(credentials), Sleeper.THREAD, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheMiddleware canvasCacheMiddleware(CanvasHttpProperties props, CacheAdapter adapter, MiddlewareMetrics metrics) {
        return new CacheMiddleware(props.getCache().toConfig(), adapter, null, null, new ResponseSerializer(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMiddleware canvasRetryMiddleware(CanvasHttpProperties props, MiddlewareMetrics metrics) {
        return new RetryMiddleware(props.getRetry().toConfig(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingMiddleware canvasLoggingMiddleware(CanvasHttpProperties props) {
        return new LoggingMiddleware(props.getLogging().toConfig(), LoggerFactory.getLogger(LoggingMiddleware.class), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public MiddlewareStack canvasMiddlewareStack(CanvasHttpProperties props,
                                                 OAuth2RefreshMiddleware oauth,
                                                 RateLimitMiddleware rateLimit,
                                                 CacheMiddleware cache,
                                                 RetryMiddleware retry,
                                                 LoggingMiddleware logging) {
        List<Middleware> chain = new ArrayList<>();
        chain.add(oauth);
        chain.add(rateLimit);
        chain.add(cache);
        if (props.getRetry().isEnabled()) {
            chain.add(retry);
        }
        chain.add(logging);
        return new MiddlewareStack(chain);
    }

    @Bean
    @ConditionalOnMissingBean
    public CanvasHttpClient canvasHttpClient(CanvasCredentials credentials,
                                             MiddlewareStack stack,
                                             SpringHttpTransport transport,
                                             MiddlewareMetrics metrics) {
        return new CanvasHttpClient(credentials, stack, transport, objectMapper, metrics);
    }
}
