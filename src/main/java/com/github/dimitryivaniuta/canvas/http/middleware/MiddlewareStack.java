package com.github.dimitryivaniuta.canvas.http.middleware;

import com.github.dimitryivaniuta.canvas.http.HttpHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered middleware list composed around a transport handler.
 *
 * <p>Order (outer -> inner) is the list order. The default Canvas stack is:
 * <ol>
 *   <li>OAuth refresh: rewrites the token around everything else</li>
 *   <li>Rate limit: charges the bucket once per logical call</li>
 *   <li>Cache: short-circuits reads, never charged twice</li>
 *   <li>Retry: repeats only what is inside it</li>
 *   <li>Logging: one record per physical attempt</li>
 * </ol>
 * Moving retry outside rate limiting would charge the bucket on every attempt.
 */
public final class MiddlewareStack {

    private final List<Middleware> middleware;

    public MiddlewareStack(List<? extends Middleware> middleware) {
        List<Middleware> copy = new ArrayList<>();
        for (Middleware m : middleware) {
            Objects.requireNonNull(m, "middleware must not contain null");
            if (m.getName() == null || m.getName().isBlank()) {
                throw new IllegalArgumentException("middleware name must not be blank: " + m.getClass().getName());
            }
            copy.add(m);
        }
        this.middleware = List.copyOf(copy);
    }

    public static MiddlewareStack of(Middleware... middleware) {
        return new MiddlewareStack(List.of(middleware));
    }

    /**
     * Wraps {@code transport} so that the first middleware is the outermost.
     */
    public HttpHandler compose(HttpHandler transport) {
        HttpHandler handler = Objects.requireNonNull(transport, "transport must not be null");
        for (int i = middleware.size() - 1; i >= 0; i--) {
            handler = middleware.get(i).wrap(handler);
        }
        return handler;
    }

    public List<Middleware> middleware() {
        return middleware;
    }

    public List<String> names() {
        return middleware.stream().map(Middleware::getName).toList();
    }

    public <T extends Middleware> Optional<T> find(Class<T> type) {
        return middleware.stream().filter(type::isInstance).map(type::cast).findFirst();
    }
}
