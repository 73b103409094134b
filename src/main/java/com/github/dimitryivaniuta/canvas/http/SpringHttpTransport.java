package com.github.dimitryivaniuta.canvas.http;

import com.github.dimitryivaniuta.canvas.exception.ConnectionException;
import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Innermost handler: sends the request through a Spring {@link ClientHttpRequestFactory}.
 *
 * <p>Statuses of 400 and above raise {@link HttpResponseException} unless the request sets
 * {@code http_errors=false}. I/O failures, timeouts included, become {@link ConnectionException}.
 */
public class SpringHttpTransport implements HttpHandler {

    private final ClientHttpRequestFactory requestFactory;

    public SpringHttpTransport(ClientHttpRequestFactory requestFactory) {
        this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory must not be null");
    }

    /** JDK {@link HttpClient} based transport. */
    public static SpringHttpTransport create(Duration connectTimeout, Duration readTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client);
        factory.setReadTimeout(readTimeout);
        return new SpringHttpTransport(factory);
    }

    @Override
    public CanvasResponse handle(CanvasRequest request, RequestOptions options) {
        CanvasResponse response;
        try {
            ClientHttpRequest outgoing = requestFactory.createRequest(request.getUri(), HttpMethod.valueOf(request.getMethod()));
            outgoing.getHeaders().putAll(request.getHeaders());

            byte[] body = request.getBody().readAllBytes();
            if (body.length > 0) {
                StreamUtils.copy(body, outgoing.getBody());
            }

            try (ClientHttpResponse incoming = outgoing.execute()) {
                response = CanvasResponse.builder()
                        .statusCode(incoming.getStatusCode().value())
                        .reasonPhrase(incoming.getStatusText())
                        .headers(incoming.getHeaders())
                        .body(StreamUtils.copyToByteArray(incoming.getBody()))
                        .build();
            }
        } catch (IOException e) {
            throw new ConnectionException("Request " + request + " failed: " + e.getMessage(), request, e);
        } catch (UncheckedIOException e) {
            throw new ConnectionException("Request " + request + " failed: " + e.getMessage(), request, e.getCause());
        }

        if (response.getStatusCode() >= 400 && !options.isFalse(RequestOptionKeys.HTTP_ERRORS)) {
            throw HttpResponseException.of(request, response);
        }
        return response;
    }
}
