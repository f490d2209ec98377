package io.endpoints.client.http.jdk;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.endpoints.client.http.Transport;
import io.endpoints.client.http.TransportResponse;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} backed by {@link java.net.http.HttpClient}.
 */
public class JdkTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkTransport.class);

    private final HttpClient httpClient;
    private final @Nullable Duration requestTimeout;

    JdkTransport(HttpClient httpClient, @Nullable Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<TransportResponse> send(EndpointRequest request) {
        final HttpRequest httpRequest;
        try {
            httpRequest = createRequest(request);
        } catch (IllegalArgumentException e) {
            // restricted headers and unsupported methods are rejected by the JDK builder
            return CompletableFuture.failedFuture(e);
        }
        LOGGER.debug("Sending {} {}", request.method(), request.uri());
        return httpClient.sendAsync(httpRequest, BodyHandlers.ofByteArray())
                .thenApply(response -> new TransportResponse(
                        new ResponseMetadata(response.statusCode(), headers(response.headers().map())),
                        response.body()));
    }

    private HttpRequest createRequest(EndpointRequest request) {
        byte[] body = request.body();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .method(request.method().asString(), body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body));
        for (Map.Entry<String, String> headerEntry : request.headers().entrySet()) {
            builder.header(headerEntry.getKey(), headerEntry.getValue());
        }
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        return builder.build();
    }

    private static Map<String, List<String>> headers(Map<String, List<String>> raw) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            // HTTP/2 pseudo headers
            if (!entry.getKey().startsWith(":")) {
                headers.put(entry.getKey(), entry.getValue());
            }
        }
        return headers;
    }
}
