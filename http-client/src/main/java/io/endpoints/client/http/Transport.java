package io.endpoints.client.http;

import java.util.concurrent.CompletableFuture;

import io.endpoints.spec.EndpointRequest;

/**
 * Performs the actual HTTP exchange for an assembled {@link EndpointRequest}.
 * <p>
 * Every response the server sends, whatever its status, completes the future normally;
 * only failures to obtain a response (connection refused, unknown host, timeouts)
 * complete it exceptionally. Timeouts, redirects and connection pooling are the
 * transport's concern.
 */
public interface Transport {

    static Transport create() {
        return TransportBuilder.DEFAULT_FACTORY.create();
    }

    CompletableFuture<TransportResponse> send(EndpointRequest request);
}
