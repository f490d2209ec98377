package io.endpoints.client.http.vertx;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.endpoints.client.http.Transport;
import io.endpoints.client.http.TransportResponse;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} backed by a Vert.x {@link HttpClient}.
 */
public class VertxTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(VertxTransport.class);

    private final HttpClient client;

    VertxTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<TransportResponse> send(EndpointRequest request) {
        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(request.method().asString()))
                .setAbsoluteURI(request.uri().toString());
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            options.putHeader(header.getKey(), header.getValue());
        }
        byte[] body = request.body();

        LOGGER.debug("Sending {} {}", request.method(), request.uri());
        return client.request(options)
                .compose(httpRequest -> body == null
                        ? httpRequest.send()
                        : httpRequest.send(Buffer.buffer(body)))
                .compose(VertxTransport::toTransportResponse)
                .toCompletionStage()
                .toCompletableFuture();
    }

    private static Future<TransportResponse> toTransportResponse(HttpClientResponse response) {
        ResponseMetadata metadata = new ResponseMetadata(response.statusCode(), headers(response.headers()));
        return response.body()
                .map(buffer -> new TransportResponse(metadata, buffer.getBytes()));
    }

    private static Map<String, List<String>> headers(MultiMap multiMap) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : multiMap.names()) {
            headers.put(name, multiMap.getAll(name));
        }
        return headers;
    }
}
