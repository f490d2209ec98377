package io.endpoints.client.http.vertx;

import io.endpoints.client.http.Transport;
import io.endpoints.client.http.TransportBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.jspecify.annotations.Nullable;

public class VertxTransportBuilder implements TransportBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxTransportBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    public VertxTransportBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public Transport create() {
        Vertx selected = vertx != null ? vertx : Vertx.vertx();
        return new VertxTransport(selected.createHttpClient(options != null ? options : new HttpClientOptions()));
    }
}
