package io.endpoints.client.http.jdk;

import java.net.http.HttpClient;
import java.time.Duration;

import io.endpoints.client.http.Transport;
import io.endpoints.client.http.TransportBuilder;
import io.endpoints.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link JdkTransport}s.
 * <p>
 * Without further configuration the transport follows redirects and prefers HTTP/2,
 * falling back to HTTP/1.1 where the server does not support it.
 */
public class JdkTransportBuilder implements TransportBuilder {

    private @Nullable HttpClient httpClient;
    private @Nullable Duration connectTimeout;
    private @Nullable Duration requestTimeout;
    private HttpClient.Version version = HttpClient.Version.HTTP_2;

    /**
     * Uses an existing client; the connect timeout and version settings are then ignored.
     *
     * @param httpClient the client to send requests with
     * @return this builder
     */
    public JdkTransportBuilder httpClient(HttpClient httpClient) {
        this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
        return this;
    }

    public JdkTransportBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = Assert.checkNotNullParam("connectTimeout", connectTimeout);
        return this;
    }

    public JdkTransportBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = Assert.checkNotNullParam("requestTimeout", requestTimeout);
        return this;
    }

    public JdkTransportBuilder version(HttpClient.Version version) {
        this.version = Assert.checkNotNullParam("version", version);
        return this;
    }

    @Override
    public Transport create() {
        HttpClient client = httpClient;
        if (client == null) {
            HttpClient.Builder builder = HttpClient.newBuilder()
                    .version(version)
                    .followRedirects(HttpClient.Redirect.NORMAL);
            if (connectTimeout != null) {
                builder.connectTimeout(connectTimeout);
            }
            client = builder.build();
        }
        return new JdkTransport(client, requestTimeout);
    }
}
