package io.endpoints.client.http;

import io.endpoints.client.http.jdk.JdkTransportBuilder;

public interface TransportBuilder {

    TransportBuilder DEFAULT_FACTORY = new JdkTransportBuilder();

    Transport create();
}
