/**
 * Transport SPI used by the endpoint client to exchange requests over HTTP.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.endpoints.client.http.Transport} - sends one assembled request and yields the raw response</li>
 *   <li>{@link io.endpoints.client.http.TransportResponse} - status, headers and body bytes</li>
 *   <li>{@link io.endpoints.client.http.TransportBuilder} - factory for transport instances</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link io.endpoints.client.http.jdk.JdkTransport} - default, backed by the JDK HttpClient</li>
 *   <li>VertxTransport - Vert.x web client based, in the {@code endpoints-http-client-vertx} module</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Transport transport = new JdkTransportBuilder()
 *     .connectTimeout(Duration.ofSeconds(5))
 *     .create();
 *
 * EndpointRequest request = EndpointRequest.builder(Method.GET, URI.create("https://api.example.com/status"))
 *     .header("Accept", "application/json")
 *     .build();
 *
 * TransportResponse response = transport.send(request).join();
 * }</pre>
 */
@NullMarked
package io.endpoints.client.http;

import org.jspecify.annotations.NullMarked;
