package io.endpoints.spec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class EndpointRequestTest {

    private static final URI URI_VALUE = URI.create("https://api.example.com/user/42");

    @Test
    void testHeadersAreCaseInsensitive() {
        EndpointRequest request = EndpointRequest.builder(Method.GET, URI_VALUE)
                .header("Content-Type", "application/json")
                .build();

        assertEquals("application/json", request.header("content-type"));
        assertTrue(request.hasHeader("CONTENT-TYPE"));
    }

    @Test
    void testWithHeaderReturnsCopy() {
        EndpointRequest request = EndpointRequest.builder(Method.POST, URI_VALUE)
                .body("{}".getBytes(StandardCharsets.UTF_8))
                .build();

        EndpointRequest authorized = request.withHeader("Authorization", "Bearer token");

        assertNull(request.header("Authorization"));
        assertEquals("Bearer token", authorized.header("authorization"));
        assertArrayEquals("{}".getBytes(StandardCharsets.UTF_8), authorized.body());
        assertEquals(Method.POST, authorized.method());
        assertEquals(URI_VALUE, authorized.uri());
    }

    @Test
    void testWithHeaderReplacesExistingValue() {
        EndpointRequest request = EndpointRequest.builder(Method.GET, URI_VALUE)
                .header("authorization", "Bearer old")
                .build()
                .withHeader("Authorization", "Bearer new");

        assertEquals(1, request.headers().size());
        assertEquals("Bearer new", request.header("Authorization"));
    }

    @Test
    void testEquality() {
        EndpointRequest first = EndpointRequest.builder(Method.GET, URI_VALUE).header("A", "1").build();
        EndpointRequest second = EndpointRequest.builder(Method.GET, URI_VALUE).header("a", "1").build();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
