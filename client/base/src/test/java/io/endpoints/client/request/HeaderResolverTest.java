package io.endpoints.client.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.util.List;
import java.util.Map;

import io.endpoints.spec.EndpointDefinition;
import io.endpoints.spec.EndpointException;
import io.endpoints.spec.Method;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

public class HeaderResolverTest {

    enum Priority {
        HIGH
    }

    record Headers(@Nullable String trace, Object custom) {
    }

    @Test
    void testFieldAndValueHeaders() throws Exception {
        EndpointDefinition<Headers, Void> definition = EndpointDefinition.<Headers, Void>builder(Method.GET)
                .header("X-Trace", Headers::trace)
                .headerValue("HARD_CODED_HEADER", "test2")
                .header("X-Custom", Headers::custom)
                .build();

        Map<String, String> headers = HeaderResolver.resolve(definition, new Headers("abc", Priority.HIGH));

        assertEquals(List.of("X-Trace", "HARD_CODED_HEADER", "X-Custom"), List.copyOf(headers.keySet()));
        assertEquals("abc", headers.get("X-Trace"));
        assertEquals("HIGH", headers.get("X-Custom"));
    }

    @Test
    void testNullValueOmitsHeader() throws Exception {
        EndpointDefinition<Headers, Void> definition = EndpointDefinition.<Headers, Void>builder(Method.GET)
                .header("X-Trace", Headers::trace)
                .build();

        assertFalse(HeaderResolver.resolve(definition, new Headers(null, 1)).containsKey("X-Trace"));
    }

    @Test
    void testSupportedScalarTypes() throws Exception {
        assertEquals("12", HeaderResolver.headerValue("h", 12));
        assertEquals("false", HeaderResolver.headerValue("h", false));
        assertEquals("https://example.com", HeaderResolver.headerValue("h", URI.create("https://example.com")));
    }

    @Test
    void testUnsupportedTypeFails() {
        EndpointException e = assertThrows(EndpointException.class,
                () -> HeaderResolver.headerValue("X-List", List.of("a")));
        assertEquals(EndpointException.Reason.INVALID_HEADER, e.getReason());
        assertEquals("X-List", e.getName());
    }
}
