package io.endpoints.spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Turns response payload bytes into a typed value.
 *
 * @param <T> the decoded type
 */
@FunctionalInterface
public interface ResponseDecoder<T> {

    T decode(byte[] payload) throws IOException;

    /**
     * Returns a decoder that hands out the raw payload.
     *
     * @return the identity decoder
     */
    static ResponseDecoder<byte[]> bytes() {
        return payload -> payload;
    }

    /**
     * Returns a decoder for endpoints whose response body carries no information.
     *
     * @return a decoder that ignores the payload and produces {@code null}
     */
    static ResponseDecoder<Void> discarding() {
        return payload -> null;
    }

    static ResponseDecoder<String> utf8String() {
        return payload -> new String(payload, StandardCharsets.UTF_8);
    }
}
