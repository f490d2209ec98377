package io.endpoints.client.http;

import io.endpoints.spec.ResponseMetadata;
import org.jspecify.annotations.Nullable;

/**
 * The raw outcome of a transport exchange.
 *
 * @param metadata status and headers, or {@code null} if the transport produced none
 * @param body the response body bytes, or {@code null} if there was no body
 */
public record TransportResponse(@Nullable ResponseMetadata metadata, byte @Nullable [] body) {

    public static TransportResponse of(int statusCode, byte @Nullable [] body) {
        return new TransportResponse(new ResponseMetadata(statusCode), body);
    }

    public int statusCode() {
        return metadata == null ? -1 : metadata.statusCode();
    }
}
