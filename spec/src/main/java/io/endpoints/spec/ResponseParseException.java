package io.endpoints.spec;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a successful payload could not be decoded into the endpoint's response type.
 */
public final class ResponseParseException extends TaskException {

    private final byte[] payload;

    public ResponseParseException(@Nullable ResponseMetadata responseMetadata, byte[] payload, Throwable cause) {
        super("Unable to decode response: " + cause.getMessage(), responseMetadata, cause);
        this.payload = payload.clone();
    }

    public byte[] getPayload() {
        return payload.clone();
    }
}
