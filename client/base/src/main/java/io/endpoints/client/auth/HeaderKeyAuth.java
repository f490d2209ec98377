package io.endpoints.client.auth;

import java.util.concurrent.CompletableFuture;

import io.endpoints.spec.AuthenticationException;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.TaskException;
import io.endpoints.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Sends a fixed key in a request header, {@code Authorization: Bearer <key>} by default.
 * <pre>{@code
 * AuthenticationMethod bearer = new HeaderKeyAuth(apiKey);
 * AuthenticationMethod custom = new HeaderKeyAuth(apiKey, "X-Api-Key", null);
 * }</pre>
 */
public final class HeaderKeyAuth implements AuthenticationMethod {

    public static final String AUTHORIZATION = "Authorization";
    public static final String BEARER = "Bearer";

    private final String key;
    private final String headerName;
    private final @Nullable String prefix;

    public HeaderKeyAuth(String key) {
        this(key, AUTHORIZATION, BEARER);
    }

    /**
     * @param key the key value
     * @param headerName the header carrying the key
     * @param prefix written before the key and separated by a space, or {@code null} for the bare key
     */
    public HeaderKeyAuth(String key, String headerName, @Nullable String prefix) {
        this.key = Assert.checkNotNullParam("key", key);
        this.headerName = Assert.checkNotEmptyParam("headerName", headerName);
        this.prefix = prefix;
    }

    public String getHeaderName() {
        return headerName;
    }

    public @Nullable String getPrefix() {
        return prefix;
    }

    @Override
    public CompletableFuture<EndpointRequest> authenticate(EndpointRequest request) {
        String value = prefix == null ? key : prefix + " " + key;
        return CompletableFuture.completedFuture(request.withHeader(headerName, value));
    }

    @Override
    public boolean shouldReauthenticate(TaskException error, @Nullable ResponseMetadata response) {
        return false;
    }

    @Override
    public CompletableFuture<Void> reauthenticate() {
        return CompletableFuture.failedFuture(
                new AuthenticationException(AuthenticationException.Reason.REFRESH_NOT_SUPPORTED));
    }
}
