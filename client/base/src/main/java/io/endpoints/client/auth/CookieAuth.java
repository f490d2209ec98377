package io.endpoints.client.auth;

import java.util.concurrent.CompletableFuture;

import io.endpoints.spec.AuthenticationException;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.TaskException;
import io.endpoints.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Sends a fixed {@code name=value} cookie.
 * <p>
 * By default the cookie is appended to a {@code Cookie} header already present on the
 * request, separated by {@code "; "}.
 */
public final class CookieAuth implements AuthenticationMethod {

    public static final String COOKIE = "Cookie";

    private final String name;
    private final String value;
    private final String headerName;
    private final boolean appendToExisting;

    public CookieAuth(String name, String value) {
        this(name, value, COOKIE, true);
    }

    public CookieAuth(String name, String value, String headerName, boolean appendToExisting) {
        this.name = Assert.checkNotEmptyParam("name", name);
        this.value = Assert.checkNotNullParam("value", value);
        this.headerName = Assert.checkNotEmptyParam("headerName", headerName);
        this.appendToExisting = appendToExisting;
    }

    @Override
    public CompletableFuture<EndpointRequest> authenticate(EndpointRequest request) {
        String cookie = name + "=" + value;
        String existing = request.header(headerName);
        if (appendToExisting && existing != null && !existing.isEmpty()) {
            cookie = existing + "; " + cookie;
        }
        return CompletableFuture.completedFuture(request.withHeader(headerName, cookie));
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
