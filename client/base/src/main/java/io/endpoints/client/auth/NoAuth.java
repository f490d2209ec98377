package io.endpoints.client.auth;

import java.util.concurrent.CompletableFuture;

import io.endpoints.spec.AuthenticationException;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.TaskException;
import org.jspecify.annotations.Nullable;

/**
 * Sends requests unchanged.
 */
public final class NoAuth implements AuthenticationMethod {

    public static final NoAuth INSTANCE = new NoAuth();

    private NoAuth() {
    }

    @Override
    public CompletableFuture<EndpointRequest> authenticate(EndpointRequest request) {
        return CompletableFuture.completedFuture(request);
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
