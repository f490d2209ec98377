package io.endpoints.client.auth;

import java.util.concurrent.CompletableFuture;

import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.TaskException;
import org.jspecify.annotations.Nullable;

/**
 * Applies credentials to requests and refreshes them when the server rejects them.
 * <p>
 * The delivery coordinator calls {@link #authenticate(EndpointRequest)} before every
 * attempt. When an attempt fails and {@link #shouldReauthenticate(TaskException, ResponseMetadata)}
 * agrees, it calls {@link #reauthenticate()} and tries again. Implementations must coalesce
 * concurrent {@code reauthenticate} calls into a single refresh.
 */
public interface AuthenticationMethod {

    /**
     * Applies the current credentials to a request.
     *
     * @param request the assembled request
     * @return a future completing with the authenticated request, or failing with an
     *         {@link io.endpoints.spec.AuthenticationException} of reason {@code NOT_AUTHENTICATED}
     */
    CompletableFuture<EndpointRequest> authenticate(EndpointRequest request);

    /**
     * Decides whether a failed attempt should trigger a credential refresh.
     *
     * @param error the failure of the attempt
     * @param response the metadata of the response, if one was received
     * @return {@code true} to refresh and retry
     */
    boolean shouldReauthenticate(TaskException error, @Nullable ResponseMetadata response);

    /**
     * Refreshes the credentials.
     *
     * @return a future completing once fresh credentials are in place
     */
    CompletableFuture<Void> reauthenticate();
}
