package io.endpoints.client;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import io.endpoints.client.auth.AuthenticationMethod;
import io.endpoints.client.auth.NoAuth;
import io.endpoints.client.http.Transport;
import io.endpoints.client.http.TransportBuilder;
import io.endpoints.client.http.TransportResponse;
import io.endpoints.client.request.RequestAssembler;
import io.endpoints.client.response.ResponseClassifier;
import io.endpoints.spec.AuthenticationException;
import io.endpoints.spec.EndpointDefinition;
import io.endpoints.spec.EndpointException;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.Environment;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.ResponseParseException;
import io.endpoints.spec.TaskException;
import io.endpoints.util.Assert;
import io.endpoints.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs endpoint calls: assembles the request, authenticates it, sends it, classifies and
 * decodes the response, and retries after refreshing credentials when the authentication
 * method asks for it.
 * <p>
 * Each call makes at most {@code maxRetries + 1} attempts. Every attempt re-assembles and
 * re-authenticates the request so that refreshed credentials are picked up. Assembly
 * failures, authentication failures and response parse failures are never retried. If the
 * authentication method still asks for a refresh once all attempts are used, the call fails
 * with an {@link AuthenticationException} of reason {@code MAX_RETRIES_EXCEEDED} whose cause
 * is the last failure.
 * <pre>{@code
 * DeliveryCoordinator client = DeliveryCoordinator.builder()
 *         .environment(ApiServer.SERVER.environment())
 *         .authentication(tokenPairAuth)
 *         .build();
 *
 * User user = client.execute(GET_USER, new GetUser(42, null));
 * }</pre>
 */
public class DeliveryCoordinator {

    public static final int DEFAULT_MAX_RETRIES = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryCoordinator.class);

    private final Transport transport;
    private final AuthenticationMethod authentication;
    private final RequestAssembler assembler;
    private final int maxRetries;

    private DeliveryCoordinator(Builder builder, Environment environment) {
        this.transport = builder.transport != null ? builder.transport : TransportBuilder.DEFAULT_FACTORY.create();
        this.authentication = builder.authentication;
        this.assembler = new RequestAssembler(environment);
        this.maxRetries = builder.maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AuthenticationMethod getAuthentication() {
        return authentication;
    }

    public Environment getEnvironment() {
        return assembler.getEnvironment();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Calls an endpoint asynchronously.
     *
     * @param definition the endpoint definition
     * @param request the request instance
     * @param <T> the request instance type
     * @param <R> the response type
     * @return a future completing with the decoded response, or failing with a {@link TaskException}
     */
    public <T, R> CompletableFuture<R> send(EndpointDefinition<T, R> definition, T request) {
        Assert.checkNotNullParam("definition", definition);
        Assert.checkNotNullParam("request", request);
        return attempt(definition, request, 0);
    }

    /**
     * Calls an endpoint and waits for the result.
     *
     * @param definition the endpoint definition
     * @param request the request instance
     * @param <T> the request instance type
     * @param <R> the response type
     * @return the decoded response
     * @throws TaskException if the call fails
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public <T, R> R execute(EndpointDefinition<T, R> definition, T request) throws TaskException, InterruptedException {
        try {
            return send(definition, request).get();
        } catch (ExecutionException e) {
            Throwable cause = Utils.unwrapCompletionException(e);
            if (cause instanceof TaskException taskException) {
                throw taskException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Endpoint call failed", cause);
        }
    }

    private <T, R> CompletableFuture<R> attempt(EndpointDefinition<T, R> definition, T request, int attempt) {
        EndpointRequest assembled;
        try {
            assembled = assembler.assemble(definition, request);
        } catch (EndpointException e) {
            LOGGER.debug("Unable to assemble request for {}", definition, e);
            return CompletableFuture.failedFuture(e);
        }
        LOGGER.debug("Attempt {} of {}: {} {}", attempt + 1, maxRetries + 1, assembled.method(), assembled.uri());
        return authentication.authenticate(assembled)
                .thenCompose(authenticated -> deliver(definition, authenticated)
                        .exceptionallyCompose(error -> retryOrFail(definition, request, attempt, error)));
    }

    private <T, R> CompletableFuture<R> retryOrFail(EndpointDefinition<T, R> definition, T request, int attempt,
                                                    Throwable error) {
        Throwable cause = Utils.unwrapCompletionException(error);
        if (cause instanceof TaskException taskException
                && authentication.shouldReauthenticate(taskException, taskException.getResponseMetadata())) {
            if (attempt < maxRetries) {
                LOGGER.debug("Reauthenticating after status {}", taskException.getStatusCode());
                return authentication.reauthenticate()
                        .thenCompose(ignored -> attempt(definition, request, attempt + 1));
            }
            LOGGER.debug("Giving up after {} attempts", attempt + 1);
            return CompletableFuture.failedFuture(
                    new AuthenticationException(AuthenticationException.Reason.MAX_RETRIES_EXCEEDED, taskException));
        }
        return CompletableFuture.failedFuture(cause);
    }

    private <R> CompletableFuture<R> deliver(EndpointDefinition<?, R> definition, EndpointRequest request) {
        CompletableFuture<TransportResponse> sent;
        try {
            sent = transport.send(request);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.handle((response, error) -> {
            try {
                return CompletableFuture.completedFuture(complete(definition, response, error));
            } catch (TaskException e) {
                return CompletableFuture.<R>failedFuture(e);
            }
        }).thenCompose(result -> result);
    }

    private static <R> R complete(EndpointDefinition<?, R> definition, @Nullable TransportResponse response,
                                  @Nullable Throwable error) throws TaskException {
        ResponseMetadata metadata = response == null ? null : response.metadata();
        byte[] payload = ResponseClassifier.classify(response == null ? null : response.body(), metadata, error,
                definition.errorDecoder());
        try {
            return definition.responseDecoder().decode(payload);
        } catch (IOException | RuntimeException e) {
            throw new ResponseParseException(metadata, payload, e);
        }
    }

    public static final class Builder {
        private @Nullable Transport transport;
        private AuthenticationMethod authentication = NoAuth.INSTANCE;
        private @Nullable Environment environment;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder() {
        }

        /**
         * Sets the transport. Defaults to one created by {@link TransportBuilder#DEFAULT_FACTORY}.
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(Transport transport) {
            this.transport = Assert.checkNotNullParam("transport", transport);
            return this;
        }

        public Builder authentication(AuthenticationMethod authentication) {
            this.authentication = Assert.checkNotNullParam("authentication", authentication);
            return this;
        }

        public Builder environment(Environment environment) {
            this.environment = Assert.checkNotNullParam("environment", environment);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = Assert.checkNotNegativeParam("maxRetries", maxRetries);
            return this;
        }

        public DeliveryCoordinator build() {
            return new DeliveryCoordinator(this, Assert.checkNotNullParam("environment", environment));
        }
    }
}
