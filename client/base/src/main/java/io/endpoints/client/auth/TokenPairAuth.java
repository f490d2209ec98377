package io.endpoints.client.auth;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import io.endpoints.spec.AuthenticationException;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.TaskException;
import io.endpoints.util.Assert;
import io.endpoints.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates with a rotating access/refresh token pair, such as a JWT pair.
 * <p>
 * The access token is sent as {@code Authorization: Bearer <token>} unless configured
 * otherwise. When a response status is one of the configured trigger codes (401 by default),
 * {@link #reauthenticate()} exchanges the refresh token for a new pair through the
 * {@link RefreshHandler}.
 * <p>
 * At most one refresh is in flight at a time. Concurrent callers of {@code reauthenticate}
 * share it and all observe its outcome; {@code authenticate} waits for it before reading the
 * access token. The futures handed to callers are dependents of the shared refresh, so
 * cancelling one of them leaves the refresh running for everybody else.
 * <p>
 * {@link #setTokens(TokenPair)} and {@link #clearTokens()} replace the credentials at any time
 * and cancel a refresh in flight; its late result is discarded.
 * <pre>{@code
 * TokenPairAuth auth = TokenPairAuth.builder(refreshToken -> authApi.refresh(refreshToken))
 *         .initialTokens(new TokenPairAuth.TokenPair(accessToken, refreshToken))
 *         .onTokensUpdated(tokenStore::save)
 *         .onRefreshFailed(error -> session.logout())
 *         .build();
 * }</pre>
 */
public final class TokenPairAuth implements AuthenticationMethod {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenPairAuth.class);

    private final Configuration configuration;
    private final RefreshHandler refreshHandler;
    private final @Nullable Consumer<TokenPair> onTokensUpdated;
    private final @Nullable Consumer<Throwable> onRefreshFailed;

    // guarded by this
    private @Nullable TokenPair tokens;
    private @Nullable CompletableFuture<TokenPair> pendingRefresh;

    private TokenPairAuth(Builder builder) {
        this.configuration = builder.configuration;
        this.refreshHandler = builder.refreshHandler;
        this.onTokensUpdated = builder.onTokensUpdated;
        this.onRefreshFailed = builder.onRefreshFailed;
        this.tokens = builder.initialTokens;
    }

    public static Builder builder(RefreshHandler refreshHandler) {
        return new Builder(refreshHandler);
    }

    @Override
    public CompletableFuture<EndpointRequest> authenticate(EndpointRequest request) {
        CompletableFuture<TokenPair> pending;
        synchronized (this) {
            pending = pendingRefresh;
        }
        CompletableFuture<Void> ready = pending == null
                ? CompletableFuture.<Void>completedFuture(null)
                : pending.handle((ignored, error) -> (Void) null);
        return ready.thenCompose(ignored -> {
            TokenPair current = getTokens();
            if (current == null) {
                return CompletableFuture.failedFuture(
                        new AuthenticationException(AuthenticationException.Reason.NOT_AUTHENTICATED));
            }
            return CompletableFuture.completedFuture(
                    request.withHeader(configuration.headerName(), headerValue(current.accessToken())));
        });
    }

    @Override
    public boolean shouldReauthenticate(TaskException error, @Nullable ResponseMetadata response) {
        return response != null && configuration.refreshTriggerStatusCodes().contains(response.statusCode());
    }

    @Override
    public CompletableFuture<Void> reauthenticate() {
        CompletableFuture<TokenPair> refresh;
        String refreshToken;
        synchronized (this) {
            if (pendingRefresh != null) {
                LOGGER.debug("Joining token refresh in flight");
                return observe(pendingRefresh);
            }
            if (tokens == null) {
                return CompletableFuture.failedFuture(
                        new AuthenticationException(AuthenticationException.Reason.NO_REFRESH_TOKEN));
            }
            refreshToken = tokens.refreshToken();
            refresh = new CompletableFuture<>();
            pendingRefresh = refresh;
        }
        LOGGER.debug("Refreshing tokens");
        startRefresh(refresh, refreshToken);
        return observe(refresh);
    }

    private void startRefresh(CompletableFuture<TokenPair> refresh, String refreshToken) {
        CompletionStage<TokenPair> result;
        try {
            result = refreshHandler.refresh(refreshToken);
        } catch (RuntimeException e) {
            refreshFailed(refresh, e);
            return;
        }
        if (result == null) {
            refreshFailed(refresh, new IllegalStateException("Refresh handler returned no result"));
            return;
        }
        result.whenComplete((newTokens, error) -> {
            if (error != null) {
                refreshFailed(refresh, Utils.unwrapCompletionException(error));
            } else if (newTokens == null) {
                refreshFailed(refresh, new IllegalStateException("Refresh handler produced no tokens"));
            } else {
                refreshSucceeded(refresh, newTokens);
            }
        });
    }

    private void refreshSucceeded(CompletableFuture<TokenPair> refresh, TokenPair newTokens) {
        boolean current;
        synchronized (this) {
            current = pendingRefresh == refresh;
            if (current) {
                tokens = newTokens;
                pendingRefresh = null;
            }
        }
        if (!current) {
            LOGGER.debug("Discarding tokens of a cancelled refresh");
            return;
        }
        LOGGER.debug("Token refresh succeeded");
        if (onTokensUpdated != null) {
            try {
                onTokensUpdated.accept(newTokens);
            } catch (RuntimeException e) {
                LOGGER.warn("Token update callback failed", e);
            }
        }
        refresh.complete(newTokens);
    }

    private void refreshFailed(CompletableFuture<TokenPair> refresh, Throwable cause) {
        boolean current;
        synchronized (this) {
            current = pendingRefresh == refresh;
            if (current) {
                pendingRefresh = null;
            }
        }
        if (!current) {
            LOGGER.debug("Ignoring failure of a cancelled refresh", cause);
            return;
        }
        LOGGER.warn("Token refresh failed", cause);
        if (onRefreshFailed != null) {
            try {
                onRefreshFailed.accept(cause);
            } catch (RuntimeException e) {
                LOGGER.warn("Refresh failure callback failed", e);
            }
        }
        refresh.completeExceptionally(new AuthenticationException(AuthenticationException.Reason.REFRESH_FAILED, cause));
    }

    private CompletableFuture<Void> observe(CompletableFuture<TokenPair> refresh) {
        return refresh.handle((newTokens, error) -> {
            if (error == null) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            Throwable cause = Utils.unwrapCompletionException(error);
            if (cause instanceof CancellationException) {
                // credentials were replaced while refreshing
                return isAuthenticated()
                        ? CompletableFuture.<Void>completedFuture(null)
                        : CompletableFuture.<Void>failedFuture(
                                new AuthenticationException(AuthenticationException.Reason.NOT_AUTHENTICATED));
            }
            return CompletableFuture.<Void>failedFuture(cause);
        }).thenCompose(outcome -> outcome);
    }

    /**
     * Replaces the token pair, cancelling a refresh in flight.
     *
     * @param tokens the new token pair
     */
    public void setTokens(TokenPair tokens) {
        Assert.checkNotNullParam("tokens", tokens);
        replaceTokens(tokens);
    }

    /**
     * Removes the token pair, cancelling a refresh in flight. Subsequent requests fail with
     * {@code NOT_AUTHENTICATED} until new tokens are set.
     */
    public void clearTokens() {
        replaceTokens(null);
    }

    private void replaceTokens(@Nullable TokenPair newTokens) {
        CompletableFuture<TokenPair> cancelled;
        synchronized (this) {
            tokens = newTokens;
            cancelled = pendingRefresh;
            pendingRefresh = null;
        }
        if (cancelled != null) {
            LOGGER.debug("Cancelling token refresh in flight");
            cancelled.cancel(false);
        }
    }

    public synchronized @Nullable TokenPair getTokens() {
        return tokens;
    }

    public synchronized boolean isAuthenticated() {
        return tokens != null;
    }

    synchronized boolean isRefreshing() {
        return pendingRefresh != null;
    }

    private String headerValue(String accessToken) {
        String prefix = configuration.tokenPrefix();
        return prefix.isEmpty() ? accessToken : prefix + " " + accessToken;
    }

    /**
     * An access token together with the refresh token that renews it.
     *
     * @param accessToken sent with every request
     * @param refreshToken exchanged for a new pair when the access token is rejected
     */
    public record TokenPair(String accessToken, String refreshToken) {

        public TokenPair {
            Assert.checkNotNullParam("accessToken", accessToken);
            Assert.checkNotNullParam("refreshToken", refreshToken);
        }

        @Override
        public String toString() {
            return "TokenPair[accessToken=***, refreshToken=***]";
        }
    }

    /**
     * Exchanges a refresh token for a new token pair, typically by calling an auth endpoint.
     */
    @FunctionalInterface
    public interface RefreshHandler {

        CompletionStage<TokenPair> refresh(String refreshToken);
    }

    /**
     * Where the access token goes and which statuses trigger a refresh.
     *
     * @param headerName the header carrying the access token
     * @param tokenPrefix written before the token, separated by a space; empty for the bare token
     * @param refreshTriggerStatusCodes response statuses that trigger a refresh
     */
    public record Configuration(String headerName, String tokenPrefix, Set<Integer> refreshTriggerStatusCodes) {

        public static final Configuration DEFAULT = builder().build();

        public Configuration {
            Assert.checkNotEmptyParam("headerName", headerName);
            Assert.checkNotNullParam("tokenPrefix", tokenPrefix);
            refreshTriggerStatusCodes = Set.copyOf(
                    Assert.checkNotNullParam("refreshTriggerStatusCodes", refreshTriggerStatusCodes));
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String headerName = HeaderKeyAuth.AUTHORIZATION;
            private String tokenPrefix = HeaderKeyAuth.BEARER;
            private Set<Integer> refreshTriggerStatusCodes = Set.of(401);

            private Builder() {
            }

            public Builder headerName(String headerName) {
                this.headerName = headerName;
                return this;
            }

            public Builder tokenPrefix(String tokenPrefix) {
                this.tokenPrefix = tokenPrefix;
                return this;
            }

            public Builder refreshTriggerStatusCodes(Set<Integer> refreshTriggerStatusCodes) {
                this.refreshTriggerStatusCodes = refreshTriggerStatusCodes;
                return this;
            }

            public Configuration build() {
                return new Configuration(headerName, tokenPrefix, refreshTriggerStatusCodes);
            }
        }
    }

    public static final class Builder {
        private final RefreshHandler refreshHandler;
        private Configuration configuration = Configuration.DEFAULT;
        private @Nullable TokenPair initialTokens;
        private @Nullable Consumer<TokenPair> onTokensUpdated;
        private @Nullable Consumer<Throwable> onRefreshFailed;

        private Builder(RefreshHandler refreshHandler) {
            this.refreshHandler = Assert.checkNotNullParam("refreshHandler", refreshHandler);
        }

        public Builder initialTokens(@Nullable TokenPair initialTokens) {
            this.initialTokens = initialTokens;
            return this;
        }

        public Builder configuration(Configuration configuration) {
            this.configuration = Assert.checkNotNullParam("configuration", configuration);
            return this;
        }

        public Builder onTokensUpdated(Consumer<TokenPair> onTokensUpdated) {
            this.onTokensUpdated = onTokensUpdated;
            return this;
        }

        public Builder onRefreshFailed(Consumer<Throwable> onRefreshFailed) {
            this.onRefreshFailed = onRefreshFailed;
            return this;
        }

        public TokenPairAuth build() {
            return new TokenPairAuth(this);
        }
    }
}
