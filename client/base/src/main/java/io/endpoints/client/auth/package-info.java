/**
 * Authentication methods applied to assembled requests.
 *
 * <ul>
 *   <li>{@link io.endpoints.client.auth.NoAuth} - no credentials</li>
 *   <li>{@link io.endpoints.client.auth.HeaderKeyAuth} - static key in a header</li>
 *   <li>{@link io.endpoints.client.auth.CookieAuth} - static cookie</li>
 *   <li>{@link io.endpoints.client.auth.TokenPairAuth} - rotating access/refresh tokens with single-flight refresh</li>
 * </ul>
 */
@NullMarked
package io.endpoints.client.auth;

import org.jspecify.annotations.NullMarked;
