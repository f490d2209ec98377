/**
 * Vert.x based {@link io.endpoints.client.http.Transport}.
 */
@NullMarked
package io.endpoints.client.http.vertx;

import org.jspecify.annotations.NullMarked;
