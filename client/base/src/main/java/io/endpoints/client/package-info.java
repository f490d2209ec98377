/**
 * Endpoint client: runs calls described by {@link io.endpoints.spec.EndpointDefinition}s through
 * assembly, authentication, transport, classification and the reauthentication retry.
 *
 * @see io.endpoints.client.DeliveryCoordinator
 */
@NullMarked
package io.endpoints.client;

import org.jspecify.annotations.NullMarked;
