/**
 * Request assembly: path rendering, parameter and header resolution, body attachment.
 */
@NullMarked
package io.endpoints.client.request;

import org.jspecify.annotations.NullMarked;
