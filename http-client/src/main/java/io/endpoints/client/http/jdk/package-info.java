/**
 * {@link java.net.http.HttpClient} based transport.
 */
@NullMarked
package io.endpoints.client.http.jdk;

import org.jspecify.annotations.NullMarked;
