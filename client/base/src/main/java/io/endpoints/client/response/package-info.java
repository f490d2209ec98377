@NullMarked
package io.endpoints.client.response;

import org.jspecify.annotations.NullMarked;
