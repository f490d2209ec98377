package io.endpoints.spec;

import org.jspecify.annotations.Nullable;

/**
 * Implemented by caller types that may be bound to a query parameter, form field or header.
 * <p>
 * Returning {@code null} omits the parameter from the request.
 */
@FunctionalInterface
public interface ParameterRepresentable {

    @Nullable
    String toParameterValue();
}
