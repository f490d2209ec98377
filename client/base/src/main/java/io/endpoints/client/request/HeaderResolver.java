package io.endpoints.client.request;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import io.endpoints.spec.EndpointDefinition;
import io.endpoints.spec.EndpointException;
import io.endpoints.spec.HeaderBinding;
import io.endpoints.spec.ParameterRepresentable;
import org.jspecify.annotations.Nullable;

/**
 * Resolves the header bindings of an endpoint for one request instance.
 * <p>
 * Header values must be {@link ParameterRepresentable}s, character sequences, numbers,
 * booleans, characters, enum constants, UUIDs or URIs. A {@code null} value omits the header.
 */
public final class HeaderResolver {

    private HeaderResolver() {
    }

    /**
     * Resolves all header bindings in declaration order.
     *
     * @param definition the endpoint definition
     * @param request the request instance
     * @param <T> the request instance type
     * @return header values keyed by header name
     * @throws EndpointException with reason {@code INVALID_HEADER} if a value type is not supported
     */
    public static <T> Map<String, String> resolve(EndpointDefinition<T, ?> definition, T request)
            throws EndpointException {
        Map<String, String> headers = new LinkedHashMap<>();
        for (HeaderBinding<T> binding : definition.headers().values()) {
            String value;
            if (binding instanceof HeaderBinding.Field<T> field) {
                value = headerValue(field.name(), field.accessor().apply(request));
            } else {
                value = ((HeaderBinding.Value<T>) binding).value();
            }
            if (value != null) {
                headers.put(binding.name(), value);
            }
        }
        return headers;
    }

    static @Nullable String headerValue(String name, @Nullable Object value) throws EndpointException {
        if (value == null) {
            return null;
        }
        if (value instanceof ParameterRepresentable representable) {
            return representable.toParameterValue();
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?> || value instanceof UUID
                || value instanceof URI) {
            return value.toString();
        }
        throw EndpointException.invalidHeader(name, value.getClass());
    }
}
