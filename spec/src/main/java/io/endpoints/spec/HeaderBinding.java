package io.endpoints.spec;

import java.util.function.Function;

import io.endpoints.util.Assert;

/**
 * A request header declared on an {@link EndpointDefinition}, keyed by header name.
 *
 * @param <T> the request instance type
 */
public sealed interface HeaderBinding<T> permits HeaderBinding.Field, HeaderBinding.Value {

    String name();

    /**
     * Header whose value is read from the request instance. A {@code null} value omits the header.
     */
    record Field<T>(String name, Function<? super T, ?> accessor) implements HeaderBinding<T> {
        public Field {
            Assert.checkNotEmptyParam("name", name);
            Assert.checkNotNullParam("accessor", accessor);
        }
    }

    /**
     * Header with a fixed value.
     */
    record Value<T>(String name, String value) implements HeaderBinding<T> {
        public Value {
            Assert.checkNotEmptyParam("name", name);
            Assert.checkNotNullParam("value", value);
        }
    }
}
