package io.endpoints.client.request;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.TimeZone;
import java.util.UUID;

import io.endpoints.spec.EndpointDefinition;
import io.endpoints.spec.EndpointException;
import io.endpoints.spec.ParameterBinding;
import io.endpoints.spec.ParameterRepresentable;
import io.endpoints.spec.QueryEncodingStrategy.QueryItem;
import io.endpoints.util.PercentEncoding;
import org.jspecify.annotations.Nullable;

/**
 * Resolves the query and form parameters of an endpoint for one request instance.
 * <p>
 * Bindings are evaluated in declaration order. Bound values that are {@code null} or an
 * empty {@link Optional} are omitted. Supported value types are {@link ParameterRepresentable},
 * character sequences, numbers, booleans, characters, dates (rendered {@code yyyy-MM-dd} in
 * the system time zone), time zones (their identifier) and UUIDs.
 */
public final class ParameterResolver {

    private ParameterResolver() {
    }

    /**
     * Query and form items resolved from the endpoint's parameter bindings.
     *
     * @param query the items for the URL query
     * @param form the items for a form-encoded body
     */
    public record Resolved(List<QueryItem> query, List<QueryItem> form) {

        public Resolved {
            query = List.copyOf(query);
            form = List.copyOf(form);
        }

        /**
         * Renders the form items as an {@code application/x-www-form-urlencoded} body.
         *
         * @return the encoded form, empty if there are no form items
         */
        public String formBody() {
            StringJoiner joiner = new StringJoiner("&");
            for (QueryItem item : form) {
                // form items always carry a value
                joiner.add(PercentEncoding.FORM_FIELD.encode(item.name()) + "="
                        + PercentEncoding.FORM_FIELD.encode(String.valueOf(item.value())));
            }
            return joiner.toString();
        }
    }

    public static <T> Resolved resolve(EndpointDefinition<T, ?> definition, T request) throws EndpointException {
        List<QueryItem> query = new ArrayList<>();
        List<QueryItem> form = new ArrayList<>();
        for (ParameterBinding<T> binding : definition.parameters()) {
            String value;
            if (binding instanceof ParameterBinding.QueryBound<T> bound) {
                value = parameterValue(bound.name(), bound.accessor().apply(request));
            } else if (binding instanceof ParameterBinding.FormBound<T> bound) {
                value = parameterValue(bound.name(), bound.accessor().apply(request));
            } else if (binding instanceof ParameterBinding.QueryLiteral<T> literal) {
                value = literal.value();
            } else {
                value = ((ParameterBinding.FormLiteral<T>) binding).value();
            }
            if (value == null) {
                continue;
            }
            (binding.isQuery() ? query : form).add(new QueryItem(binding.name(), value));
        }
        return new Resolved(query, form);
    }

    /**
     * Converts a bound value to its parameter representation.
     *
     * @param name the parameter name, reported on failure
     * @param value the bound value
     * @return the representation, or {@code null} if the parameter should be omitted
     * @throws EndpointException with reason {@code INVALID_PARAMETER} if the type is not supported
     */
    public static @Nullable String parameterValue(String name, @Nullable Object value) throws EndpointException {
        if (value == null) {
            return null;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? parameterValue(name, optional.get()) : null;
        }
        if (value instanceof ParameterRepresentable representable) {
            return representable.toParameterValue();
        }
        if (value instanceof CharSequence || value instanceof Boolean || value instanceof Character
                || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof Instant instant) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(LocalDate.ofInstant(instant, ZoneId.systemDefault()));
        }
        if (value instanceof Date date) {
            return parameterValue(name, Instant.ofEpochMilli(date.getTime()));
        }
        if (value instanceof TimeZone timeZone) {
            return timeZone.getID();
        }
        if (value instanceof ZoneId zoneId) {
            return zoneId.getId();
        }
        throw EndpointException.invalidParameter(name, value.getClass());
    }
}
