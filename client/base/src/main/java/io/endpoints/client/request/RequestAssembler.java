package io.endpoints.client.request;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import io.endpoints.spec.BodyEncoder;
import io.endpoints.spec.EndpointDefinition;
import io.endpoints.spec.EndpointException;
import io.endpoints.spec.EndpointRequest;
import io.endpoints.spec.Environment;
import io.endpoints.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the transport-ready {@link EndpointRequest} for an endpoint call.
 * <p>
 * The steps run in a fixed order:
 * <ol>
 *   <li>render the path</li>
 *   <li>resolve query parameters and build the URL against the environment's base URL</li>
 *   <li>resolve and apply headers</li>
 *   <li>attach the body: an explicit body value is encoded with the endpoint's encoder,
 *       otherwise, when the value is {@code null} or an empty {@code Optional}, form parameters
 *       become an {@code application/x-www-form-urlencoded} body</li>
 *   <li>run the environment's request processor</li>
 * </ol>
 * A content type from the encoder or the form is only set if no header binding already set one.
 */
public class RequestAssembler {

    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestAssembler.class);

    private final Environment environment;

    public RequestAssembler(Environment environment) {
        this.environment = Assert.checkNotNullParam("environment", environment);
    }

    public Environment getEnvironment() {
        return environment;
    }

    /**
     * Assembles the request.
     *
     * @param definition the endpoint definition
     * @param request the request instance
     * @param <T> the request instance type
     * @return the assembled request
     * @throws EndpointException if the URL, a parameter, a header or the body is invalid
     */
    public <T> EndpointRequest assemble(EndpointDefinition<T, ?> definition, T request) throws EndpointException {
        String path = PathResolver.resolve(definition.path(), request);

        ParameterResolver.Resolved parameters = ParameterResolver.resolve(definition, request);
        String query = definition.queryEncodingStrategy().encode(parameters.query());
        URI uri = buildUri(environment.baseUrl(), path, query);

        EndpointRequest.Builder builder = EndpointRequest.builder(definition.method(), uri);
        for (Map.Entry<String, String> header : HeaderResolver.resolve(definition, request).entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        Object body = bodyValue(definition, request);
        if (body != null) {
            BodyEncoder encoder = definition.bodyEncoder();
            builder.body(encode(encoder, body));
            String contentType = encoder.contentType();
            if (contentType != null && !builder.hasHeader(EndpointRequest.CONTENT_TYPE)) {
                builder.header(EndpointRequest.CONTENT_TYPE, contentType);
            }
        } else if (!parameters.form().isEmpty()) {
            builder.body(parameters.formBody().getBytes(StandardCharsets.UTF_8));
            if (!builder.hasHeader(EndpointRequest.CONTENT_TYPE)) {
                builder.header(EndpointRequest.CONTENT_TYPE, FORM_URLENCODED);
            }
        }

        EndpointRequest assembled = environment.requestProcessor().process(builder.build());
        LOGGER.debug("Assembled {} {}", assembled.method(), assembled.uri());
        return assembled;
    }

    private static <T> @Nullable Object bodyValue(EndpointDefinition<T, ?> definition, T request) {
        Function<? super T, ?> accessor = definition.body();
        Object value = accessor == null ? null : accessor.apply(request);
        if (value instanceof Optional<?> optional) {
            return optional.orElse(null);
        }
        return value;
    }

    private static byte[] encode(BodyEncoder encoder, Object body) throws EndpointException {
        try {
            return encoder.encode(body);
        } catch (IOException | RuntimeException e) {
            throw EndpointException.invalidBody(e);
        }
    }

    static URI buildUri(URI baseUrl, String path, String query) throws EndpointException {
        String base = baseUrl.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String relative = path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        StringBuilder url = new StringBuilder(base);
        if (!relative.isEmpty()) {
            url.append('/').append(relative);
        }
        if (!query.isEmpty()) {
            url.append('?').append(query);
        }
        String candidate = url.toString();
        final URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw EndpointException.invalidUrl(candidate, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw EndpointException.invalidUrl(candidate, null);
        }
        return uri;
    }
}
