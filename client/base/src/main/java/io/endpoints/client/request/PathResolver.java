package io.endpoints.client.request;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import io.endpoints.spec.PathRepresentable;
import io.endpoints.spec.PathSegment;
import io.endpoints.spec.PathTemplate;
import io.endpoints.util.PercentEncoding;
import org.jspecify.annotations.Nullable;

/**
 * Renders a {@link PathTemplate} for one request instance.
 * <p>
 * Segments are joined in index order. A separator is inserted before a segment that asks
 * for one unless the path so far is empty or one side already provides it. Segments that
 * render empty are dropped; if the dropped segment is the last one, a dangling trailing
 * separator is removed. The result never contains {@code //}.
 * <p>
 * Bound values may be {@link PathRepresentable}s, character sequences (percent-encoded),
 * integral numbers, or {@code null} and empty {@link Optional}s which render empty.
 */
public final class PathResolver {

    private PathResolver() {
    }

    /**
     * Renders the template.
     *
     * @param template the path template
     * @param request the request instance bound segments read from
     * @param <T> the request instance type
     * @return the rendered path, possibly empty
     * @throws IllegalArgumentException if a bound value has a type that cannot appear in a path
     */
    public static <T> String resolve(PathTemplate<T> template, T request) {
        List<PathSegment<T>> segments = template.sortedSegments();
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            PathSegment<T> segment = segments.get(i);
            String value = render(segment, request);
            if (value.isEmpty()) {
                if (i == segments.size() - 1 && endsWithSlash(path)) {
                    path.setLength(path.length() - 1);
                }
                continue;
            }
            if (segment.includesSlash() && path.length() > 0 && !endsWithSlash(path) && !value.startsWith("/")) {
                path.append('/');
            }
            path.append(value);
        }
        return collapseSeparators(path.toString());
    }

    private static <T> String render(PathSegment<T> segment, T request) {
        if (segment instanceof PathSegment.Literal<T> literal) {
            return PercentEncoding.PATH.encode(literal.value());
        }
        PathSegment.Bound<T> bound = (PathSegment.Bound<T>) segment;
        return pathValue(bound.accessor().apply(request));
    }

    static String pathValue(@Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? pathValue(optional.get()) : "";
        }
        if (value instanceof PathRepresentable representable) {
            return representable.toPathSegment();
        }
        if (value instanceof CharSequence sequence) {
            return PercentEncoding.PATH.encode(sequence.toString());
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        throw new IllegalArgumentException("Type " + value.getClass().getName() + " cannot be used as a path value");
    }

    private static boolean endsWithSlash(StringBuilder path) {
        return path.length() > 0 && path.charAt(path.length() - 1) == '/';
    }

    private static String collapseSeparators(String path) {
        String collapsed = path;
        while (collapsed.contains("//")) {
            collapsed = collapsed.replace("//", "/");
        }
        return collapsed;
    }
}
