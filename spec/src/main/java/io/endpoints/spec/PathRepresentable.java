package io.endpoints.spec;

/**
 * Implemented by caller types that may appear as a value in a {@link PathTemplate}.
 * <p>
 * The returned segment is inserted into the path as is, so it must already be
 * percent-encoded where needed. An empty string elides the segment.
 */
@FunctionalInterface
public interface PathRepresentable {

    String toPathSegment();
}
