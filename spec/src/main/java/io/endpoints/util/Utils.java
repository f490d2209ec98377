package io.endpoints.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared helpers: the default {@link ObjectMapper} and future utilities.
 */
public final class Utils {

    /**
     * Mapper used by the default JSON body encoder and response decoders. {@code java.time}
     * values are written as ISO-8601 strings and {@code Optional} fields are unwrapped.
     */
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Utils() {
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * {@link java.util.concurrent.CompletableFuture} adds around the real failure.
     *
     * @param throwable the throwable received from a future stage
     * @return the innermost wrapped cause, or the throwable itself
     */
    public static Throwable unwrapCompletionException(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
