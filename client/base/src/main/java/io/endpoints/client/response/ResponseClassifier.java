package io.endpoints.client.response;

import java.net.NoRouteToHostException;
import java.net.ProtocolException;
import java.net.UnknownHostException;
import java.nio.channels.UnresolvedAddressException;

import io.endpoints.spec.ErrorResponseException;
import io.endpoints.spec.ErrorResponseParseException;
import io.endpoints.spec.OfflineException;
import io.endpoints.spec.ResponseDecoder;
import io.endpoints.spec.ResponseMetadata;
import io.endpoints.spec.TaskException;
import io.endpoints.spec.TransportFailureException;
import io.endpoints.spec.UnexpectedStatusException;
import io.endpoints.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Maps the raw outcome of a transport exchange to a success payload or a {@link TaskException}.
 * <p>
 * <table>
 *   <caption>Classification</caption>
 *   <tr><th>Outcome</th><th>Result</th></tr>
 *   <tr><td>unknown host, no route to host or unresolved address in the error's cause chain</td>
 *       <td>{@link OfflineException}</td></tr>
 *   <tr><td>any other transport error</td><td>{@link TransportFailureException}</td></tr>
 *   <tr><td>no error but no metadata</td><td>{@link TransportFailureException}</td></tr>
 *   <tr><td>204</td><td>empty payload</td></tr>
 *   <tr><td>2xx with payload</td><td>the payload</td></tr>
 *   <tr><td>non-2xx with payload the error decoder accepts</td><td>{@link ErrorResponseException}</td></tr>
 *   <tr><td>non-2xx with payload the error decoder rejects</td><td>{@link ErrorResponseParseException}</td></tr>
 *   <tr><td>anything else</td><td>{@link UnexpectedStatusException}</td></tr>
 * </table>
 */
public final class ResponseClassifier {

    public static final int NO_CONTENT = 204;

    private static final byte[] EMPTY = new byte[0];

    private ResponseClassifier() {
    }

    public static byte[] classify(byte @Nullable [] payload, @Nullable ResponseMetadata metadata,
                                  @Nullable Throwable transportError, ResponseDecoder<?> errorDecoder)
            throws TaskException {
        if (transportError != null) {
            Throwable error = Utils.unwrapCompletionException(transportError);
            if (isOffline(error)) {
                throw new OfflineException(error);
            }
            throw new TransportFailureException(error);
        }
        if (metadata == null) {
            throw new TransportFailureException(new ProtocolException("Transport returned no response metadata"));
        }
        int status = metadata.statusCode();
        if (status == NO_CONTENT) {
            return EMPTY;
        }
        if (metadata.isSuccessful() && payload != null) {
            return payload;
        }
        if (!metadata.isSuccessful() && payload != null && payload.length > 0) {
            Object errorResponse;
            try {
                errorResponse = errorDecoder.decode(payload);
            } catch (Exception e) {
                throw new ErrorResponseParseException(metadata, payload, e);
            }
            if (errorResponse == null) {
                throw new ErrorResponseParseException(metadata, payload,
                        new ProtocolException("Error decoder produced no value"));
            }
            throw new ErrorResponseException(metadata, errorResponse);
        }
        throw new UnexpectedStatusException(metadata);
    }

    static boolean isOffline(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnknownHostException || current instanceof NoRouteToHostException
                    || current instanceof UnresolvedAddressException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
