// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.error;

import java.util.Locale;

/**
 * Exception thrown when a JSON-RPC request to a node fails.
 *
 * <p>
 * <strong>Codes produced by Keel transports:</strong>
 * <ul>
 * <li><strong>-32001</strong>: HTTP status outside 2xx</li>
 * <li><strong>-32000</strong>: Network failure or timeout</li>
 * <li><strong>-32700</strong>: Request or response could not be (de)serialized</li>
 * </ul>
 * Any other code is passed through from the node's error object.
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends KeelException {

    /** HTTP status outside the 2xx range. */
    public static final int HTTP_ERROR = -32001;

    /** Transport-level failure (connection refused, reset, timeout). */
    public static final int NETWORK_ERROR = -32000;

    /** JSON serialization or parsing failure. */
    public static final int PARSE_ERROR = -32700;

    private final int code;
    private final String data;
    private final Long requestId;
    private final int httpStatus;

    public RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        this(code, message, data, requestId, cause, 0);
    }

    private RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause,
            final int httpStatus) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
        this.httpStatus = httpStatus;
    }

    /**
     * Creates an {@link #HTTP_ERROR} for a response with a status outside 2xx.
     *
     * @param status the HTTP status code
     * @param method the JSON-RPC method, or a short description of the request
     * @param body   the response body, kept as error data
     */
    public static RpcException httpStatus(
            final int status, final String method, final String body, final Long requestId) {
        return new RpcException(HTTP_ERROR, "HTTP " + status + " for " + method, body, requestId, null, status);
    }

    public RpcException(final int code, final String message, final String data, final Long requestId) {
        this(code, message, data, requestId, null);
    }

    public RpcException(final int code, final String message, final String data, final Throwable cause) {
        this(code, message, data, null, cause);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    /**
     * Returns the HTTP status for {@link #HTTP_ERROR} failures, 0 otherwise.
     */
    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Returns {@code true} when the node reported that the queried account does not exist.
     */
    public boolean isAccountNotFound() {
        final String msg = getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("could not find account");
    }

    /**
     * Returns {@code true} when the failure was a transport timeout.
     */
    public boolean isTimeout() {
        return code == NETWORK_ERROR
                && getCause() instanceof java.net.http.HttpTimeoutException;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
