// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc.internal;

import java.lang.reflect.Array;
import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Internal helpers shared by the RPC layer.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper for JSON-RPC payloads.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Recursively extracts the most specific error detail from a JSON-RPC error's
     * {@code data} member.
     *
     * <p>
     * Solana preflight failures nest details as {@code {"err":..., "logs":[...]}};
     * the first nested string is returned, falling back to the whole value.
     *
     * @param dataValue the error data object from a JSON-RPC response
     * @return extracted error data string, or null if dataValue is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue.getClass().isArray()) {
            return extractFromArray(dataValue, dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    private static String extractFromArray(final Object array, final Object fallback) {
        final int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            final String extracted = extractErrorData(Array.get(array, i));
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }
}
