// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import static sh.keel.rpc.internal.RpcUtils.MAPPER;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response from a Solana node.
 *
 * <p>
 * Most Solana read methods wrap their payload as
 * {@code {"context":{"slot":N},"value":...}}; {@link #value()} unwraps it.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result  the result object if successful, or {@code null} if error
 * @param error   the error object if failed, or {@code null} if successful
 * @param id      the request ID that this response corresponds to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * Returns the {@code value} field of a context-wrapped result, or the raw
     * result when it is not wrapped.
     */
    public @Nullable Object value() {
        if (result instanceof Map<?, ?> map && map.containsKey("context")) {
            return map.get("value");
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> valueAsMap() {
        final Object value = value();
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        return MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {});
    }

    @SuppressWarnings("unchecked")
    public @Nullable List<Object> valueAsList() {
        final Object value = value();
        if (value == null) {
            return null;
        }
        if (value instanceof List<?>) {
            return (List<Object>) value;
        }
        return MAPPER.convertValue(value, new TypeReference<List<Object>>() {});
    }
}
