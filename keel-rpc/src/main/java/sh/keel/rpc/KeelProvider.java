// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.util.List;
import java.util.Map;

import sh.keel.core.error.RpcException;

/**
 * Low-level abstraction for sending JSON-RPC requests to one Solana RPC endpoint.
 *
 * <p>
 * Implementations handle serialization, transport and deserialization; retry
 * and failover are layered on top by {@link RpcRoute} implementations.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see HttpKeelProvider
 */
public interface KeelProvider extends AutoCloseable {

    /**
     * Returns the endpoint this provider talks to.
     */
    String endpoint();

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the JSON-RPC method name
     * @param params the positional parameters
     * @return the JSON-RPC response, never carrying an error
     * @throws RpcException if the request fails or the node returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Posts a caller-built JSON-RPC body and returns the parsed response object
     * without interpreting it.
     *
     * @throws RpcException on transport failure, non-2xx status or unparseable body
     */
    Map<String, Object> sendRaw(Map<String, ?> body) throws RpcException;

    /**
     * Creates an HTTP provider with default settings.
     */
    static KeelProvider http(final String url) {
        return HttpKeelProvider.builder(url).build();
    }

    /**
     * Releases resources held by this provider. The default does nothing.
     */
    @Override
    default void close() {
        // Default no-op for providers that don't need cleanup
    }
}
