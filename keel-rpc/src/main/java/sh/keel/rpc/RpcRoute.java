// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import sh.keel.core.types.Blockhash;
import sh.keel.core.types.TransactionSignature;

/**
 * Strategy deciding which endpoint serves an RPC call and how failures are retried.
 *
 * <p>
 * {@link ResilientClient} is written against this interface only; the
 * single-endpoint and multi-provider modes differ solely in the route injected
 * at construction.
 *
 * @see SingleEndpointRoute
 * @see FailoverRouter
 */
public interface RpcRoute extends AutoCloseable {

    /**
     * Runs {@code call} against a provider chosen by this route, applying the
     * route's retry policy.
     */
    <T> T execute(Function<KeelProvider, T> call);

    /**
     * Returns the cached recent blockhash, fetching it synchronously when absent.
     */
    Blockhash cachedBlockhash();

    /**
     * Polls the signature status until it reaches {@code commitment}.
     *
     * @param timeout give up after this long; {@code null} polls until resolved
     * @return {@code true} once confirmed; {@code false} if the transaction failed,
     *         the RPC calls failed, the timeout passed or the thread was interrupted
     */
    boolean confirmTransaction(TransactionSignature signature, Commitment commitment, @Nullable Duration timeout);

    /**
     * Posts a raw JSON-RPC body.
     *
     * @return the parsed response, or {@code null} if the request failed
     */
    @Nullable Map<String, Object> postRpc(Map<String, ?> body);

    /**
     * Returns the endpoint calls are currently sent to.
     */
    String currentEndpoint();

    /**
     * Starts background work (blockhash refresh, health checks). Idempotent.
     */
    void start();

    /**
     * Stops background work and releases providers. Idempotent.
     */
    @Override
    void close();
}
