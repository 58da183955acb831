// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;
import java.util.Objects;

/**
 * Creates the {@link KeelProvider} a router uses for one endpoint.
 */
@FunctionalInterface
public interface ProviderFactory {

    /**
     * @param endpoint the endpoint URL
     * @param timeout  the per-request timeout the provider must apply
     */
    KeelProvider create(String endpoint, Duration timeout);

    /**
     * Returns a factory producing {@link HttpKeelProvider}s over a shared pool.
     */
    static ProviderFactory http(final HttpConnectionPool pool) {
        Objects.requireNonNull(pool, "pool");
        return (endpoint, timeout) -> HttpKeelProvider.builder(endpoint)
                .pool(pool)
                .readTimeout(timeout)
                .build();
    }
}
