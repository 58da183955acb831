// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;

/**
 * Limits for {@link HttpConnectionPool}.
 *
 * @param maxConnections        maximum concurrent exchanges across all hosts (default 100)
 * @param maxConnectionsPerHost maximum concurrent exchanges per host (default 10)
 * @param connectTimeout        TCP connect timeout (default 10s)
 * @param requestTimeout        total timeout for a pooled request (default 30s)
 */
public record PoolConfig(
        int maxConnections,
        int maxConnectionsPerHost,
        Duration connectTimeout,
        Duration requestTimeout) {

    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 10;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public PoolConfig {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1, got: " + maxConnections);
        }
        if (maxConnectionsPerHost < 1 || maxConnectionsPerHost > maxConnections) {
            throw new IllegalArgumentException(
                    "maxConnectionsPerHost must be in [1, maxConnections], got: " + maxConnectionsPerHost);
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static PoolConfig defaults() {
        return new PoolConfig(
                DEFAULT_MAX_CONNECTIONS,
                DEFAULT_MAX_CONNECTIONS_PER_HOST,
                DEFAULT_CONNECT_TIMEOUT,
                DEFAULT_REQUEST_TIMEOUT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int maxConnectionsPerHost = DEFAULT_MAX_CONNECTIONS_PER_HOST;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

        private Builder() {}

        public Builder maxConnections(final int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxConnectionsPerHost(final int maxConnectionsPerHost) {
            this.maxConnectionsPerHost = maxConnectionsPerHost;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(final Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(maxConnections, maxConnectionsPerHost, connectTimeout, requestTimeout);
        }
    }
}
