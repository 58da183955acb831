// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared HTTP connection pool for JSON-RPC traffic.
 *
 * <p>
 * Wraps one {@link HttpClient}, which keeps connections alive and reuses them,
 * and bounds concurrent exchanges with a global and a per-host semaphore. Create
 * one pool at application startup, inject it into every {@link HttpKeelProvider}
 * and {@link ResilientClient}, and {@link #close()} it on shutdown.
 *
 * <pre>{@code
 * try (HttpConnectionPool pool = new HttpConnectionPool(PoolConfig.defaults())) {
 *     ResilientClient client = ResilientClient.singleEndpoint(url, pool, ClientConfig.defaults());
 *     ...
 * }
 * }</pre>
 */
public final class HttpConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpConnectionPool.class);

    private final PoolConfig config;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final Semaphore global;
    private final Map<String, Semaphore> perHost = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HttpConnectionPool(final PoolConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.executor = KeelExecutors.newIoBoundExecutor("keel-http", config.maxConnections());
        this.httpClient = HttpClient.newBuilder()
                .executor(executor)
                .connectTimeout(config.connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.global = new Semaphore(config.maxConnections(), true);
        log.debug("Created HTTP connection pool (max={}, perHost={})",
                config.maxConnections(), config.maxConnectionsPerHost());
    }

    public PoolConfig config() {
        return config;
    }

    /**
     * Sends {@code request} once a global and a per-host slot are free.
     *
     * <p>
     * Requests without their own timeout get the pool's request timeout. Waiting
     * for a slot is bounded by the same timeout.
     *
     * @throws HttpTimeoutException if no slot frees up in time or the exchange times out
     * @throws IOException          on transport failure
     * @throws IllegalStateException if the pool has been closed
     */
    public HttpResponse<String> send(final HttpRequest request) throws IOException, InterruptedException {
        ensureOpen();
        final HttpRequest effective = request.timeout().isPresent()
                ? request
                : HttpRequest.newBuilder(request, (name, value) -> true).timeout(config.requestTimeout()).build();

        final Semaphore host = perHost.computeIfAbsent(hostKey(effective.uri()),
                k -> new Semaphore(config.maxConnectionsPerHost(), true));
        final long waitMillis = config.requestTimeout().toMillis();
        if (!global.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
            throw new HttpTimeoutException("Timed out waiting for a pooled connection");
        }
        try {
            if (!host.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new HttpTimeoutException("Timed out waiting for a connection to " + effective.uri().getHost());
            }
            try {
                return httpClient.send(effective, HttpResponse.BodyHandlers.ofString());
            } finally {
                host.release();
            }
        } finally {
            global.release();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the pool. Further {@link #send} calls fail with {@link IllegalStateException};
     * exchanges already in flight run to completion on their calling threads.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            KeelExecutors.shutdown(executor, 1_000);
            perHost.clear();
            log.debug("Closed HTTP connection pool");
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("HTTP connection pool is closed");
        }
    }

    private static String hostKey(final URI uri) {
        return uri.getScheme() + "://" + uri.getHost() + ":" + uri.getPort();
    }
}
