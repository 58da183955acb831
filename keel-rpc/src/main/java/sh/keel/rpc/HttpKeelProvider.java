// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import static sh.keel.rpc.internal.RpcUtils.MAPPER;
import static sh.keel.rpc.internal.RpcUtils.extractErrorData;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;

import sh.keel.core.DebugLogger;
import sh.keel.core.LogFormatter;
import sh.keel.core.error.RpcException;

/**
 * HTTP JSON-RPC transport over an {@link HttpConnectionPool}.
 *
 * <p>
 * Non-2xx statuses raise {@link RpcException#HTTP_ERROR} with the status in the
 * message, transport failures and timeouts raise {@link RpcException#NETWORK_ERROR}
 * (timeouts keep the {@link java.net.http.HttpTimeoutException} as cause), and
 * unparseable bodies raise {@link RpcException#PARSE_ERROR}.
 *
 * <pre>{@code
 * KeelProvider provider = HttpKeelProvider.builder("https://api.mainnet-beta.solana.com")
 *         .pool(sharedPool)
 *         .readTimeout(Duration.ofSeconds(5))
 *         .build();
 * }</pre>
 */
public final class HttpKeelProvider implements KeelProvider {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RpcConfig config;
    private final HttpConnectionPool pool;
    private final boolean ownsPool;
    private final URI uri;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpKeelProvider(final RpcConfig config, final HttpConnectionPool pool, final boolean ownsPool) {
        this.config = config;
        this.pool = pool;
        this.ownsPool = ownsPool;
        this.uri = URI.create(config.url());
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    @Override
    public String endpoint() {
        return config.url();
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest("2.0", method, safeParams, requestId);

        final String payload = serialize(request, method, requestId);
        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(buildRequest(payload), method, requestId);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationMicros));
            throw RpcException.httpStatus(response.statusCode(), "method " + method, response.body(), requestId);
        }

        final JsonRpcResponse rpcResponse = parse(response.body(), method, requestId);
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new RpcException(err.code(), err.message(), extractErrorData(err.data()), requestId);
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    @Override
    public Map<String, Object> sendRaw(final Map<String, ?> body) throws RpcException {
        final String method = String.valueOf(body.get("method"));
        final String payload;
        try {
            payload = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RpcException(RpcException.PARSE_ERROR, "Unable to serialize raw RPC body", null, e);
        }

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(buildRequest(payload), method, null);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationMicros));
            throw RpcException.httpStatus(response.statusCode(), "raw request", response.body(), null);
        }
        try {
            final Map<String, Object> parsed = MAPPER.readValue(response.body(), MAP_TYPE);
            DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
            return parsed;
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    RpcException.PARSE_ERROR, "Unable to parse raw RPC response", response.body(), e);
        }
    }

    /**
     * Closes the underlying pool only when this provider created it.
     */
    @Override
    public void close() {
        if (ownsPool) {
            pool.close();
        }
    }

    private String serialize(final JsonRpcRequest request, final String method, final long requestId) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    RpcException.PARSE_ERROR,
                    "Unable to serialize JSON-RPC request for " + method,
                    null,
                    requestId,
                    e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private HttpResponse<String> execute(final HttpRequest request, final String method, final Long requestId) {
        try {
            return pool.send(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(
                    RpcException.NETWORK_ERROR, "Interrupted during JSON-RPC call " + method, null, requestId, e);
        } catch (IOException e) {
            final String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new RpcException(
                    RpcException.NETWORK_ERROR, "Network error during JSON-RPC call " + method + ": " + detail,
                    null, requestId, e);
        }
    }

    private JsonRpcResponse parse(final String body, final String method, final long requestId) {
        try {
            return MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    RpcException.PARSE_ERROR,
                    "Unable to parse JSON-RPC response for method " + method,
                    body,
                    requestId,
                    e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private HttpConnectionPool pool;

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        /**
         * Shares an existing pool. Without one the provider creates and owns a
         * private pool that it closes in {@link HttpKeelProvider#close()}.
         */
        public Builder pool(final HttpConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        public HttpKeelProvider build() {
            final RpcConfig config = new RpcConfig(url, connectTimeout, readTimeout, headers);
            if (pool != null) {
                return new HttpKeelProvider(config, pool, false);
            }
            final PoolConfig own = PoolConfig.builder().connectTimeout(connectTimeout).build();
            return new HttpKeelProvider(config, new HttpConnectionPool(own), true);
        }
    }
}
