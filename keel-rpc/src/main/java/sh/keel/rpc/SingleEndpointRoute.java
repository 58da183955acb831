// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.types.Blockhash;
import sh.keel.core.types.TransactionSignature;

/**
 * Route that sends every call to one fixed provider without retry.
 *
 * <p>
 * Owns its blockhash cache; {@link #start()} launches the refresh loop, and
 * until then the cache fetches once on first read.
 */
public final class SingleEndpointRoute implements RpcRoute {

    private static final Logger log = LoggerFactory.getLogger(SingleEndpointRoute.class);

    private final KeelProvider provider;
    private final Duration blockhashRefreshInterval;
    private final Duration confirmPollInterval;
    private final BlockhashCache blockhashCache;
    private final Object lifecycleLock = new Object();

    private @Nullable ScheduledExecutorService scheduler;
    private @Nullable ScheduledFuture<?> refreshLoop;
    private boolean closed;

    public SingleEndpointRoute(
            final KeelProvider provider, final Duration blockhashRefreshInterval, final Duration confirmPollInterval) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.blockhashRefreshInterval = Objects.requireNonNull(blockhashRefreshInterval, "blockhashRefreshInterval");
        this.confirmPollInterval = Objects.requireNonNull(confirmPollInterval, "confirmPollInterval");
        if (blockhashRefreshInterval.isNegative() || blockhashRefreshInterval.isZero()) {
            throw new IllegalArgumentException("blockhashRefreshInterval must be positive");
        }
        this.blockhashCache = new BlockhashCache(() -> RpcCalls.getLatestBlockhash(provider));
    }

    @Override
    public <T> T execute(final Function<KeelProvider, T> call) {
        return call.apply(provider);
    }

    @Override
    public Blockhash cachedBlockhash() {
        return blockhashCache.get();
    }

    public BlockhashCache blockhashCache() {
        return blockhashCache;
    }

    @Override
    public boolean confirmTransaction(
            final TransactionSignature signature, final Commitment commitment, final @Nullable Duration timeout) {
        try {
            return RpcCalls.awaitConfirmation(provider, signature, commitment, confirmPollInterval, timeout);
        } catch (RuntimeException e) {
            log.error("Failed to confirm transaction {}: {}", signature, e.getMessage());
            return false;
        }
    }

    @Override
    public @Nullable Map<String, Object> postRpc(final Map<String, ?> body) {
        try {
            return provider.sendRaw(body);
        } catch (RuntimeException e) {
            log.error("RPC request failed: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public String currentEndpoint() {
        return provider.endpoint();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Route has been closed");
            }
            if (scheduler != null) {
                return;
            }
            scheduler = KeelExecutors.newScheduler("keel-blockhash", 1);
            final long millis = blockhashRefreshInterval.toMillis();
            refreshLoop = scheduler.scheduleWithFixedDelay(this::refreshIteration, 0L, millis, TimeUnit.MILLISECONDS);
            log.debug("Blockhash refresh started for {} every {}ms", provider.endpoint(), millis);
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (refreshLoop != null) {
                refreshLoop.cancel(true);
            }
            if (scheduler != null) {
                KeelExecutors.shutdown(scheduler, 1_000);
            }
        }
        provider.close();
    }

    private void refreshIteration() {
        try {
            blockhashCache.refresh();
        } catch (RuntimeException e) {
            log.warn("Blockhash update failed: {}", e.getMessage());
        }
    }
}
