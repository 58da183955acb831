// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.DebugLogger;
import sh.keel.core.LogFormatter;
import sh.keel.core.error.RpcException;
import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.core.types.TransactionSignature;

/**
 * Routes RPC calls across several Solana endpoints, preferring the healthiest
 * one and retrying failed calls on other providers.
 *
 * <h2>Selection</h2>
 * Providers whose status is {@link ProviderStatus#HEALTHY} or
 * {@link ProviderStatus#DEGRADED}, whose success rate is at least
 * {@link FailoverConfig#minSuccessRate()} and whose average latency is at most
 * {@link FailoverConfig#maxLatencyMs()} are ranked by {@link ProviderHealth#score()}.
 * If none qualify the whole set is ranked instead, so a provider is always chosen.
 * Ties keep configuration order.
 *
 * <h2>Failover</h2>
 * {@link #executeWithFailover(Function, int)} runs a call on the current provider,
 * records the outcome, and on failure reselects, avoiding providers already
 * tried by the same call until all have been tried, then backs off
 * {@code backoffBase * 2^attempt} before the next attempt.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} checks every provider, selects one and schedules the
 * health-check and blockhash-refresh loops. {@link #stop()} cancels both and
 * closes the providers. Calls made before {@code start()} select lazily.
 *
 * <pre>{@code
 * try (HttpConnectionPool pool = new HttpConnectionPool(PoolConfig.defaults());
 *         FailoverRouter router = new FailoverRouter(
 *                 List.of(primaryUrl, backupUrl), FailoverConfig.defaults(), ProviderFactory.http(pool))) {
 *     router.start();
 *     Blockhash blockhash = router.getLatestBlockhash();
 * }
 * }</pre>
 */
public final class FailoverRouter implements RpcRoute {

    private static final Logger log = LoggerFactory.getLogger(FailoverRouter.class);

    private final List<String> endpoints;
    private final FailoverConfig config;
    private final Map<String, ProviderHealth> health = new LinkedHashMap<>();
    private final Map<String, KeelProvider> providers = new LinkedHashMap<>();
    private final Map<String, KeelProvider> healthProviders = new LinkedHashMap<>();
    private final ReentrantLock selectionLock = new ReentrantLock();
    private final BlockhashCache blockhashCache;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService healthExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile @Nullable String currentProvider;
    private @Nullable ScheduledFuture<?> healthLoop;
    private @Nullable ScheduledFuture<?> blockhashLoop;

    /**
     * @throws IllegalArgumentException if {@code endpoints} is empty
     */
    public FailoverRouter(
            final List<String> endpoints, final FailoverConfig config, final ProviderFactory factory) {
        Objects.requireNonNull(endpoints, "endpoints");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(factory, "factory");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC provider is required");
        }
        // duplicates collapse to their first occurrence
        this.endpoints = List.copyOf(new LinkedHashSet<>(endpoints));
        this.config = config;
        for (String endpoint : this.endpoints) {
            health.put(endpoint, new ProviderHealth(endpoint));
            providers.put(endpoint, factory.create(endpoint, config.requestTimeout()));
            healthProviders.put(endpoint, factory.create(endpoint, config.healthCheckTimeout()));
        }
        this.blockhashCache = new BlockhashCache(this::getLatestBlockhash);
        this.scheduler = KeelExecutors.newScheduler("keel-failover", 2);
        this.healthExecutor = KeelExecutors.newIoBoundExecutor("keel-health", this.endpoints.size());
    }

    /**
     * Checks all providers, selects the best one and starts the background loops.
     * Subsequent calls do nothing.
     */
    @Override
    public void start() {
        ensureRunning();
        if (!started.compareAndSet(false, true)) {
            return;
        }
        checkAllProviders();
        selectBest();

        final long healthMillis = config.healthCheckInterval().toMillis();
        healthLoop = scheduler.scheduleWithFixedDelay(
                this::healthCheckIteration, healthMillis, healthMillis, TimeUnit.MILLISECONDS);
        blockhashLoop = scheduler.scheduleWithFixedDelay(
                this::blockhashIteration, 0L, config.blockhashRefreshInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Failover router started with {} providers, current: {}", endpoints.size(), currentProvider);
    }

    /**
     * Cancels the background loops and closes all providers. Subsequent calls do nothing.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (healthLoop != null) {
            healthLoop.cancel(true);
        }
        if (blockhashLoop != null) {
            blockhashLoop.cancel(true);
        }
        KeelExecutors.shutdown(scheduler, 1_000);
        KeelExecutors.shutdown(healthExecutor, 1_000);
        for (KeelProvider provider : providers.values()) {
            closeQuietly(provider);
        }
        for (KeelProvider provider : healthProviders.values()) {
            closeQuietly(provider);
        }
        log.info("Failover router stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs one liveness check against every provider concurrently and waits for all of them.
     */
    public void checkAllProviders() {
        final List<CompletableFuture<Void>> checks = new ArrayList<>(endpoints.size());
        for (String endpoint : endpoints) {
            checks.add(CompletableFuture.runAsync(() -> checkProvider(endpoint), healthExecutor));
        }
        CompletableFuture.allOf(checks.toArray(new CompletableFuture<?>[0])).join();
    }

    /**
     * Picks the best provider and makes it current.
     *
     * @return the selected endpoint, never {@code null}
     */
    public String selectBest() {
        selectionLock.lock();
        try {
            String best = bestOf(usableEndpoints(Set.of()));
            if (best == null) {
                log.warn("No healthy providers available, using best available");
                best = bestOf(endpoints);
            }
            if (!best.equals(currentProvider)) {
                final double score = health.get(best).score();
                log.info("Switching to provider: {} (score: {})", best, String.format("%.2f", score));
                DebugLogger.logRpc(LogFormatter.formatProviderSwitch(best, score));
                currentProvider = best;
            }
            return best;
        } finally {
            selectionLock.unlock();
        }
    }

    /**
     * Returns the active endpoint, selecting one first if none is active yet.
     */
    @Override
    public String currentEndpoint() {
        final String current = currentProvider;
        return current != null ? current : selectBest();
    }

    /**
     * Returns health snapshots for every provider in configuration order.
     */
    public List<ProviderHealthSnapshot> healthSummary() {
        final List<ProviderHealthSnapshot> out = new ArrayList<>(endpoints.size());
        for (String endpoint : endpoints) {
            out.add(health.get(endpoint).snapshot());
        }
        return out;
    }

    public ProviderHealth health(final String endpoint) {
        final ProviderHealth h = health.get(endpoint);
        if (h == null) {
            throw new IllegalArgumentException("Unknown provider: " + endpoint);
        }
        return h;
    }

    public List<String> endpoints() {
        return endpoints;
    }

    public FailoverConfig config() {
        return config;
    }

    @Override
    public <T> T execute(final Function<KeelProvider, T> call) {
        return executeWithFailover(call, config.maxRetries());
    }

    /**
     * Runs {@code call} with cross-provider retry.
     *
     * @throws AllProvidersExhaustedException after {@code maxRetries} failed attempts
     * @throws TransactionBuildException      immediately, without retry
     */
    public <T> T executeWithFailover(final Function<KeelProvider, T> call, final int maxRetries) {
        Objects.requireNonNull(call, "call");
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        ensureRunning();

        final long start = System.nanoTime();
        final Set<String> attempted = new HashSet<>();
        final List<RuntimeException> failures = new ArrayList<>(maxRetries);
        String endpoint = null;
        int attempts = 0;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            endpoint = currentEndpoint();
            if (attempted.size() >= endpoints.size()) {
                attempted.clear();
            }
            if (attempted.contains(endpoint)) {
                selectBest();
                endpoint = pickAvoiding(attempted);
            }
            attempted.add(endpoint);
            attempts++;

            final ProviderHealth providerHealth = health.get(endpoint);
            try {
                final long callStart = System.nanoTime();
                final T result = call.apply(providers.get(endpoint));
                providerHealth.recordSuccess((System.nanoTime() - callStart) / 1_000_000.0);
                return result;
            } catch (TransactionBuildException e) {
                throw e;
            } catch (RuntimeException e) {
                failures.add(e);
                providerHealth.recordFailure(describe(e));
                log.warn("Provider {} failed (attempt {}/{}): {}", endpoint, attempt + 1, maxRetries, describe(e));
                selectBest();

                if (attempt < maxRetries - 1 && !sleep(config.backoffFor(attempt))) {
                    break;
                }
            }
        }

        final RuntimeException last = failures.isEmpty() ? null : failures.get(failures.size() - 1);
        final AllProvidersExhaustedException exhausted = new AllProvidersExhaustedException(
                attempts, (System.nanoTime() - start) / 1_000_000L, endpoint, last);
        for (RuntimeException failure : failures) {
            exhausted.addSuppressed(failure);
        }
        log.error(exhausted.getMessage());
        throw exhausted;
    }

    @Override
    public Blockhash cachedBlockhash() {
        return blockhashCache.get();
    }

    public BlockhashCache blockhashCache() {
        return blockhashCache;
    }

    public Blockhash getLatestBlockhash() {
        return execute(RpcCalls::getLatestBlockhash);
    }

    public TransactionSignature sendTransaction(final Transaction transaction, final boolean skipPreflight) {
        Objects.requireNonNull(transaction, "transaction");
        return execute(p -> RpcCalls.sendTransaction(p, transaction, skipPreflight));
    }

    /**
     * Waits for confirmation using up to {@link FailoverConfig#confirmMaxRetries()} attempts.
     *
     * @return {@code false} instead of throwing when confirmation cannot be established
     */
    public boolean confirmTransaction(final TransactionSignature signature, final Commitment commitment) {
        return confirmTransaction(signature, commitment, null);
    }

    @Override
    public boolean confirmTransaction(
            final TransactionSignature signature, final Commitment commitment, final @Nullable Duration timeout) {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(commitment, "commitment");
        try {
            return executeWithFailover(
                    p -> RpcCalls.awaitConfirmation(p, signature, commitment, config.confirmPollInterval(), timeout),
                    config.confirmMaxRetries());
        } catch (AllProvidersExhaustedException e) {
            log.error("Failed to confirm transaction {}: {}", signature, e.getMessage());
            return false;
        }
    }

    @Override
    public @Nullable Map<String, Object> postRpc(final Map<String, ?> body) {
        Objects.requireNonNull(body, "body");
        try {
            return execute(p -> p.sendRaw(body));
        } catch (AllProvidersExhaustedException e) {
            log.error("RPC request failed on all providers: {}", e.getMessage());
            return null;
        }
    }

    public Lamports getBalance(final PublicKey account) {
        return execute(p -> RpcCalls.getBalance(p, account));
    }

    public @Nullable AccountInfo getAccountInfo(final PublicKey account) {
        return execute(p -> RpcCalls.getAccountInfo(p, account));
    }

    public List<@Nullable AccountInfo> getMultipleAccounts(final List<PublicKey> accounts) {
        if (accounts.isEmpty()) {
            return List.of();
        }
        return execute(p -> RpcCalls.getMultipleAccounts(p, accounts));
    }

    public long getTokenAccountBalance(final PublicKey tokenAccount) {
        return execute(p -> RpcCalls.getTokenAccountBalance(p, tokenAccount));
    }

    public String getHealth() {
        return execute(RpcCalls::getHealth);
    }

    private void checkProvider(final String endpoint) {
        final ProviderHealth providerHealth = health.get(endpoint);
        final long start = System.nanoTime();
        try {
            RpcCalls.getHealth(healthProviders.get(endpoint));
            final long micros = (System.nanoTime() - start) / 1_000L;
            providerHealth.recordSuccess(micros / 1_000.0);
            log.debug("Provider {} health check: OK ({}ms)", endpoint, micros / 1_000L);
            DebugLogger.logRpc(LogFormatter.formatHealthCheck(endpoint, true, null, micros));
        } catch (RuntimeException e) {
            final String error = healthError(e);
            providerHealth.recordFailure(error);
            log.debug("Provider {} health check failed: {}", endpoint, error);
            DebugLogger.logRpc(LogFormatter.formatHealthCheck(
                    endpoint, false, error, (System.nanoTime() - start) / 1_000L));
        }
    }

    private void healthCheckIteration() {
        try {
            checkAllProviders();
            selectBest();
        } catch (RuntimeException e) {
            log.error("Health check loop error", e);
        }
    }

    private void blockhashIteration() {
        try {
            blockhashCache.refresh();
        } catch (RuntimeException e) {
            log.warn("Blockhash update failed: {}", e.getMessage());
        }
    }

    private List<String> usableEndpoints(final Set<String> avoid) {
        final List<String> usable = new ArrayList<>(endpoints.size());
        for (String endpoint : endpoints) {
            if (avoid.contains(endpoint)) {
                continue;
            }
            final ProviderHealthSnapshot s = health.get(endpoint).snapshot();
            if (s.status().isUsable()
                    && s.successRate() >= config.minSuccessRate()
                    && s.averageLatencyMs() <= config.maxLatencyMs()) {
                usable.add(endpoint);
            }
        }
        return usable;
    }

    /**
     * Chooses the best provider not yet tried by the current call without changing
     * the router-wide selection.
     */
    private String pickAvoiding(final Set<String> attempted) {
        String pick = bestOf(usableEndpoints(attempted));
        if (pick == null) {
            final List<String> untried = new ArrayList<>(endpoints);
            untried.removeAll(attempted);
            pick = bestOf(untried);
        }
        return pick != null ? pick : currentEndpoint();
    }

    private @Nullable String bestOf(final List<String> candidates) {
        String best = null;
        double bestScore = -1.0;
        for (String endpoint : candidates) {
            final double score = health.get(endpoint).score();
            if (score > bestScore) {
                best = endpoint;
                bestScore = score;
            }
        }
        return best;
    }

    private static String healthError(final RuntimeException e) {
        if (e instanceof RpcException rpc) {
            if (rpc.httpStatus() != 0) {
                return "HTTP " + rpc.httpStatus();
            }
            if (rpc.isTimeout()) {
                return "Timeout";
            }
        }
        return describe(e);
    }

    private static String describe(final Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean sleep(final Duration duration) {
        if (duration.isZero()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void ensureRunning() {
        if (stopped.get()) {
            throw new IllegalStateException("Failover router has been stopped");
        }
    }

    private static void closeQuietly(final KeelProvider provider) {
        try {
            provider.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close provider {}: {}", provider.endpoint(), e.getMessage());
        }
    }
}
