// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.DebugLogger;
import sh.keel.core.LogFormatter;
import sh.keel.core.error.KeelException;
import sh.keel.core.tx.ComputeBudget;
import sh.keel.core.tx.Instruction;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Lamports;
import sh.keel.rpc.AllProvidersExhaustedException;
import sh.keel.rpc.KeelExecutors;
import sh.keel.rpc.ResilientClient;

/**
 * Builds one trade transaction per pool identity and submits them together as a
 * single atomic bundle, raising the tip after each rejection.
 *
 * <h2>Building</h2>
 * Per-identity transactions are built concurrently; an identity whose build fails
 * (or whose sell amount is zero) is skipped and logged. Submission waits until every
 * build has completed or been skipped, and the bundle keeps identity order.
 *
 * <h2>Submission</h2>
 * {@link #submitWithRetry(List, Lamports, int)} offers {@code initialTip}, then adds
 * {@link BundleConfig#tipIncrement()} up to {@link BundleConfig#maxTip()} after each
 * rejection, pausing {@link BundleConfig#retryDelay()} in between. Rejection is a
 * soft failure: the final {@link BundleResult} reports it and nothing is thrown.
 *
 * <pre>{@code
 * try (BundleCoordinator coordinator = new BundleCoordinator(client, pool, relay, builder, BundleConfig.defaults())) {
 *     BundleResult result = coordinator.executeBuy(target, Lamports.fromSol("0.05"));
 *     if (!result.success()) {
 *         log.warn("Bundle failed: {}", result.errorMessage());
 *     }
 * }
 * }</pre>
 */
public final class BundleCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BundleCoordinator.class);

    static final String NO_TRANSACTIONS = "No transactions built";

    private final ResilientClient client;
    private final IdentityPool pool;
    private final BundleRelay relay;
    private final TradeInstructionBuilder instructions;
    private final BundleConfig config;
    private final Clock clock;
    private final ExecutorService buildExecutor;
    private final AtomicLong totalBundles = new AtomicLong();
    private final AtomicLong successfulBundles = new AtomicLong();

    public BundleCoordinator(
            final ResilientClient client,
            final IdentityPool pool,
            final BundleRelay relay,
            final TradeInstructionBuilder instructions,
            final BundleConfig config) {
        this(client, pool, relay, instructions, config, Clock.systemUTC());
    }

    BundleCoordinator(
            final ResilientClient client,
            final IdentityPool pool,
            final BundleRelay relay,
            final TradeInstructionBuilder instructions,
            final BundleConfig config,
            final Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.relay = Objects.requireNonNull(relay, "relay");
        this.instructions = Objects.requireNonNull(instructions, "instructions");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.buildExecutor = KeelExecutors.newIoBoundExecutor("keel-bundle-build", config.buildParallelism());
    }

    public BundleResult executeBuy(final TradeTarget target, final Lamports amountPerIdentity) {
        return executeBuy(target, amountPerIdentity, null, null);
    }

    /**
     * Buys {@code amountPerIdentity} of {@code target} with each selected identity in one bundle.
     *
     * @param indices identities to use, {@code null} for the whole pool
     * @param tip     first-attempt tip, {@code null} for {@link BundleConfig#initialTip()}
     * @throws IndexOutOfBoundsException if an index is not a pool index
     */
    public BundleResult executeBuy(
            final TradeTarget target,
            final Lamports amountPerIdentity,
            final @Nullable List<Integer> indices,
            final @Nullable Lamports tip) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(amountPerIdentity, "amountPerIdentity");
        final List<Integer> selected = select(indices);
        log.info("Building buy bundle for {}: {} identities, {} SOL each",
                target.symbol(), selected.size(), amountPerIdentity.toSol());

        final List<Built> built = buildAll(selected, identity -> buildBuy(identity, target, amountPerIdentity));
        return submitBuilt(built, tip, "buy");
    }

    public BundleResult executePercentageSell(final TradeTarget target, final double percentage) {
        return executePercentageSell(target, percentage, null, null);
    }

    /**
     * Sells {@code floor(balance * percentage)} raw tokens from each selected identity in one bundle.
     * Identities whose computed amount is zero are left out.
     *
     * @param percentage fraction in {@code (0, 1]}; {@code 1.0} sells exactly the observed balance
     * @throws IllegalArgumentException  if {@code percentage} is outside {@code (0, 1]}
     * @throws IndexOutOfBoundsException if an index is not a pool index
     */
    public BundleResult executePercentageSell(
            final TradeTarget target,
            final double percentage,
            final @Nullable List<Integer> indices,
            final @Nullable Lamports tip) {
        Objects.requireNonNull(target, "target");
        if (!(percentage > 0.0 && percentage <= 1.0)) {
            throw new IllegalArgumentException("percentage must be in (0, 1], got: " + percentage);
        }
        final List<Integer> selected = select(indices);
        log.info("Building sell bundle for {}: {} identities, {}% each",
                target.symbol(), selected.size(), percentage * 100);

        final BigDecimal fraction = BigDecimal.valueOf(percentage);
        final List<Built> built = buildAll(selected, identity -> buildSell(identity, target, fraction));
        return submitBuilt(built, tip, "sell");
    }

    public BundleResult submitWithRetry(final List<Transaction> transactions, final Lamports initialTip) {
        return submitWithRetry(transactions, initialTip, config.maxRetries());
    }

    /**
     * Submits the bundle, escalating the tip after each rejection. Never throws for
     * relay failures.
     */
    public BundleResult submitWithRetry(
            final List<Transaction> transactions, final Lamports initialTip, final int maxRetries) {
        Objects.requireNonNull(initialTip, "initialTip");
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        final List<Lamports> tips = new ArrayList<>(maxRetries);
        Lamports tip = initialTip;
        String lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            final BundleAttempt current = new BundleAttempt(transactions, tip, attempt);
            tips.add(tip);
            transition(current, BundleState.BUILDING, BundleState.SUBMITTED);
            log.info("Submitting bundle (attempt {}/{}), tip: {} SOL", attempt, maxRetries, tip.toSol());
            DebugLogger.logBundle(LogFormatter.formatBundleSubmit(
                    attempt, maxRetries, current.transactions().size(), tip.value()));

            final RelaySubmission submission = submitOnce(current);
            if (submission.success()) {
                transition(current, BundleState.SUBMITTED, BundleState.LANDED);
                DebugLogger.logBundle(LogFormatter.formatBundleResult(
                        submission.bundleId(), BundleState.LANDED.name(), true));
                log.info("Bundle landed successfully: {}", submission.bundleId());
                return new BundleResult(true, submission.bundleId(), null, tip,
                        current.transactions().size(), attempt, tips);
            }

            lastError = submission.errorMessage();
            transition(current, BundleState.SUBMITTED, BundleState.FAILED);
            if (attempt == maxRetries) {
                transition(current, BundleState.FAILED, BundleState.FINAL_FAILURE);
                break;
            }
            tip = config.escalate(tip);
            transition(current, BundleState.FAILED, BundleState.BUILDING);
            log.warn("Bundle failed ({}), retrying with higher tip: {} SOL", lastError, tip.toSol());
            if (!pause()) {
                break;
            }
        }

        DebugLogger.logBundle(LogFormatter.formatBundleResult(null, BundleState.FINAL_FAILURE.name(), false));
        log.error("Bundle failed after {} attempts: {}", tips.size(), lastError);
        return new BundleResult(false, null, lastError, Lamports.ZERO, transactions.size(), tips.size(), tips);
    }

    public BundleStats stats() {
        final long total = totalBundles.get();
        final long landed = successfulBundles.get();
        return new BundleStats(total, landed, total > 0 ? (double) landed / total : 0.0, pool.count());
    }

    public BundleConfig config() {
        return config;
    }

    @Override
    public void close() {
        KeelExecutors.shutdown(buildExecutor, 1_000);
    }

    private BundleResult submitBuilt(final List<Built> built, final @Nullable Lamports tip, final String side) {
        if (built.isEmpty()) {
            log.warn("No {} transactions built; bundle not submitted", side);
            return BundleResult.notSubmitted(NO_TRANSACTIONS);
        }
        final List<Transaction> transactions = new ArrayList<>(built.size());
        for (Built b : built) {
            transactions.add(b.transaction());
        }

        final BundleResult result = submitWithRetry(transactions, tip != null ? tip : config.initialTip());
        totalBundles.incrementAndGet();
        if (result.success()) {
            successfulBundles.incrementAndGet();
            for (Built b : built) {
                b.identity().markUsed(clock.instant());
            }
            log.info("Multi-identity {} landed: bundle {}, identities: {}, tip: {} SOL",
                    side, result.bundleId(), transactions.size(), result.tipPaid().toSol());
        }
        return result;
    }

    private List<Built> buildAll(final List<Integer> selected, final BuildStep step) {
        final List<CompletableFuture<@Nullable Built>> futures = new ArrayList<>(selected.size());
        for (int index : selected) {
            final Identity identity = pool.identity(index);
            futures.add(CompletableFuture.supplyAsync(() -> buildOne(index, identity, step), buildExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        final List<Built> built = new ArrayList<>(futures.size());
        for (CompletableFuture<@Nullable Built> future : futures) {
            final Built b = future.join();
            if (b != null) {
                built.add(b);
            }
        }
        return built;
    }

    private @Nullable Built buildOne(final int index, final Identity identity, final BuildStep step) {
        try {
            final Transaction tx = step.build(identity);
            return tx == null ? null : new Built(identity, tx);
        } catch (RuntimeException e) {
            log.warn("Failed to build transaction for identity {}: {}", index, e.getMessage());
            return null;
        }
    }

    private Transaction buildBuy(final Identity identity, final TradeTarget target, final Lamports amount) {
        final List<Instruction> trade = instructions.buy(target, identity.publicKey(), amount);
        final Transaction tx = client.buildTransaction(trade, identity.keypair(),
                budget(instructions.buyComputeUnitLimit()));
        log.debug("Built buy transaction for {}: {} SOL", identity.publicKey(), amount.toSol());
        return tx;
    }

    private @Nullable Transaction buildSell(
            final Identity identity, final TradeTarget target, final BigDecimal fraction) {
        final long balance = tokenBalance(identity, target);
        identity.setTokenBalance(balance);
        final long amount = BigDecimal.valueOf(balance).multiply(fraction)
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
        if (amount <= 0) {
            log.debug("Skipping {}: nothing to sell", identity.publicKey());
            return null;
        }
        final List<Instruction> trade = instructions.sell(target, identity.publicKey(), amount);
        final Transaction tx = client.buildTransaction(trade, identity.keypair(),
                budget(instructions.sellComputeUnitLimit()));
        log.debug("Built sell transaction for {}: {} tokens", identity.publicKey(), amount);
        return tx;
    }

    private long tokenBalance(final Identity identity, final TradeTarget target) {
        try {
            return client.getTokenAccountBalance(instructions.tokenAccount(target, identity.publicKey()));
        } catch (KeelException | AllProvidersExhaustedException e) {
            log.debug("Token account of {} may not exist: {}", identity.publicKey(), e.getMessage());
            return 0L;
        }
    }

    private ComputeBudget budget(final int computeUnitLimit) {
        return ComputeBudget.builder()
                .priorityFee(config.priorityFee())
                .computeUnitLimit(computeUnitLimit)
                .build();
    }

    private RelaySubmission submitOnce(final BundleAttempt attempt) {
        try {
            final RelaySubmission submission = relay.submit(attempt.transactions(), attempt.tip());
            return submission != null ? submission : RelaySubmission.rejected("Relay returned no result");
        } catch (RuntimeException e) {
            log.error("Relay error on attempt {}: {}", attempt.attemptNumber(), e.getMessage(), e);
            return RelaySubmission.rejected(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private List<Integer> select(final @Nullable List<Integer> indices) {
        if (indices == null) {
            final List<Integer> all = new ArrayList<>(pool.count());
            for (int i = 0; i < pool.count(); i++) {
                all.add(i);
            }
            return all;
        }
        for (int index : indices) {
            if (index < 0 || index >= pool.count()) {
                throw new IndexOutOfBoundsException("Identity index " + index + " out of range");
            }
        }
        return List.copyOf(indices);
    }

    private static void transition(final BundleAttempt attempt, final BundleState from, final BundleState to) {
        if (to.isTerminal()) {
            log.info("Bundle attempt {}: {} -> {}", attempt.attemptNumber(), from, to);
        } else {
            log.debug("Bundle attempt {}: {} -> {}", attempt.attemptNumber(), from, to);
        }
    }

    private boolean pause() {
        if (config.retryDelay().isZero()) {
            return true;
        }
        try {
            Thread.sleep(config.retryDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    private interface BuildStep {
        @Nullable Transaction build(Identity identity);
    }

    private record Built(Identity identity, Transaction transaction) {
    }
}
