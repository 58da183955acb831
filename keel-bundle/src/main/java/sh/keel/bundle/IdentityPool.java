// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.crypto.Signer;
import sh.keel.core.error.KeelException;
import sh.keel.core.program.SystemProgram;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.core.types.TransactionSignature;
import sh.keel.rpc.AllProvidersExhaustedException;
import sh.keel.rpc.ResilientClient;

/**
 * A fixed-size set of signing identities funded from one source identity.
 *
 * <p>
 * {@link #initialize(Signer)} loads the pool from {@link IdentityPoolConfig#storagePath()}
 * when that file exists (generating more identities if it holds fewer than
 * {@link IdentityPoolConfig#size()}), otherwise generates a fresh pool. It then tops
 * up every identity below {@code minBalance} to {@code targetBalance}, provided the
 * funding identity can cover the total shortfall plus {@code feeMargin}.
 *
 * <p>
 * An identity is written to storage before it can receive funds. The pool is saved
 * whenever identities are generated and again after each accepted transfer.
 *
 * <p>
 * Failures affecting a single identity (a balance read, a transfer) are logged and
 * skipped; they never abort the rest of the pool.
 */
public final class IdentityPool {

    private static final Logger log = LoggerFactory.getLogger(IdentityPool.class);

    private final ResilientClient client;
    private final IdentityPoolConfig config;
    private final List<Identity> identities = new ArrayList<>();
    private @Nullable Signer funder;
    private volatile boolean initialized;

    public IdentityPool(final ResilientClient client, final IdentityPoolConfig config) {
        this.client = Objects.requireNonNull(client, "client");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Loads or generates the identities and funds those below the minimum balance.
     * A second call logs a warning and returns.
     */
    public synchronized void initialize(final Signer fundingIdentity) {
        Objects.requireNonNull(fundingIdentity, "fundingIdentity");
        if (initialized) {
            log.warn("Identity pool already initialized");
            return;
        }
        this.funder = fundingIdentity;

        final Path storage = config.storagePath();
        if (storage != null && Files.exists(storage)) {
            load(storage);
        } else {
            generate();
        }
        checkAndFund();

        initialized = true;
        log.info("Identity pool initialized with {} identities", identities.size());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Transfers {@code amount} from the funding identity to identity {@code index}
     * and saves the pool once the transfer is accepted.
     *
     * @return {@code true} if the transfer was accepted by the node
     * @throws IndexOutOfBoundsException if {@code index} is not a pool index
     * @throws IllegalStateException     if the pool has no funding identity yet
     */
    public boolean fund(final int index, final Lamports amount) {
        Objects.requireNonNull(amount, "amount");
        final Identity identity = identity(index);
        final Signer source = requireFunder();
        try {
            final Transaction tx = client.buildTransaction(
                    List.of(SystemProgram.transfer(source.publicKey(), identity.publicKey(), amount)), source);
            final TransactionSignature signature = client.sendTransaction(tx);
            identity.credit(amount);
            log.info("Funded identity {} ({}): {} SOL, signature: {}",
                    index, identity.publicKey(), amount.toSol(), signature);
            save();
            return true;
        } catch (KeelException | AllProvidersExhaustedException e) {
            log.error("Error funding identity {}: {}", index, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Re-reads all balances and spreads the pool-wide shortfall against
     * {@code targetBalance * size} evenly over the identities below target.
     */
    public synchronized void rebalance() {
        log.info("Rebalancing identities...");
        long total = 0L;
        for (Identity identity : identities) {
            final Lamports balance = readBalance(identity.publicKey());
            identity.setSolBalance(balance);
            total += balance.value();
        }

        final long targetTotal = config.targetBalance().value() * identities.size();
        if (total >= targetTotal) {
            log.info("Pool balance meets target");
            return;
        }

        final List<Integer> underTarget = new ArrayList<>();
        for (int i = 0; i < identities.size(); i++) {
            if (identities.get(i).solBalance().isLessThan(config.targetBalance())) {
                underTarget.add(i);
            }
        }
        if (underTarget.isEmpty()) {
            return;
        }
        final Lamports share = Lamports.of((targetTotal - total) / underTarget.size());
        log.info("Total balance below target, funding {} SOL across {} identities",
                Lamports.of(targetTotal - total).toSol(), underTarget.size());
        fundAll(underTarget, share);
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not a pool index
     */
    public synchronized Identity identity(final int index) {
        if (index < 0 || index >= identities.size()) {
            throw new IndexOutOfBoundsException("Identity index " + index + " out of range");
        }
        return identities.get(index);
    }

    public synchronized int count() {
        return identities.size();
    }

    public synchronized List<Identity> identities() {
        return Collections.unmodifiableList(new ArrayList<>(identities));
    }

    /**
     * Refreshes and returns every identity's SOL balance in pool order.
     */
    public synchronized List<Lamports> allBalances() {
        final List<Lamports> balances = new ArrayList<>(identities.size());
        for (Identity identity : identities) {
            final Lamports balance = readBalance(identity.publicKey());
            identity.setSolBalance(balance);
            balances.add(balance);
        }
        return balances;
    }

    /**
     * Summarizes cached balances without network access.
     */
    public synchronized PoolStats stats() {
        if (identities.isEmpty()) {
            return new PoolStats(0, Lamports.ZERO, Lamports.ZERO, 0L, Lamports.ZERO, Lamports.ZERO);
        }
        long total = 0L;
        long trades = 0L;
        long min = Long.MAX_VALUE;
        long max = 0L;
        for (Identity identity : identities) {
            final long balance = identity.solBalance().value();
            total += balance;
            trades += identity.totalTrades();
            min = Math.min(min, balance);
            max = Math.max(max, balance);
        }
        return new PoolStats(identities.size(), Lamports.of(total), Lamports.of(total / identities.size()),
                trades, Lamports.of(min), Lamports.of(max));
    }

    /**
     * Writes the pool to {@link IdentityPoolConfig#storagePath()}; does nothing without one.
     */
    public synchronized void save() {
        final Path storage = config.storagePath();
        if (storage == null) {
            return;
        }
        final List<PoolState.Entry> entries = new ArrayList<>(identities.size());
        for (Identity identity : identities) {
            final Instant lastUsed = identity.lastUsed();
            entries.add(new PoolState.Entry(
                    identity.keypair().toBase58SecretKey(),
                    identity.solBalance().toSol(),
                    identity.tokenBalance(),
                    identity.totalTrades(),
                    lastUsed == null ? 0.0 : lastUsed.toEpochMilli() / 1000.0));
        }
        try {
            new PoolState(entries).write(storage);
            log.info("Saved {} identities to {}", identities.size(), storage);
        } catch (IOException e) {
            log.error("Error saving identities to {}: {}", storage, e.getMessage(), e);
        }
    }

    private void generate() {
        log.info("Generating {} new identities...", config.size());
        identities.clear();
        topUpCount();
        save();
    }

    private void load(final Path storage) {
        try {
            final PoolState state = PoolState.read(storage);
            identities.clear();
            for (PoolState.Entry entry : state.identities()) {
                identities.add(fromEntry(entry));
            }
            final int stored = identities.size();
            topUpCount();
            log.info("Loaded {} identities from storage", stored);
            if (identities.size() > stored) {
                save();
            }
        } catch (IOException | RuntimeException e) {
            log.error("Error loading identities from {}: {}", storage, e.getMessage(), e);
            generate();
        }
    }

    private static Identity fromEntry(final PoolState.Entry entry) {
        final Double lastUsed = entry.lastUsed();
        return new Identity(
                Keypair.fromBase58SecretKey(entry.keyMaterial()),
                entry.balanceSol() == null ? Lamports.ZERO : Lamports.fromSol(entry.balanceSol()),
                entry.balanceTokens() == null ? 0L : entry.balanceTokens(),
                entry.totalTrades() == null ? 0 : entry.totalTrades(),
                lastUsed == null || lastUsed <= 0.0
                        ? null
                        : Instant.ofEpochMilli(BigDecimal.valueOf(lastUsed).movePointRight(3)
                                .setScale(0, RoundingMode.DOWN).longValueExact()));
    }

    private void topUpCount() {
        while (identities.size() < config.size()) {
            final Identity identity = new Identity(Keypair.generate());
            identities.add(identity);
            log.debug("Generated identity {}/{}: {}", identities.size(), config.size(), identity.publicKey());
        }
    }

    private void checkAndFund() {
        log.info("Checking identity balances...");
        final List<Integer> toFund = new ArrayList<>();
        final List<Lamports> amounts = new ArrayList<>();
        long totalNeeded = 0L;

        for (int i = 0; i < identities.size(); i++) {
            final Identity identity = identities.get(i);
            final Lamports balance = readBalance(identity.publicKey());
            identity.setSolBalance(balance);
            if (balance.isLessThan(config.minBalance())) {
                final Lamports needed = config.targetBalance().minusOrZero(balance);
                totalNeeded += needed.value();
                toFund.add(i);
                amounts.add(needed);
            }
        }

        if (toFund.isEmpty()) {
            log.info("All identities have sufficient balance");
            return;
        }
        log.info("Funding {} identities, total: {} SOL", toFund.size(), Lamports.of(totalNeeded).toSol());

        final Lamports available = readBalance(requireFunder().publicKey());
        final Lamports required = Lamports.of(totalNeeded).plus(config.feeMargin());
        if (available.isLessThan(required)) {
            log.warn("Insufficient balance in funding identity: {} SOL, needed: {} SOL",
                    available.toSol(), Lamports.of(totalNeeded).toSol());
            return;
        }

        for (int n = 0; n < toFund.size(); n++) {
            fund(toFund.get(n), amounts.get(n));
            if (n < toFund.size() - 1 && !pause(config.fundingDelay())) {
                break;
            }
        }
    }

    private void fundAll(final List<Integer> indices, final Lamports share) {
        for (int n = 0; n < indices.size(); n++) {
            fund(indices.get(n), share);
            if (n < indices.size() - 1 && !pause(config.fundingDelay())) {
                break;
            }
        }
    }

    /**
     * Returns the on-chain balance, or zero when it cannot be read.
     */
    private Lamports readBalance(final PublicKey account) {
        try {
            return client.getBalance(account);
        } catch (KeelException | AllProvidersExhaustedException e) {
            log.error("Error getting balance of {}: {}", account, e.getMessage());
            return Lamports.ZERO;
        }
    }

    private Signer requireFunder() {
        final Signer source = funder;
        if (source == null) {
            throw new IllegalStateException("Identity pool has no funding identity; call initialize first");
        }
        return source;
    }

    private static boolean pause(final Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Funding interrupted");
            return false;
        }
    }
}
