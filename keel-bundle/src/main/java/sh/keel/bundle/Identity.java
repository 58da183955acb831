// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;

/**
 * One signing identity of an {@link IdentityPool} with its cached balances and usage.
 *
 * <p>
 * Cached values reflect the last network read or local update and may lag the chain.
 * All accessors are thread-safe.
 */
public final class Identity {

    private final Keypair keypair;
    private Lamports solBalance;
    private long tokenBalance;
    private int totalTrades;
    private @Nullable Instant lastUsed;

    Identity(final Keypair keypair) {
        this(keypair, Lamports.ZERO, 0L, 0, null);
    }

    Identity(
            final Keypair keypair,
            final Lamports solBalance,
            final long tokenBalance,
            final int totalTrades,
            final @Nullable Instant lastUsed) {
        this.keypair = Objects.requireNonNull(keypair, "keypair");
        this.solBalance = Objects.requireNonNull(solBalance, "solBalance");
        this.tokenBalance = tokenBalance;
        this.totalTrades = totalTrades;
        this.lastUsed = lastUsed;
    }

    public PublicKey publicKey() {
        return keypair.publicKey();
    }

    public Keypair keypair() {
        return keypair;
    }

    public synchronized Lamports solBalance() {
        return solBalance;
    }

    synchronized void setSolBalance(final Lamports balance) {
        this.solBalance = Objects.requireNonNull(balance, "balance");
    }

    synchronized void credit(final Lamports amount) {
        this.solBalance = solBalance.plus(amount);
    }

    /**
     * Returns the raw token amount last observed for this identity.
     */
    public synchronized long tokenBalance() {
        return tokenBalance;
    }

    synchronized void setTokenBalance(final long tokenBalance) {
        this.tokenBalance = tokenBalance;
    }

    public synchronized int totalTrades() {
        return totalTrades;
    }

    public synchronized @Nullable Instant lastUsed() {
        return lastUsed;
    }

    /**
     * Counts one trade and stamps the usage time.
     */
    public synchronized void markUsed(final Instant now) {
        totalTrades++;
        lastUsed = now;
    }

    @Override
    public String toString() {
        return "Identity{" + publicKey() + ", balance=" + solBalance().toSol() + " SOL}";
    }
}
