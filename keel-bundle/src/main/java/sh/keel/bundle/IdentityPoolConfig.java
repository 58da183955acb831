// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.nio.file.Path;
import java.time.Duration;

import org.jspecify.annotations.Nullable;

import sh.keel.core.types.Lamports;

/**
 * Settings for {@link IdentityPool}.
 *
 * @param size          number of identities kept in the pool (default 20)
 * @param minBalance    identities below this are topped up during initialization (default 0.1 SOL)
 * @param targetBalance balance each identity is funded up to (default 1 SOL)
 * @param feeMargin     headroom the funding identity must keep for fees (default 0.01 SOL)
 * @param fundingDelay  pause between consecutive funding transfers (default 100ms)
 * @param storagePath   JSON file the pool is loaded from and saved to; {@code null} keeps it in memory
 */
public record IdentityPoolConfig(
        int size,
        Lamports minBalance,
        Lamports targetBalance,
        Lamports feeMargin,
        Duration fundingDelay,
        @Nullable Path storagePath) {

    public static final int DEFAULT_SIZE = 20;
    public static final Lamports DEFAULT_MIN_BALANCE = Lamports.of(100_000_000L);
    public static final Lamports DEFAULT_TARGET_BALANCE = Lamports.of(1_000_000_000L);
    public static final Lamports DEFAULT_FEE_MARGIN = Lamports.of(10_000_000L);
    public static final Duration DEFAULT_FUNDING_DELAY = Duration.ofMillis(100);

    public IdentityPoolConfig {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1, got: " + size);
        }
        if (minBalance == null || targetBalance == null || feeMargin == null) {
            throw new IllegalArgumentException("balances must not be null");
        }
        if (targetBalance.isLessThan(minBalance)) {
            throw new IllegalArgumentException("targetBalance must be >= minBalance");
        }
        if (fundingDelay == null || fundingDelay.isNegative()) {
            throw new IllegalArgumentException("fundingDelay must be non-negative");
        }
    }

    public static IdentityPoolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int size = DEFAULT_SIZE;
        private Lamports minBalance = DEFAULT_MIN_BALANCE;
        private Lamports targetBalance = DEFAULT_TARGET_BALANCE;
        private Lamports feeMargin = DEFAULT_FEE_MARGIN;
        private Duration fundingDelay = DEFAULT_FUNDING_DELAY;
        private @Nullable Path storagePath;

        private Builder() {}

        public Builder size(final int size) {
            this.size = size;
            return this;
        }

        public Builder minBalance(final Lamports minBalance) {
            this.minBalance = minBalance;
            return this;
        }

        public Builder targetBalance(final Lamports targetBalance) {
            this.targetBalance = targetBalance;
            return this;
        }

        public Builder feeMargin(final Lamports feeMargin) {
            this.feeMargin = feeMargin;
            return this;
        }

        public Builder fundingDelay(final Duration fundingDelay) {
            this.fundingDelay = fundingDelay;
            return this;
        }

        public Builder storagePath(final @Nullable Path storagePath) {
            this.storagePath = storagePath;
            return this;
        }

        public IdentityPoolConfig build() {
            return new IdentityPoolConfig(size, minBalance, targetBalance, feeMargin, fundingDelay, storagePath);
        }
    }
}
