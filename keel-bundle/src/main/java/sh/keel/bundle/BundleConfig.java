// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.time.Duration;

import sh.keel.core.types.Lamports;

/**
 * Tip escalation and build settings for {@link BundleCoordinator}.
 *
 * @param initialTip       tip offered on the first attempt (default 0.1 SOL)
 * @param tipIncrement     added to the tip after each rejected attempt (default 0.05 SOL)
 * @param maxTip           upper bound for the escalated tip (default 1 SOL)
 * @param maxRetries       submission attempts per bundle (default 3)
 * @param retryDelay       pause between attempts (default 1s)
 * @param priorityFee      compute unit price in micro-lamports set on every trade (default 100,000)
 * @param buildParallelism threads used to build per-identity transactions (default 8)
 */
public record BundleConfig(
        Lamports initialTip,
        Lamports tipIncrement,
        Lamports maxTip,
        int maxRetries,
        Duration retryDelay,
        long priorityFee,
        int buildParallelism) {

    public static final Lamports DEFAULT_INITIAL_TIP = Lamports.of(100_000_000L);
    public static final Lamports DEFAULT_TIP_INCREMENT = Lamports.of(50_000_000L);
    public static final Lamports DEFAULT_MAX_TIP = Lamports.of(1_000_000_000L);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final long DEFAULT_PRIORITY_FEE = 100_000L;
    public static final int DEFAULT_BUILD_PARALLELISM = 8;

    public BundleConfig {
        if (initialTip == null || tipIncrement == null || maxTip == null) {
            throw new IllegalArgumentException("tips must not be null");
        }
        if (maxTip.isLessThan(initialTip)) {
            throw new IllegalArgumentException("maxTip must be >= initialTip");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be non-negative");
        }
        if (priorityFee < 0) {
            throw new IllegalArgumentException("priorityFee must be non-negative, got: " + priorityFee);
        }
        if (buildParallelism < 1) {
            throw new IllegalArgumentException("buildParallelism must be >= 1, got: " + buildParallelism);
        }
    }

    public static BundleConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the tip for the attempt after one offering {@code current}.
     * The result is capped at {@code maxTip} but never lower than {@code current}.
     */
    public Lamports escalate(final Lamports current) {
        final Lamports next = current.plus(tipIncrement);
        final Lamports capped = next.compareTo(maxTip) > 0 ? maxTip : next;
        return capped.compareTo(current) < 0 ? current : capped;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Lamports initialTip = DEFAULT_INITIAL_TIP;
        private Lamports tipIncrement = DEFAULT_TIP_INCREMENT;
        private Lamports maxTip = DEFAULT_MAX_TIP;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private long priorityFee = DEFAULT_PRIORITY_FEE;
        private int buildParallelism = DEFAULT_BUILD_PARALLELISM;

        private Builder() {}

        public Builder initialTip(final Lamports initialTip) {
            this.initialTip = initialTip;
            return this;
        }

        public Builder tipIncrement(final Lamports tipIncrement) {
            this.tipIncrement = tipIncrement;
            return this;
        }

        public Builder maxTip(final Lamports maxTip) {
            this.maxTip = maxTip;
            return this;
        }

        public Builder maxRetries(final int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(final Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder priorityFee(final long priorityFee) {
            this.priorityFee = priorityFee;
            return this;
        }

        public Builder buildParallelism(final int buildParallelism) {
            this.buildParallelism = buildParallelism;
            return this;
        }

        public BundleConfig build() {
            return new BundleConfig(
                    initialTip, tipIncrement, maxTip, maxRetries, retryDelay, priorityFee, buildParallelism);
        }
    }
}
