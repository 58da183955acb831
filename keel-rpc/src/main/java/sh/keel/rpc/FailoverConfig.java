// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;

/**
 * Tuning for {@link FailoverRouter}.
 *
 * @param healthCheckInterval      delay between background health checks (default 30s)
 * @param blockhashRefreshInterval delay between blockhash refreshes (default 5s)
 * @param healthCheckTimeout       timeout of one liveness call (default 5s)
 * @param requestTimeout           timeout of ordinary RPC calls (default 10s)
 * @param minSuccessRate           minimum success rate to be preferred (default 0.8)
 * @param maxLatencyMs             maximum average latency to be preferred (default 2000)
 * @param backoffBase              backoff before the second attempt, doubling after (default 500ms)
 * @param maxRetries               attempts per failover call (default 3)
 * @param confirmMaxRetries        attempts for confirmation polling (default 5)
 * @param confirmPollInterval      delay between signature status polls (default 1s)
 */
public record FailoverConfig(
        Duration healthCheckInterval,
        Duration blockhashRefreshInterval,
        Duration healthCheckTimeout,
        Duration requestTimeout,
        double minSuccessRate,
        double maxLatencyMs,
        Duration backoffBase,
        int maxRetries,
        int confirmMaxRetries,
        Duration confirmPollInterval) {

    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_BLOCKHASH_REFRESH_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final double DEFAULT_MIN_SUCCESS_RATE = 0.8;
    public static final double DEFAULT_MAX_LATENCY_MS = 2000.0;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_CONFIRM_MAX_RETRIES = 5;
    public static final Duration DEFAULT_CONFIRM_POLL_INTERVAL = Duration.ofSeconds(1);

    public FailoverConfig {
        requirePositive(healthCheckInterval, "healthCheckInterval");
        requirePositive(blockhashRefreshInterval, "blockhashRefreshInterval");
        requirePositive(healthCheckTimeout, "healthCheckTimeout");
        requirePositive(requestTimeout, "requestTimeout");
        requireNonNegative(backoffBase, "backoffBase");
        requireNonNegative(confirmPollInterval, "confirmPollInterval");
        if (minSuccessRate < 0.0 || minSuccessRate > 1.0) {
            throw new IllegalArgumentException("minSuccessRate must be in [0, 1], got: " + minSuccessRate);
        }
        if (maxLatencyMs <= 0) {
            throw new IllegalArgumentException("maxLatencyMs must be > 0, got: " + maxLatencyMs);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        if (confirmMaxRetries < 1) {
            throw new IllegalArgumentException("confirmMaxRetries must be >= 1, got: " + confirmMaxRetries);
        }
    }

    public static FailoverConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the backoff after the failed attempt with zero-based index {@code attempt}.
     */
    public Duration backoffFor(final int attempt) {
        return backoffBase.multipliedBy(1L << Math.min(attempt, 30));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(final Duration d, final String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + d);
        }
    }

    private static void requireNonNegative(final Duration d, final String name) {
        if (d == null || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0, got: " + d);
        }
    }

    public static final class Builder {
        private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;
        private Duration blockhashRefreshInterval = DEFAULT_BLOCKHASH_REFRESH_INTERVAL;
        private Duration healthCheckTimeout = DEFAULT_HEALTH_CHECK_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private double minSuccessRate = DEFAULT_MIN_SUCCESS_RATE;
        private double maxLatencyMs = DEFAULT_MAX_LATENCY_MS;
        private Duration backoffBase = DEFAULT_BACKOFF_BASE;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int confirmMaxRetries = DEFAULT_CONFIRM_MAX_RETRIES;
        private Duration confirmPollInterval = DEFAULT_CONFIRM_POLL_INTERVAL;

        private Builder() {}

        public Builder healthCheckInterval(final Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder blockhashRefreshInterval(final Duration blockhashRefreshInterval) {
            this.blockhashRefreshInterval = blockhashRefreshInterval;
            return this;
        }

        public Builder healthCheckTimeout(final Duration healthCheckTimeout) {
            this.healthCheckTimeout = healthCheckTimeout;
            return this;
        }

        public Builder requestTimeout(final Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder minSuccessRate(final double minSuccessRate) {
            this.minSuccessRate = minSuccessRate;
            return this;
        }

        public Builder maxLatencyMs(final double maxLatencyMs) {
            this.maxLatencyMs = maxLatencyMs;
            return this;
        }

        public Builder backoffBase(final Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder maxRetries(final int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder confirmMaxRetries(final int confirmMaxRetries) {
            this.confirmMaxRetries = confirmMaxRetries;
            return this;
        }

        public Builder confirmPollInterval(final Duration confirmPollInterval) {
            this.confirmPollInterval = confirmPollInterval;
            return this;
        }

        public FailoverConfig build() {
            return new FailoverConfig(
                    healthCheckInterval,
                    blockhashRefreshInterval,
                    healthCheckTimeout,
                    requestTimeout,
                    minSuccessRate,
                    maxLatencyMs,
                    backoffBase,
                    maxRetries,
                    confirmMaxRetries,
                    confirmPollInterval);
        }
    }
}
