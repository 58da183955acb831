// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;

/**
 * Tuning for {@link ResilientClient}.
 *
 * @param maxSendRetries           send attempts per transaction (default 3)
 * @param sendBackoffBase          wait after the first failed send, doubling after (default 1s)
 * @param confirmPollInterval      delay between signature status polls (default 1s)
 * @param blockhashRefreshInterval single-endpoint blockhash refresh interval (default 5s)
 * @param skipPreflight            skip node-side simulation when sending (default true)
 */
public record ClientConfig(
        int maxSendRetries,
        Duration sendBackoffBase,
        Duration confirmPollInterval,
        Duration blockhashRefreshInterval,
        boolean skipPreflight) {

    public static final int DEFAULT_MAX_SEND_RETRIES = 3;
    public static final Duration DEFAULT_SEND_BACKOFF_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CONFIRM_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_BLOCKHASH_REFRESH_INTERVAL = Duration.ofSeconds(5);

    public ClientConfig {
        if (maxSendRetries < 1) {
            throw new IllegalArgumentException("maxSendRetries must be >= 1, got: " + maxSendRetries);
        }
        if (sendBackoffBase == null || sendBackoffBase.isNegative()) {
            throw new IllegalArgumentException("sendBackoffBase must be >= 0");
        }
        if (confirmPollInterval == null || confirmPollInterval.isNegative()) {
            throw new IllegalArgumentException("confirmPollInterval must be >= 0");
        }
        if (blockhashRefreshInterval == null || blockhashRefreshInterval.isNegative()
                || blockhashRefreshInterval.isZero()) {
            throw new IllegalArgumentException("blockhashRefreshInterval must be positive");
        }
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the wait after the failed send with zero-based index {@code attempt}.
     */
    public Duration sendBackoffFor(final int attempt) {
        return sendBackoffBase.multipliedBy(1L << Math.min(attempt, 30));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxSendRetries = DEFAULT_MAX_SEND_RETRIES;
        private Duration sendBackoffBase = DEFAULT_SEND_BACKOFF_BASE;
        private Duration confirmPollInterval = DEFAULT_CONFIRM_POLL_INTERVAL;
        private Duration blockhashRefreshInterval = DEFAULT_BLOCKHASH_REFRESH_INTERVAL;
        private boolean skipPreflight = true;

        private Builder() {}

        public Builder maxSendRetries(final int maxSendRetries) {
            this.maxSendRetries = maxSendRetries;
            return this;
        }

        public Builder sendBackoffBase(final Duration sendBackoffBase) {
            this.sendBackoffBase = sendBackoffBase;
            return this;
        }

        public Builder confirmPollInterval(final Duration confirmPollInterval) {
            this.confirmPollInterval = confirmPollInterval;
            return this;
        }

        public Builder blockhashRefreshInterval(final Duration blockhashRefreshInterval) {
            this.blockhashRefreshInterval = blockhashRefreshInterval;
            return this;
        }

        public Builder skipPreflight(final boolean skipPreflight) {
            this.skipPreflight = skipPreflight;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    maxSendRetries, sendBackoffBase, confirmPollInterval, blockhashRefreshInterval, skipPreflight);
        }
    }
}
