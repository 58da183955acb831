// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import org.jspecify.annotations.Nullable;

/**
 * Thrown by {@link FailoverRouter} when every attempt of a failover call failed.
 *
 * <p>
 * The cause is the error of the final attempt; {@link #getSuppressed()} holds
 * every attempt's error in order.
 *
 * <pre>{@code
 * try {
 *     router.getLatestBlockhash();
 * } catch (AllProvidersExhaustedException e) {
 *     log.error("Gave up after {} attempts on {}", e.getAttemptCount(), e.getLastEndpoint());
 * }
 * }</pre>
 */
public final class AllProvidersExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attemptCount;
    private final long totalRetryDurationMs;
    private final @Nullable String lastEndpoint;

    public AllProvidersExhaustedException(
            final int attemptCount,
            final long totalRetryDurationMs,
            final @Nullable String lastEndpoint,
            final @Nullable Throwable cause) {
        super("All providers failed after " + attemptCount + " attempts. Last error: "
                + (cause != null ? cause.getMessage() : "none"), cause);
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
        this.lastEndpoint = lastEndpoint;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public long getTotalRetryDurationMs() {
        return totalRetryDurationMs;
    }

    /**
     * Returns the endpoint used by the final attempt.
     */
    public @Nullable String getLastEndpoint() {
        return lastEndpoint;
    }
}
