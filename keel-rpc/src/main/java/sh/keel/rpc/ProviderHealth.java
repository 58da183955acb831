// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Rolling health metrics and a 0..1 quality score for one RPC endpoint.
 *
 * <h2>Scoring</h2>
 *
 * <pre>
 * score = successRate
 *       - min(averageLatencyMs / 1000, 1) * 0.2
 *       - min(consecutiveFailures / 5, 1) * 0.3
 * </pre>
 *
 * clamped to [0, 1]. A provider with no observations scores 0.5.
 *
 * <h2>Status</h2>
 * A success sets {@link ProviderStatus#HEALTHY}. After a failure the status is
 * {@link ProviderStatus#UNHEALTHY} at 3 or more consecutive failures and
 * {@link ProviderStatus#DEGRADED} otherwise.
 *
 * <p>
 * <strong>Thread Safety:</strong> all methods are synchronized.
 */
public final class ProviderHealth {

    /** Latency samples kept for the rolling average. */
    public static final int LATENCY_WINDOW = 100;

    static final int UNHEALTHY_THRESHOLD = 3;
    static final double NEUTRAL_SCORE = 0.5;

    private final String endpoint;
    private final Clock clock;
    private final Deque<Double> recentLatencies = new ArrayDeque<>(LATENCY_WINDOW);

    private ProviderStatus status = ProviderStatus.UNKNOWN;
    private double latencySum;
    private double successRate = 1.0;
    private int consecutiveFailures;
    private long totalRequests;
    private long successfulRequests;
    private @Nullable String lastError;
    private @Nullable Instant lastCheck;

    public ProviderHealth(final String endpoint) {
        this(endpoint, Clock.systemUTC());
    }

    ProviderHealth(final String endpoint, final Clock clock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String endpoint() {
        return endpoint;
    }

    /**
     * Records a successful request that took {@code latencyMs}.
     */
    public synchronized void recordSuccess(final double latencyMs) {
        totalRequests++;
        successfulRequests++;
        consecutiveFailures = 0;
        if (recentLatencies.size() == LATENCY_WINDOW) {
            latencySum -= recentLatencies.removeFirst();
        }
        final double sample = Math.max(0.0, latencyMs);
        recentLatencies.addLast(sample);
        latencySum += sample;
        successRate = (double) successfulRequests / totalRequests;
        lastCheck = clock.instant();
        status = ProviderStatus.HEALTHY;
        lastError = null;
    }

    /**
     * Records a failed request. Never throws.
     */
    public synchronized void recordFailure(final @Nullable String error) {
        totalRequests++;
        consecutiveFailures++;
        lastCheck = clock.instant();
        lastError = error;
        status = consecutiveFailures >= UNHEALTHY_THRESHOLD ? ProviderStatus.UNHEALTHY : ProviderStatus.DEGRADED;
        successRate = (double) successfulRequests / totalRequests;
    }

    public synchronized double score() {
        if (totalRequests == 0) {
            return NEUTRAL_SCORE;
        }
        double score = successRate;
        score -= Math.min(averageLatencyMs() / 1000.0, 1.0) * 0.2;
        score -= Math.min(consecutiveFailures / 5.0, 1.0) * 0.3;
        return Math.max(0.0, Math.min(1.0, score));
    }

    public synchronized ProviderStatus status() {
        return status;
    }

    public synchronized double successRate() {
        return successRate;
    }

    public synchronized double averageLatencyMs() {
        return recentLatencies.isEmpty() ? 0.0 : latencySum / recentLatencies.size();
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized @Nullable String lastError() {
        return lastError;
    }

    public synchronized ProviderHealthSnapshot snapshot() {
        return new ProviderHealthSnapshot(
                endpoint,
                status,
                averageLatencyMs(),
                successRate,
                consecutiveFailures,
                totalRequests,
                successfulRequests,
                score(),
                lastError,
                lastCheck);
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
