// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Instant;

import org.jspecify.annotations.Nullable;

/**
 * Immutable point-in-time view of a {@link ProviderHealth}.
 */
public record ProviderHealthSnapshot(
        String endpoint,
        ProviderStatus status,
        double averageLatencyMs,
        double successRate,
        int consecutiveFailures,
        long totalRequests,
        long successfulRequests,
        double score,
        @Nullable String lastError,
        @Nullable Instant lastCheck) {}
