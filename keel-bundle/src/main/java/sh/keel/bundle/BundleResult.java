// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.keel.core.types.Lamports;

/**
 * Final outcome of a bundle after tip escalation.
 *
 * @param success               whether an attempt landed
 * @param bundleId              identifier of the landed bundle
 * @param errorMessage          last rejection reason when nothing landed
 * @param tipPaid               tip of the landing attempt, zero when nothing landed
 * @param transactionsSubmitted transactions in the bundle
 * @param attempts              submission attempts made
 * @param attemptedTips         tip offered on each attempt, in order
 */
public record BundleResult(
        boolean success,
        @Nullable String bundleId,
        @Nullable String errorMessage,
        Lamports tipPaid,
        int transactionsSubmitted,
        int attempts,
        List<Lamports> attemptedTips) {

    public BundleResult {
        attemptedTips = List.copyOf(attemptedTips);
    }

    /**
     * A result for a bundle that was never submitted.
     */
    public static BundleResult notSubmitted(final String errorMessage) {
        return new BundleResult(false, null, errorMessage, Lamports.ZERO, 0, 0, List.of());
    }
}
