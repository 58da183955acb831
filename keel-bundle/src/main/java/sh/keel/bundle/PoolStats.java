// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import sh.keel.core.types.Lamports;

/**
 * Aggregate view over the cached balances of an {@link IdentityPool}.
 */
public record PoolStats(
        int count,
        Lamports totalBalance,
        Lamports averageBalance,
        long totalTrades,
        Lamports minBalance,
        Lamports maxBalance) {
}
