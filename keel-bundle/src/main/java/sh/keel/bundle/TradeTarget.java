// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.util.Objects;

import sh.keel.core.types.PublicKey;

/**
 * The token a bundle trades.
 *
 * @param mint   token mint address
 * @param symbol display symbol, used in logs only
 */
public record TradeTarget(PublicKey mint, String symbol) {

    public TradeTarget {
        Objects.requireNonNull(mint, "mint");
        symbol = symbol == null ? mint.value() : symbol;
    }
}
