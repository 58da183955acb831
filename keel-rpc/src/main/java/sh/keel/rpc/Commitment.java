// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * Solana commitment levels, weakest first.
 */
public enum Commitment {
    PROCESSED,
    CONFIRMED,
    FINALIZED;

    /**
     * Returns the wire name ({@code "processed"}, {@code "confirmed"}, {@code "finalized"}).
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether a reported {@code confirmationStatus} meets this level.
     */
    public boolean isSatisfiedBy(final @Nullable String confirmationStatus) {
        if (confirmationStatus == null) {
            return false;
        }
        for (Commitment level : values()) {
            if (level.value().equals(confirmationStatus)) {
                return level.ordinal() >= ordinal();
            }
        }
        return false;
    }
}
