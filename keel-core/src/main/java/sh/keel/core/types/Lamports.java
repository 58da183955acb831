// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Represents a quantity in lamports (10^-9 SOL).
 * <p>
 * All internal arithmetic on SOL amounts happens in lamports. Use
 * {@link #fromSol(BigDecimal)} and {@link #toSol()} only at input/output
 * boundaries such as configuration and persisted state.
 */
public record Lamports(long value) implements Comparable<Lamports> {

    /** Number of lamports in one SOL. */
    public static final long LAMPORTS_PER_SOL = 1_000_000_000L;

    public static final Lamports ZERO = new Lamports(0L);

    private static final BigDecimal LAMPORTS_PER_SOL_DECIMAL = BigDecimal.valueOf(LAMPORTS_PER_SOL);

    public Lamports {
        if (value < 0) {
            throw new IllegalArgumentException("Lamports must be non-negative, got: " + value);
        }
    }

    public static Lamports of(final long lamports) {
        return new Lamports(lamports);
    }

    /**
     * Converts a SOL amount to lamports, rounding sub-lamport fractions down.
     */
    public static Lamports fromSol(final BigDecimal sol) {
        Objects.requireNonNull(sol, "sol");
        return new Lamports(sol.multiply(LAMPORTS_PER_SOL_DECIMAL).setScale(0, RoundingMode.DOWN).longValueExact());
    }

    public static Lamports fromSol(final String sol) {
        return fromSol(new BigDecimal(sol));
    }

    public BigDecimal toSol() {
        return BigDecimal.valueOf(value).divide(LAMPORTS_PER_SOL_DECIMAL, 9, RoundingMode.DOWN);
    }

    public Lamports plus(final Lamports other) {
        return new Lamports(Math.addExact(value, other.value));
    }

    /**
     * Returns {@code this - other}, floored at zero.
     */
    public Lamports minusOrZero(final Lamports other) {
        return value <= other.value ? ZERO : new Lamports(value - other.value);
    }

    public boolean isLessThan(final Lamports other) {
        return value < other.value;
    }

    @Override
    public int compareTo(final Lamports other) {
        return Long.compare(value, other.value);
    }
}
