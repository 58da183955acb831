// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.tx;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.keel.core.program.ComputeBudgetProgram;

/**
 * Optional compute budget settings applied when building a transaction.
 *
 * <p>
 * When any option is set, {@link #prependTo(List)} emits, in this order:
 * <ol>
 * <li>the loaded-accounts data size limit, if set</li>
 * <li>the compute unit limit ({@value #DEFAULT_COMPUTE_UNIT_LIMIT} if unset)</li>
 * <li>the compute unit price, if set</li>
 * </ol>
 * followed by the caller's instructions unchanged. With no option set the
 * instructions are returned as-is.
 *
 * @param priorityFee          compute unit price in micro-lamports
 * @param computeUnitLimit     compute unit limit
 * @param accountDataSizeLimit loaded-accounts data size limit in bytes
 */
public record ComputeBudget(
        @Nullable Long priorityFee,
        @Nullable Integer computeUnitLimit,
        @Nullable Integer accountDataSizeLimit) {

    public static final int DEFAULT_COMPUTE_UNIT_LIMIT = 85_000;

    public static final ComputeBudget NONE = new ComputeBudget(null, null, null);

    public boolean isEmpty() {
        return priorityFee == null && computeUnitLimit == null && accountDataSizeLimit == null;
    }

    /**
     * Returns the budget instructions this configuration produces.
     */
    public List<Instruction> instructions() {
        if (isEmpty()) {
            return List.of();
        }
        final List<Instruction> out = new ArrayList<>(3);
        if (accountDataSizeLimit != null) {
            out.add(ComputeBudgetProgram.setLoadedAccountsDataSizeLimit(accountDataSizeLimit));
        }
        out.add(ComputeBudgetProgram.setComputeUnitLimit(
                computeUnitLimit != null ? computeUnitLimit : DEFAULT_COMPUTE_UNIT_LIMIT));
        if (priorityFee != null) {
            out.add(ComputeBudgetProgram.setComputeUnitPrice(priorityFee));
        }
        return out;
    }

    /**
     * Returns the budget instructions followed by {@code instructions}.
     */
    public List<Instruction> prependTo(final List<Instruction> instructions) {
        final List<Instruction> budget = instructions();
        if (budget.isEmpty()) {
            return List.copyOf(instructions);
        }
        final List<Instruction> out = new ArrayList<>(budget.size() + instructions.size());
        out.addAll(budget);
        out.addAll(instructions);
        return List.copyOf(out);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable Long priorityFee;
        private @Nullable Integer computeUnitLimit;
        private @Nullable Integer accountDataSizeLimit;

        private Builder() {
        }

        public Builder priorityFee(final long microLamports) {
            this.priorityFee = microLamports;
            return this;
        }

        public Builder computeUnitLimit(final int units) {
            this.computeUnitLimit = units;
            return this;
        }

        public Builder accountDataSizeLimit(final int bytes) {
            this.accountDataSizeLimit = bytes;
            return this;
        }

        public ComputeBudget build() {
            return new ComputeBudget(priorityFee, computeUnitLimit, accountDataSizeLimit);
        }
    }
}
