// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.util.List;
import java.util.Objects;

import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Lamports;

/**
 * One submission of a bundle: every transaction is sent in the same relay call.
 *
 * @param transactions  signed transactions in identity order
 * @param tip           tip offered with this attempt
 * @param attemptNumber 1-based attempt counter
 */
public record BundleAttempt(List<Transaction> transactions, Lamports tip, int attemptNumber) {

    public BundleAttempt {
        transactions = List.copyOf(transactions);
        Objects.requireNonNull(tip, "tip");
        if (transactions.isEmpty()) {
            throw new IllegalArgumentException("A bundle attempt needs at least one transaction");
        }
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, got: " + attemptNumber);
        }
    }
}
