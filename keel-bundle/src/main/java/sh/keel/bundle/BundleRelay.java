// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.util.List;

import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Lamports;

/**
 * Submits a set of signed transactions as one all-or-nothing bundle.
 *
 * <p>
 * The relay guarantees atomicity; callers only see accept or reject. Implementations
 * report rejection through {@link RelaySubmission#rejected(String)} rather than
 * throwing.
 */
@FunctionalInterface
public interface BundleRelay {

    /**
     * @param transactions signed transactions in execution order
     * @param tip          incentive offered to the relay for inclusion
     */
    RelaySubmission submit(List<Transaction> transactions, Lamports tip);
}
