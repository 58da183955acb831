// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.error;

/**
 * Thrown when a transaction cannot be assembled or signed.
 *
 * <p>
 * Typical causes are missing price data in an instruction builder, an empty
 * instruction list, or a signer that is not the fee payer. Build failures are
 * deterministic and are propagated immediately without retry.
 */
public final class TransactionBuildException extends TxnException {

    public TransactionBuildException(final String message) {
        super(message);
    }

    public TransactionBuildException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
