// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.error;

/**
 * Thrown when a signed transaction could not be delivered to the network
 * after the send-layer retries were used up.
 *
 * <p>
 * The cause is the failure of the final attempt; earlier attempts are attached
 * as suppressed exceptions.
 */
public final class TransactionSubmitException extends TxnException {

    private final int attempts;

    public TransactionSubmitException(final String message, final int attempts, final Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Returns the number of send attempts made before giving up.
     */
    public int attempts() {
        return attempts;
    }
}
