// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.error;

/**
 * Base class for transaction-related failures (building, signing, sending).
 */
public non-sealed class TxnException extends KeelException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
