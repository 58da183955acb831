// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.error;

/**
 * Base runtime exception for all Keel failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * KeelException
 * ├── {@link RpcException} - JSON-RPC communication failures
 * └── {@link TxnException} - Transaction-specific failures
 *     ├── {@link TransactionBuildException} - building or signing failed (never retried)
 *     └── {@link TransactionSubmitException} - sending failed after the send-layer retries
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.buildAndSendTransaction(instructions, signer, budget);
 * } catch (TransactionBuildException e) {
 *     // Missing inputs, bad instruction data
 * } catch (RpcException e) {
 *     // Network/RPC error
 * } catch (KeelException e) {
 *     // Anything else raised by Keel
 * }
 * }</pre>
 */
public sealed class KeelException extends RuntimeException
        permits RpcException,
        TxnException {

    public KeelException(final String message) {
        super(message);
    }

    public KeelException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
