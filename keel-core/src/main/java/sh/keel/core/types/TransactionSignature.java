// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.types;

import java.util.Objects;

import sh.keel.primitives.Base58;

/**
 * Base58-encoded 64-byte Ed25519 signature identifying a transaction.
 */
public record TransactionSignature(String value) {

    public TransactionSignature {
        Objects.requireNonNull(value, "signature");
        if (!Base58.isValid(value) || Base58.decode(value).length != 64) {
            throw new IllegalArgumentException("Invalid transaction signature: " + value);
        }
    }

    public static TransactionSignature fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != 64) {
            throw new IllegalArgumentException("Signature must be exactly 64 bytes");
        }
        return new TransactionSignature(Base58.encode(bytes));
    }

    public byte[] toBytes() {
        return Base58.decode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
