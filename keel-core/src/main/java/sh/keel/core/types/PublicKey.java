// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.types;

import java.util.Objects;

import sh.keel.primitives.Base58;

/**
 * Base58-encoded 32-byte account address.
 *
 * <p>
 * The textual value is normalized to its canonical Base58 form, so two keys
 * are equal exactly when their bytes are equal.
 */
public record PublicKey(String value) {

    /** Size of an Ed25519 public key in bytes. */
    public static final int LENGTH = 32;

    public PublicKey {
        Objects.requireNonNull(value, "publicKey");
        byte[] decoded;
        try {
            decoded = Base58.decode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid public key: " + value, e);
        }
        if (decoded.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Public key must decode to " + LENGTH + " bytes, got " + decoded.length + ": " + value);
        }
        value = Base58.encode(decoded);
    }

    public byte[] toBytes() {
        return Base58.decode(value);
    }

    public static PublicKey fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Public key must be exactly " + LENGTH + " bytes");
        }
        return new PublicKey(Base58.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
