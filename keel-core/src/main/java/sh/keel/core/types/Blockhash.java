// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.types;

import java.util.Objects;

import sh.keel.primitives.Base58;

/**
 * Base58-encoded 32-byte recent blockhash.
 *
 * <p>
 * A transaction is only valid while its blockhash is recent, so values are
 * short-lived and refreshed periodically.
 */
public record Blockhash(String value) {

    public Blockhash {
        Objects.requireNonNull(value, "blockhash");
        byte[] decoded;
        try {
            decoded = Base58.decode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid blockhash: " + value, e);
        }
        if (decoded.length != 32) {
            throw new IllegalArgumentException("Blockhash must decode to 32 bytes: " + value);
        }
        value = Base58.encode(decoded);
    }

    public byte[] toBytes() {
        return Base58.decode(value);
    }

    public static Blockhash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != 32) {
            throw new IllegalArgumentException("Blockhash must be exactly 32 bytes");
        }
        return new Blockhash(Base58.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
