// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.primitives;

/**
 * Little-endian integer packing for instruction data and account layouts.
 */
public final class LittleEndian {

    private LittleEndian() {
        // Utility class
    }

    /**
     * Writes the low 32 bits of {@code value} into {@code target} at {@code offset}.
     */
    public static void putU32(final byte[] target, final int offset, final long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("u32 value out of range: " + value);
        }
        for (int i = 0; i < 4; i++) {
            target[offset + i] = (byte) (value >>> (8 * i));
        }
    }

    /**
     * Writes {@code value} as an unsigned 64-bit integer into {@code target} at {@code offset}.
     */
    public static void putU64(final byte[] target, final int offset, final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("u64 value must be non-negative: " + value);
        }
        for (int i = 0; i < 8; i++) {
            target[offset + i] = (byte) (value >>> (8 * i));
        }
    }

    /**
     * Reads an unsigned 64-bit integer at {@code offset}.
     *
     * @throws IllegalArgumentException if fewer than eight bytes remain or the value exceeds {@link Long#MAX_VALUE}
     */
    public static long getU64(final byte[] source, final int offset) {
        if (source == null || offset < 0 || offset + 8 > source.length) {
            throw new IllegalArgumentException("Need 8 bytes at offset " + offset);
        }
        long value = 0L;
        for (int i = 7; i >= 0; i--) {
            value = (value << 8) | (source[offset + i] & 0xFFL);
        }
        if (value < 0) {
            throw new IllegalArgumentException("u64 value exceeds signed 64-bit range");
        }
        return value;
    }
}
