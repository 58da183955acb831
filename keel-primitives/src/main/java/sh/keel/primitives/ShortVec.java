// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.primitives;

/**
 * Compact-u16 length prefix used by the Solana wire format.
 *
 * <p>
 * Values are written seven bits at a time, least significant group first, with
 * the high bit of each byte set when another byte follows. Any value in
 * {@code [0, 65535]} fits in at most three bytes.
 */
public final class ShortVec {

    /** Largest value representable by the encoding. */
    public static final int MAX_VALUE = 0xFFFF;

    private ShortVec() {
        // Utility class
    }

    /**
     * Encode a length as compact-u16 bytes.
     *
     * @param value the value to encode
     * @return one to three encoded bytes
     * @throws IllegalArgumentException if {@code value} is negative or above {@link #MAX_VALUE}
     */
    public static byte[] encodeLength(final int value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("compact-u16 value out of range: " + value);
        }
        final byte[] scratch = new byte[3];
        int remaining = value;
        int size = 0;
        while (true) {
            int element = remaining & 0x7F;
            remaining >>>= 7;
            if (remaining == 0) {
                scratch[size++] = (byte) element;
                break;
            }
            element |= 0x80;
            scratch[size++] = (byte) element;
        }
        final byte[] out = new byte[size];
        System.arraycopy(scratch, 0, out, 0, size);
        return out;
    }

    /**
     * Decode a compact-u16 value starting at {@code offset}.
     *
     * @param bytes  the source bytes
     * @param offset where the encoded value starts
     * @return the decoded value and the number of bytes consumed
     * @throws IllegalArgumentException if the encoding is truncated or exceeds three bytes
     */
    public static Decoded decodeLength(final byte[] bytes, final int offset) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        int value = 0;
        int size = 0;
        while (true) {
            if (size == 3) {
                throw new IllegalArgumentException("compact-u16 encoding longer than 3 bytes");
            }
            if (offset + size >= bytes.length) {
                throw new IllegalArgumentException("Truncated compact-u16 at offset " + offset);
            }
            final int element = bytes[offset + size] & 0xFF;
            value |= (element & 0x7F) << (size * 7);
            size++;
            if ((element & 0x80) == 0) {
                break;
            }
        }
        if (value > MAX_VALUE) {
            throw new IllegalArgumentException("compact-u16 value out of range: " + value);
        }
        return new Decoded(value, size);
    }

    /**
     * A decoded compact-u16 value.
     *
     * @param value  the decoded value
     * @param length the number of bytes the encoding occupied
     */
    public record Decoded(int value, int length) {}
}
