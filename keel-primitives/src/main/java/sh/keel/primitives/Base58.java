// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.primitives;

import java.util.Arrays;

/**
 * Utility methods for Base58 encoding/decoding using the Bitcoin alphabet.
 *
 * <p>
 * Base58 is the textual form of public keys, blockhashes and transaction
 * signatures on Solana. Leading zero bytes map to leading {@code '1'}
 * characters and vice versa.
 */
public final class Base58 {
    private static final char[] ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final int[] DIGIT_LOOKUP = new int[128];

    static {
        Arrays.fill(DIGIT_LOOKUP, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            DIGIT_LOOKUP[ALPHABET[i]] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Convert a byte array into a Base58 string.
     *
     * @param bytes the bytes to encode
     * @return the Base58 string (empty for empty input)
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        if (bytes.length == 0) {
            return "";
        }

        int zeros = 0;
        while (zeros < bytes.length && bytes[zeros] == 0) {
            zeros++;
        }

        // base-256 to base-58 long division over a scratch copy
        final byte[] input = Arrays.copyOf(bytes, bytes.length);
        final char[] encoded = new char[input.length * 2];
        int outputStart = encoded.length;
        int inputStart = zeros;
        while (inputStart < input.length) {
            encoded[--outputStart] = ALPHABET[divmod(input, inputStart, 256, 58)];
            if (input[inputStart] == 0) {
                inputStart++;
            }
        }

        while (outputStart < encoded.length && encoded[outputStart] == ALPHABET[0]) {
            outputStart++;
        }
        while (--zeros >= 0) {
            encoded[--outputStart] = ALPHABET[0];
        }
        return new String(encoded, outputStart, encoded.length - outputStart);
    }

    /**
     * Convert a Base58 string into a byte array.
     *
     * @param input the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null or contains characters outside the alphabet
     */
    public static byte[] decode(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("Base58 string cannot be null");
        }
        if (input.isEmpty()) {
            return new byte[0];
        }

        final byte[] input58 = new byte[input.length()];
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            final int digit = c < 128 ? DIGIT_LOOKUP[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid Base58 character '" + c + "' at position " + i);
            }
            input58[i] = (byte) digit;
        }

        int zeros = 0;
        while (zeros < input58.length && input58[zeros] == 0) {
            zeros++;
        }

        final byte[] decoded = new byte[input.length()];
        int outputStart = decoded.length;
        int inputStart = zeros;
        while (inputStart < input58.length) {
            decoded[--outputStart] = divmod(input58, inputStart, 58, 256);
            if (input58[inputStart] == 0) {
                inputStart++;
            }
        }

        while (outputStart < decoded.length && decoded[outputStart] == 0) {
            outputStart++;
        }
        return Arrays.copyOfRange(decoded, outputStart - zeros, decoded.length);
    }

    /**
     * Returns {@code true} if every character of the input belongs to the Base58 alphabet.
     *
     * @param input the string to check
     * @return {@code true} when the string is non-null and decodable
     */
    public static boolean isValid(final String input) {
        if (input == null) {
            return false;
        }
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (c >= 128 || DIGIT_LOOKUP[c] < 0) {
                return false;
            }
        }
        return true;
    }

    private static byte divmod(final byte[] number, final int firstDigit, final int base, final int divisor) {
        int remainder = 0;
        for (int i = firstDigit; i < number.length; i++) {
            final int digit = number[i] & 0xFF;
            final int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return (byte) remainder;
    }
}
