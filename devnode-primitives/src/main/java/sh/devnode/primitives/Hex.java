// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding for addresses, hashes, bytecode and calldata.
 *
 * <p>Encoding always produces lowercase digits. Decoding accepts an optional
 * {@code 0x}/{@code 0X} prefix and mixed case.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes; empty for {@code "0x"}
     * @throws IllegalArgumentException if the input is null, has an odd number of digits
     *                                  or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        final int digits = hexString.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] result = new byte[digits / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = nibble(hexString, start + i * 2);
            final int low = nibble(hexString, start + i * 2 + 1);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encodes bytes as a {@code 0x}-prefixed lowercase hex string.
     *
     * @param bytes the bytes to encode
     * @return the hex string, {@code "0x"} for an empty array
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[2 + bytes.length * 2];
        chars[0] = '0';
        chars[1] = 'x';
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[2 + i * 2] = DIGITS[v >>> 4];
            chars[2 + i * 2 + 1] = DIGITS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} when the string starts with {@code 0x} or {@code 0X}.
     *
     * @param hexString the string to check, may be null
     * @return whether the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int nibble(final String input, final int index) {
        final char c = input.charAt(index);
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("invalid hex character '" + c + "' in: " + input);
        }
        return NIBBLES[c];
    }
}
