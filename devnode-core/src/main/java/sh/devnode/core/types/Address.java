// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.types;

import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.devnode.primitives.Hex;

/**
 * 20-byte account address, stored as lowercase {@code 0x}-prefixed hex.
 *
 * <p>{@link #toString()} returns the hex form so addresses can be concatenated
 * directly into rendered log lines.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexStrings.fixedLength(BYTE_LENGTH);

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        value = HexStrings.requireMatch(value, HEX, "address");
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    /**
     * Address whose last two bytes encode {@code index} and all other bytes are zero,
     * the layout used by precompiled contracts.
     */
    public static Address ofLowBytes(final int index) {
        if (index < 0 || index > 0xFFFF) {
            throw new IllegalArgumentException("index must fit in two bytes: " + index);
        }
        final byte[] bytes = new byte[BYTE_LENGTH];
        bytes[BYTE_LENGTH - 2] = (byte) (index >>> 8);
        bytes[BYTE_LENGTH - 1] = (byte) index;
        return fromBytes(bytes);
    }

    @Override
    public String toString() {
        return value;
    }
}
