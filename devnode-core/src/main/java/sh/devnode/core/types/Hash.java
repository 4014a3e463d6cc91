// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.types;

import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.devnode.primitives.Hex;

/**
 * 32-byte Keccak-256 hash of a block or transaction, stored as lowercase hex.
 *
 * @since 0.1.0
 */
public record Hash(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexStrings.fixedLength(BYTE_LENGTH);

    public Hash {
        value = HexStrings.requireMatch(value, HEX, "hash");
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
