// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.devnode.primitives.Hex;

/**
 * Immutable arbitrary-length byte payload: bytecode, calldata, return data and
 * encoded {@code console.log} arguments.
 *
 * <p>Instances created from bytes keep the bytes and render the hex string lazily;
 * instances created from a string validate it eagerly. Equality is by content.
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private volatile String value;

    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
        this.value = value.toLowerCase(java.util.Locale.ROOT);
    }

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @JsonValue
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof HexData other && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[" + value() + ']';
    }
}
