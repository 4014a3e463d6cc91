// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation shared by the fixed-width hex value types.
 */
final class HexStrings {
    private HexStrings() {}

    static Pattern fixedLength(final int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }

    /**
     * Validates {@code value} against {@code pattern} and lowercases it.
     */
    static String requireMatch(final String value, final Pattern pattern, final String kind) {
        Objects.requireNonNull(value, kind);
        if (!pattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + kind + ": " + value);
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
