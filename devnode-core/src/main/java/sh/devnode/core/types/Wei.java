// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.types;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Represents a quantity in Wei (10^-18 Ether).
 *
 * <p><strong>Common Conversions:</strong>
 * <ul>
 * <li>1 Ether = 10^18 Wei</li>
 * <li>1 Gwei = 10^9 Wei</li>
 * </ul>
 *
 * <p>{@link #toHumanReadable()} picks the unit used in activity log lines.
 */
public record Wei(BigInteger value) {
    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    private static final BigInteger WEI_DISPLAY_LIMIT = BigInteger.valueOf(100_000L);
    private static final BigInteger GWEI_DISPLAY_LIMIT = BigInteger.TEN.pow(14);
    private static final int GWEI_DECIMALS = 9;
    private static final int ETHER_DECIMALS = 18;
    private static final int MAX_FRACTION_DIGITS = 4;

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(BigInteger.TEN.pow(GWEI_DECIMALS)));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    /**
     * Formats the amount for display.
     *
     * <ul>
     * <li>zero renders as {@code 0 ETH}</li>
     * <li>below 100000 as a plain integer of {@code wei}</li>
     * <li>below 10^14 as {@code gwei}</li>
     * <li>anything larger as {@code ETH}</li>
     * </ul>
     *
     * <p>Gwei and ETH amounts keep at most four fractional digits, truncated, with
     * trailing zeros removed; {@code 2 ETH} rather than {@code 2.0000 ETH}.
     */
    public String toHumanReadable() {
        if (value.signum() == 0) {
            return "0 ETH";
        }
        if (value.compareTo(WEI_DISPLAY_LIMIT) < 0) {
            return value + " wei";
        }
        if (value.compareTo(GWEI_DISPLAY_LIMIT) < 0) {
            return toDecimalString(GWEI_DECIMALS) + " gwei";
        }
        return toDecimalString(ETHER_DECIMALS) + " ETH";
    }

    private String toDecimalString(final int decimals) {
        final BigInteger[] parts = value.divideAndRemainder(BigInteger.TEN.pow(decimals));
        final BigInteger fraction = parts[1].divide(BigInteger.TEN.pow(decimals - MAX_FRACTION_DIGITS));

        final StringBuilder digits = new StringBuilder(fraction.toString());
        while (digits.length() < MAX_FRACTION_DIGITS) {
            digits.insert(0, '0');
        }
        int end = digits.length();
        while (end > 0 && digits.charAt(end - 1) == '0') {
            end--;
        }
        if (end == 0) {
            return parts[0].toString();
        }
        return parts[0] + "." + digits.substring(0, end);
    }

    @JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
