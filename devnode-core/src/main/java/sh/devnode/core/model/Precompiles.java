// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import sh.devnode.core.types.Address;

/**
 * Precompiled contract addresses active per hardfork.
 *
 * <p>Precompiles occupy the addresses {@code 0x01} upward, with all bytes but the
 * last two zero.
 */
public final class Precompiles {
    private static final int PREFIX_LENGTH = Address.BYTE_LENGTH - 2;

    private Precompiles() {}

    /**
     * Highest precompile index active in {@code specId}.
     */
    public static int highestIndex(final SpecId specId) {
        if (specId.isEnabledIn(SpecId.PRAGUE)) {
            return 0x11;
        }
        if (specId.isEnabledIn(SpecId.CANCUN)) {
            return 0x0a;
        }
        if (specId.isEnabledIn(SpecId.ISTANBUL)) {
            return 0x09;
        }
        if (specId.isEnabledIn(SpecId.BYZANTIUM)) {
            return 0x08;
        }
        return 0x04;
    }

    public static boolean isPrecompile(final SpecId specId, final Address address) {
        final byte[] bytes = address.toBytes();
        for (int i = 0; i < PREFIX_LENGTH; i++) {
            if (bytes[i] != 0) {
                return false;
            }
        }
        final int index = lowBytes(address);
        return index >= 1 && index <= highestIndex(specId);
    }

    /**
     * The number formed by the two lowest address bytes, big-endian.
     */
    public static int lowBytes(final Address address) {
        final byte[] bytes = address.toBytes();
        return ((bytes[PREFIX_LENGTH] & 0xff) << 8) | (bytes[PREFIX_LENGTH + 1] & 0xff);
    }
}
