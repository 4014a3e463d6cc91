// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

/**
 * Hardforks in activation order.
 */
public enum SpecId {
    FRONTIER,
    FRONTIER_THAWING,
    HOMESTEAD,
    DAO_FORK,
    TANGERINE,
    SPURIOUS_DRAGON,
    BYZANTIUM,
    CONSTANTINOPLE,
    PETERSBURG,
    ISTANBUL,
    MUIR_GLACIER,
    BERLIN,
    LONDON,
    ARROW_GLACIER,
    GRAY_GLACIER,
    MERGE,
    SHANGHAI,
    CANCUN,
    PRAGUE;

    public boolean isEnabledIn(final SpecId other) {
        return compareTo(other) >= 0;
    }
}
