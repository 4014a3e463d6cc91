// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.Hash;
import sh.devnode.core.types.Wei;

/**
 * Header fields of a mined block that the activity log and {@code newHeads}
 * subscriptions need.
 *
 * @param baseFeePerGas absent before London
 */
public record BlockHeader(
        Hash hash,
        long number,
        Hash parentHash,
        long timestamp,
        @Nullable Wei baseFeePerGas) {

    public BlockHeader {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(parentHash, "parentHash");
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative");
        }
    }
}
