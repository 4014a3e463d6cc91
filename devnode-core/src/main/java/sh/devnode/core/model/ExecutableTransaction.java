// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.Address;
import sh.devnode.core.types.Hash;
import sh.devnode.core.types.Wei;

/**
 * The parts of a signed transaction the activity logger renders.
 *
 * @param to {@code null} for contract creation
 */
public record ExecutableTransaction(
        Hash hash,
        Address caller,
        @Nullable Address to,
        Wei value,
        long gasLimit) {

    public ExecutableTransaction {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(value, "value");
    }

    public boolean isCreate() {
        return to == null;
    }
}
