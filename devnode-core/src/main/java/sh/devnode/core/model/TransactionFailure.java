// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.Hash;

/**
 * Pre-formatted failure of a transaction or call.
 *
 * @param message         rendered error text, produced by the engine's stack-trace decoder
 * @param revert          {@code true} for a revert, {@code false} for a halt
 * @param transactionHash hash of the failed transaction, absent for calls
 */
public record TransactionFailure(String message, boolean revert, @Nullable Hash transactionHash) {

    public TransactionFailure {
        Objects.requireNonNull(message, "message");
    }
}
