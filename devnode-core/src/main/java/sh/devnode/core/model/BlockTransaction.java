// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A transaction included in a mined block, with its execution outcome.
 */
public record BlockTransaction(
        ExecutableTransaction transaction,
        ExecutionResult result,
        Trace trace,
        @Nullable TransactionFailure failure) {

    public BlockTransaction {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(trace, "trace");
    }
}
