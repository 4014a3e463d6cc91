// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.HexData;

/**
 * Result of {@code eth_call}.
 */
public record CallResult(
        ExecutionResult executionResult,
        Trace trace,
        List<HexData> consoleLogInputs,
        @Nullable TransactionFailure failure) {

    public CallResult {
        Objects.requireNonNull(executionResult, "executionResult");
        Objects.requireNonNull(trace, "trace");
        consoleLogInputs = List.copyOf(Objects.requireNonNull(consoleLogInputs, "consoleLogInputs"));
    }
}
