// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.List;
import java.util.Objects;

import sh.devnode.core.types.HexData;

/**
 * Failed {@code eth_estimateGas}.
 */
public record EstimateGasFailure(List<HexData> consoleLogInputs, Trace trace, TransactionFailure failure) {

    public EstimateGasFailure {
        consoleLogInputs = List.copyOf(Objects.requireNonNull(consoleLogInputs, "consoleLogInputs"));
        Objects.requireNonNull(trace, "trace");
        Objects.requireNonNull(failure, "failure");
    }
}
