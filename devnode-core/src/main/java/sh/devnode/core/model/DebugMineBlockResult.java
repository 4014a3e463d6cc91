// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.List;
import java.util.Objects;

import sh.devnode.core.types.HexData;

/**
 * A mined block together with the raw {@code console.log} inputs captured while
 * executing it.
 */
public record DebugMineBlockResult(MinedBlock block, List<HexData> consoleLogInputs) {

    public DebugMineBlockResult {
        Objects.requireNonNull(block, "block");
        consoleLogInputs = List.copyOf(Objects.requireNonNull(consoleLogInputs, "consoleLogInputs"));
    }
}
