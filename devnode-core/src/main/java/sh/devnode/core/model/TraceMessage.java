// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.Address;
import sh.devnode.core.types.HexData;

/**
 * One step of an execution trace.
 */
public sealed interface TraceMessage permits TraceMessage.Before, TraceMessage.After {

    /**
     * Emitted before a call frame starts.
     *
     * @param to   target, {@code null} for contract creation
     * @param data calldata, or init code for creation
     * @param code deployed code of {@code to}; {@code null} or empty for accounts without code
     */
    record Before(@Nullable Address to, HexData data, @Nullable HexData code) implements TraceMessage {
        public Before {
            Objects.requireNonNull(data, "data");
        }
    }

    /**
     * Emitted after a call frame completes.
     */
    record After(ExecutionResult executionResult) implements TraceMessage {
        public After {
            Objects.requireNonNull(executionResult, "executionResult");
        }
    }
}
