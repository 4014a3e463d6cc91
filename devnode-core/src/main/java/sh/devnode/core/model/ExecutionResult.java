// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import sh.devnode.core.types.HexData;

/**
 * Outcome of executing a transaction or call.
 */
public sealed interface ExecutionResult
        permits ExecutionResult.Success, ExecutionResult.Revert, ExecutionResult.Halt {

    long gasUsed();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success(long gasUsed, Output output) implements ExecutionResult {
        public Success {
            Objects.requireNonNull(output, "output");
        }
    }

    record Revert(long gasUsed, HexData output) implements ExecutionResult {
        public Revert {
            Objects.requireNonNull(output, "output");
        }
    }

    record Halt(long gasUsed, HaltReason reason) implements ExecutionResult {
        public Halt {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
