// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import org.jspecify.annotations.Nullable;

/**
 * What the logger is in the middle of. Exactly one state is active; entering one
 * replaces the previous.
 */
sealed interface LoggingState {

    LoggingState EMPTY = new Empty();

    record Empty() implements LoggingState {}

    /**
     * The same method was printed {@code count} times in a row on one line.
     */
    record CollapsingMethod(String method, int count) implements LoggingState {}

    /**
     * Empty blocks mined by a mining request, coalesced into one buffered line.
     */
    record HardhatMining(@Nullable Long emptyBlocksRangeStart) implements LoggingState {}

    /**
     * Empty blocks mined by the interval timer, coalesced into one printed line.
     */
    record IntervalMining(@Nullable Long emptyBlocksRangeStart) implements LoggingState {}
}
