// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.devnode.bridge.HostScheduler;
import sh.devnode.core.error.LoggerException;
import sh.devnode.core.error.ProviderException;
import sh.devnode.core.model.CallResult;
import sh.devnode.core.model.DebugMineBlockResult;
import sh.devnode.core.model.EstimateGasFailure;
import sh.devnode.core.model.ExecutableTransaction;
import sh.devnode.core.model.SpecId;

/**
 * Renders node activity as a human-readable narrative on the host.
 *
 * <p>Engine operations feed their results in through the {@code log*} methods, which
 * buffer lines; {@link #printMethodLogs} prints the method name and flushes the buffer
 * once the JSON-RPC request completes. Interval mining prints directly.
 *
 * <p>An instance is driven by a single worker thread and is not thread-safe. Every
 * line reaches the host through a blocking bridge call.
 *
 * <p>All operations throw {@link LoggerException} if the host fails to print a line.
 * The render in progress is abandoned; the logger stays usable.
 */
public interface ActivityLogger {

    static ActivityLogger create(final LoggerConfig config, final HostScheduler scheduler) {
        return new DefaultActivityLogger(config, scheduler);
    }

    boolean isEnabled();

    void setEnabled(boolean enabled);

    /**
     * Buffers the outcome of {@code eth_call}.
     */
    void logCall(SpecId specId, ExecutableTransaction transaction, CallResult result);

    /**
     * Buffers a failed {@code eth_estimateGas}.
     */
    void logEstimateGasFailure(SpecId specId, ExecutableTransaction transaction, EstimateGasFailure failure);

    /**
     * Prints a block mined by the interval timer.
     */
    void logIntervalMined(SpecId specId, DebugMineBlockResult result);

    /**
     * Buffers blocks mined by an explicit mining request, coalescing runs of empty blocks.
     */
    void logMinedBlock(SpecId specId, List<DebugMineBlockResult> results);

    /**
     * Buffers the blocks auto-mined to include a sent transaction.
     *
     * @throws IllegalStateException if no result contains {@code transaction}
     */
    void logSendTransaction(SpecId specId, ExecutableTransaction transaction, List<DebugMineBlockResult> results);

    /**
     * Prints {@code method}, collapsing repeats, and flushes buffered lines.
     *
     * @param error the method's failure, or {@code null} if it succeeded
     */
    void printMethodLogs(String method, @Nullable ProviderException error);
}
