// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.devnode.bridge.HostScheduler;
import sh.devnode.core.error.ProviderException;
import sh.devnode.core.model.CallResult;
import sh.devnode.core.model.DebugMineBlockResult;
import sh.devnode.core.model.EstimateGasFailure;
import sh.devnode.core.model.ExecutableTransaction;
import sh.devnode.core.model.SpecId;

/**
 * {@link ActivityLogger} that renders through the host callbacks of a
 * {@link LoggerConfig}, each registered as its own bridge on the given scheduler.
 */
public final class DefaultActivityLogger implements ActivityLogger {

    private static final Logger log = LoggerFactory.getLogger(DefaultActivityLogger.class);

    private final LogCollector collector;

    public DefaultActivityLogger(final LoggerConfig config, final HostScheduler scheduler) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(scheduler, "scheduler");
        this.collector = new LogCollector(
                config.enabled(),
                config.colors(),
                scheduler.register("console-log-decoder", config.decoder()::decode),
                scheduler.register("contract-name-resolver",
                        (HostRequests.Resolve request) -> config.resolver().resolve(request.code(), request.calldata())),
                scheduler.register("line-printer",
                        (HostRequests.Print request) -> config.printer().printLine(request.message(), request.replace())));
        log.debug("Activity logger created (enabled={}, colors={})", config.enabled(), config.colors());
    }

    @Override
    public boolean isEnabled() {
        return collector.isEnabled();
    }

    @Override
    public void setEnabled(final boolean enabled) {
        collector.setEnabled(enabled);
    }

    @Override
    public void logCall(final SpecId specId, final ExecutableTransaction transaction, final CallResult result) {
        collector.logCall(specId, transaction, result);
    }

    @Override
    public void logEstimateGasFailure(final SpecId specId, final ExecutableTransaction transaction,
            final EstimateGasFailure failure) {
        collector.logEstimateGasFailure(specId, transaction, failure);
    }

    @Override
    public void logIntervalMined(final SpecId specId, final DebugMineBlockResult result) {
        collector.logIntervalMined(specId, result);
    }

    @Override
    public void logMinedBlock(final SpecId specId, final List<DebugMineBlockResult> results) {
        collector.logMinedBlock(specId, results);
    }

    @Override
    public void logSendTransaction(final SpecId specId, final ExecutableTransaction transaction,
            final List<DebugMineBlockResult> results) {
        collector.logSendTransaction(specId, transaction, results);
    }

    @Override
    public void printMethodLogs(final String method, final @Nullable ProviderException error) {
        collector.printMethodLogs(method, error);
    }

    LoggingState state() {
        return collector.state();
    }

    List<LogLine> bufferedLines() {
        return collector.bufferedLines();
    }
}
