// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.devnode.core.error.LoggerException;
import sh.devnode.core.model.SpecId;
import sh.devnode.logger.ActivityLogger;

/**
 * Periodically mines a block on the worker thread and prints it.
 *
 * <p>Each tick waits for the previous block to be mined and printed, so ticks never pile
 * up behind a slow engine or host.
 */
final class IntervalMiner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IntervalMiner.class);

    private final ScheduledExecutorService timer;
    private final ExecutorService worker;
    private final ProviderEngine engine;
    private final ActivityLogger logger;
    private final SpecId specId;
    private ScheduledFuture<?> schedule;

    private IntervalMiner(final ExecutorService worker, final ProviderEngine engine, final ActivityLogger logger,
            final SpecId specId) {
        this.worker = worker;
        this.engine = engine;
        this.logger = logger;
        this.specId = specId;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "devnode-interval-miner");
            t.setDaemon(true);
            return t;
        });
    }

    static IntervalMiner start(final long periodMillis, final ExecutorService worker, final ProviderEngine engine,
            final ActivityLogger logger, final SpecId specId) {
        final IntervalMiner miner = new IntervalMiner(worker, engine, logger, specId);
        miner.schedule = miner.timer.scheduleWithFixedDelay(
                miner::tick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        return miner;
    }

    private void tick() {
        try {
            worker.submit(this::mineAndLog).get();
        } catch (RejectedExecutionException e) {
            log.debug("Worker stopped, skipping interval block");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Error) {
                log.error("Interval mining stopped by a fatal fault", e.getCause());
                throw (Error) e.getCause();
            }
            // Keep the schedule alive; the next tick tries again.
            if (e.getCause() instanceof LoggerException) {
                log.warn("Failed to print interval block: {}", e.getCause().getMessage());
            } else {
                log.error("Interval mining failed", e.getCause());
            }
        }
    }

    private void mineAndLog() {
        engine.mineIntervalBlock().ifPresent(result -> logger.logIntervalMined(specId, result));
    }

    /**
     * False once closed, or once a fatal fault has stopped the schedule.
     */
    boolean isRunning() {
        return !schedule.isDone();
    }

    @Override
    public void close() {
        schedule.cancel(false);
        timer.shutdownNow();
    }
}
