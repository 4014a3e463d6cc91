// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import sh.devnode.core.DebugLogger;

/**
 * Handle through which worker threads call a host handler and block for its result.
 *
 * <p>Does not own the {@link HostScheduler}; it becomes unusable once the scheduler
 * shuts down.
 *
 * @param <Q> request type
 * @param <R> response type
 */
public final class CallbackBridge<Q, R> {

    private final HostScheduler scheduler;
    private final String name;
    private final Function<Q, ? extends CompletionStage<R>> handler;

    CallbackBridge(final HostScheduler scheduler, final String name,
            final Function<Q, ? extends CompletionStage<R>> handler) {
        this.scheduler = scheduler;
        this.name = name;
        this.handler = handler;
    }

    /**
     * Sends {@code request} to the host and waits until the handler has produced a
     * response. Safe to call from any number of threads except the dispatch thread.
     *
     * @throws BridgeFault if the handler failed, the scheduler is shut down, or the
     *                     caller is the dispatch thread itself
     */
    public R invoke(final Q request) {
        if (scheduler.isDispatchThread()) {
            throw new BridgeFault("Bridge '" + name + "' invoked from the host dispatch thread");
        }
        long start = System.nanoTime();
        PendingCall<Q, R> call = new PendingCall<>(name, handler, request);
        scheduler.submit(call);
        try {
            R response = call.result.join();
            DebugLogger.logBridge("[BRIDGE] %s round trip %d us", name, (System.nanoTime() - start) / 1_000);
            return response;
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BridgeFault fault) {
                throw fault;
            }
            throw new BridgeFault("Bridge '" + name + "' failed", cause);
        }
    }

    public String name() {
        return name;
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }
}
