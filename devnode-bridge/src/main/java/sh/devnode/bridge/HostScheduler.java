// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Function;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.LiteBlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.devnode.core.DebugLogger;

/**
 * The host's single logical executor: one daemon thread draining one mailbox.
 *
 * <p>Worker threads reach the host through {@link CallbackBridge}s created by
 * {@link #register}. Every bridge call is published to an LMAX Disruptor ring buffer
 * (multi-producer, single consumer), so host handlers never run concurrently and
 * calls made from one thread are handled in the order they were made.
 *
 * <h2>Lifecycle</h2>
 * <p>The dispatch thread is a daemon; neither the scheduler nor its registrations
 * keep the JVM alive. {@link #shutdown()} fails every call still waiting for a
 * response, and every later call, with a {@link BridgeFault}.
 *
 * <h2>Threading</h2>
 * <pre>
 *   worker-1 ──┐
 *   worker-2 ──┼──▶ [ring buffer] ──▶ devnode-host ──▶ handler
 *   worker-N ──┘         ▲                                │
 *        ▲               └───── one-shot future ◀─────────┘
 *        └── join()
 * </pre>
 */
public final class HostScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HostScheduler.class);

    private static final long MAILBOX_FULL_BACKOFF_NANOS = 50_000L;

    private final HostSchedulerConfig config;
    private final Disruptor<CallEvent> disruptor;
    private final RingBuffer<CallEvent> ringBuffer;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<PendingCall<?, ?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile Thread dispatchThread;

    private HostScheduler(final HostSchedulerConfig config) {
        this.config = config;

        WaitStrategy waitStrategy = switch (config.waitStrategy()) {
            case BUSY_SPIN -> new BusySpinWaitStrategy();
            case YIELDING -> new YieldingWaitStrategy();
            case LITE_BLOCKING -> new LiteBlockingWaitStrategy();
            case BLOCKING -> new BlockingWaitStrategy();
        };

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, config.threadName());
            t.setDaemon(true);
            dispatchThread = t;
            return t;
        };

        this.disruptor = new Disruptor<>(
                CallEvent::new,
                config.ringBufferSize(),
                threadFactory,
                ProducerType.MULTI,
                waitStrategy);

        this.disruptor.handleEventsWith(this::handleEvent);
        this.disruptor.start();
        this.ringBuffer = disruptor.getRingBuffer();
    }

    public static HostScheduler start(final HostSchedulerConfig config) {
        Objects.requireNonNull(config, "config");
        HostScheduler scheduler = new HostScheduler(config);
        log.debug("Host scheduler started on thread '{}' (ringBufferSize={}, waitStrategy={})",
                config.threadName(), config.ringBufferSize(), config.waitStrategy());
        return scheduler;
    }

    public static HostScheduler start() {
        return start(HostSchedulerConfig.defaults());
    }

    /**
     * Registers a synchronous host handler.
     *
     * @param name    label used in logs and faults
     * @param handler runs on the dispatch thread; throwing is a {@link BridgeFault}
     */
    public <Q, R> CallbackBridge<Q, R> register(final String name, final Function<Q, R> handler) {
        Objects.requireNonNull(handler, "handler");
        return registerAsync(name, request -> CompletableFuture.completedFuture(handler.apply(request)));
    }

    /**
     * Registers an asynchronous host handler. The handler starts on the dispatch
     * thread; its stage may complete on any thread and the calling worker stays
     * blocked until it does.
     */
    public <Q, R> CallbackBridge<Q, R> registerAsync(
            final String name, final Function<Q, ? extends CompletionStage<R>> handler) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        if (closed.get()) {
            throw new BridgeFault("Cannot register bridge '" + name + "' after host scheduler shutdown");
        }
        log.debug("Registered bridge '{}' on '{}'", name, config.threadName());
        return new CallbackBridge<>(this, name, handler);
    }

    public boolean isShutdown() {
        return closed.get();
    }

    boolean isDispatchThread() {
        return Thread.currentThread() == dispatchThread;
    }

    void submit(final PendingCall<?, ?> call) {
        if (closed.get()) {
            throw new BridgeFault("Bridge invoked after host scheduler shutdown");
        }
        inFlight.add(call);
        call.result.whenComplete((r, t) -> inFlight.remove(call));
        // shutdown() may have drained inFlight between the first check and add()
        if (closed.get()) {
            call.abort(new BridgeFault("Bridge invoked after host scheduler shutdown"));
            return;
        }

        long sequence;
        while (true) {
            try {
                sequence = ringBuffer.tryNext();
                break;
            } catch (InsufficientCapacityException e) {
                // The halted consumer never frees a slot, so a full mailbox must not block shutdown.
                if (closed.get()) {
                    call.abort(new BridgeFault("Host scheduler shut down while waiting for mailbox space"));
                    return;
                }
                LockSupport.parkNanos(MAILBOX_FULL_BACKOFF_NANOS);
            }
        }
        try {
            CallEvent event = ringBuffer.get(sequence);
            event.call = call;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void handleEvent(final CallEvent event, final long sequence, final boolean endOfBatch) {
        PendingCall<?, ?> call = event.call;
        event.call = null;
        if (call != null) {
            call.dispatch();
        }
    }

    /**
     * Stops the dispatch thread. Calls still waiting for a response fail with a
     * {@link BridgeFault}, as does every later {@link CallbackBridge#invoke}.
     * Idempotent.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int pending = inFlight.size();
        BridgeFault fault = new BridgeFault("Host scheduler shut down before the call completed");
        for (PendingCall<?, ?> call : inFlight) {
            call.abort(fault);
        }
        inFlight.clear();

        try {
            disruptor.halt();
        } catch (Exception e) {
            log.warn("Error halting host dispatch thread", e);
        }
        log.debug("Host scheduler '{}' shut down, {} pending call(s) failed", config.threadName(), pending);
        DebugLogger.logBridge("[BRIDGE] scheduler %s shut down", config.threadName());
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Pre-allocated ring buffer slot.
     */
    static final class CallEvent {
        PendingCall<?, ?> call;
    }
}
