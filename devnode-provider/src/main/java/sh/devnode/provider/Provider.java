// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.devnode.bridge.HostScheduler;
import sh.devnode.bridge.override.CallOverrideCallback;
import sh.devnode.bridge.override.CallOverrideDispatcher;
import sh.devnode.bridge.subscription.SubscriptionCallback;
import sh.devnode.bridge.subscription.SubscriptionDispatcher;
import sh.devnode.core.DebugLogger;
import sh.devnode.core.error.LoggerException;
import sh.devnode.core.error.ProviderException;
import sh.devnode.logger.ActivityLogger;
import sh.devnode.logger.LoggerConfig;

/**
 * A JSON-RPC endpoint in front of a blocking execution engine.
 *
 * <p>Each provider owns its activity logger, subscription dispatcher and call override,
 * all bound to the host scheduler passed to {@link #create}. Every engine operation runs
 * on one worker thread, so the logger only ever sees a single writer.
 *
 * <pre>{@code
 * HostScheduler scheduler = HostScheduler.start();
 * Provider provider = Provider.create(ProviderConfig.defaults(), LoggerConfig.builder().build(),
 *         event -> System.out.println(event), scheduler, MyEngine::new);
 * provider.handleRequest("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_chainId\"}")
 *         .thenAccept(System.out::println);
 * }</pre>
 */
public final class Provider implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Provider.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    private final ProviderConfig config;
    private final HostScheduler scheduler;
    private final ActivityLogger logger;
    private final ExecutorService worker;
    private final ProviderEngine engine;
    private final ResponseSerializer serializer;
    private final @Nullable ScenarioRecorder scenario;
    private final @Nullable IntervalMiner intervalMiner;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile @Nullable CallOverrideDispatcher callOverride;

    private Provider(final ProviderConfig config, final LoggerConfig loggerConfig,
            final SubscriptionCallback subscriptionCallback, final HostScheduler scheduler,
            final EngineFactory engineFactory, final Function<String, String> environment) {
        this.config = config;
        this.scheduler = scheduler;
        this.logger = ActivityLogger.create(loggerConfig, scheduler);
        this.serializer = new ResponseSerializer(MAPPER, config.maxResponseLength());

        final EngineContext context = new EngineContext(logger,
                new SubscriptionDispatcher(scheduler, subscriptionCallback),
                () -> Optional.ofNullable(callOverride));
        this.engine = engineFactory.create(config, context);

        final ScenarioRecorder recorder;
        try {
            recorder = ScenarioRecorder.fromEnvironment(environment, MAPPER, config, loggerConfig.enabled())
                    .orElse(null);
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }
        this.scenario = recorder;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "devnode-worker");
            t.setDaemon(true);
            return t;
        });

        this.intervalMiner = config.isIntervalMiningEnabled()
                ? IntervalMiner.start(config.intervalMiningMillis(), worker, engine, logger, config.hardfork())
                : null;
        log.debug("Provider created: chainId={}, hardfork={}", config.chainId(), config.hardfork());
    }

    /**
     * Creates a provider bound to {@code scheduler}. Scenario recording is enabled when
     * the {@code DEVNODE_SCENARIO_PREFIX} environment variable is set.
     *
     * @throws sh.devnode.core.error.ScenarioException if the scenario file cannot be created
     */
    public static Provider create(final ProviderConfig config, final LoggerConfig loggerConfig,
            final SubscriptionCallback subscriptionCallback, final HostScheduler scheduler,
            final EngineFactory engineFactory) {
        return create(config, loggerConfig, subscriptionCallback, scheduler, engineFactory, System::getenv);
    }

    static Provider create(final ProviderConfig config, final LoggerConfig loggerConfig,
            final SubscriptionCallback subscriptionCallback, final HostScheduler scheduler,
            final EngineFactory engineFactory, final Function<String, String> environment) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(loggerConfig, "loggerConfig");
        Objects.requireNonNull(subscriptionCallback, "subscriptionCallback");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(engineFactory, "engineFactory");
        return new Provider(config, loggerConfig, subscriptionCallback, scheduler, engineFactory, environment);
    }

    public ProviderConfig config() {
        return config;
    }

    boolean isIntervalMining() {
        return intervalMiner != null && intervalMiner.isRunning();
    }

    /**
     * Handles one JSON-RPC request on the worker thread.
     *
     * <p>Method failures complete the future normally with an error response. The future
     * completes exceptionally only if the request could not be recorded to the scenario
     * file, or on a fatal fault.
     */
    public CompletableFuture<ProviderResponse> handleRequest(final String json) {
        Objects.requireNonNull(json, "json");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Provider is closed"));
        }
        return CompletableFuture.supplyAsync(() -> handle(json), worker);
    }

    /**
     * Installs the host's call override, or removes it when {@code callback} is null.
     */
    public void setCallOverrideCallback(final @Nullable CallOverrideCallback callback) {
        this.callOverride = callback == null ? null : new CallOverrideDispatcher(scheduler, callback);
    }

    private ProviderResponse handle(final String json) {
        final JsonNode raw;
        try {
            raw = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return serializer.serialize(JsonRpcResponse.failure(null,
                    new JsonRpcError(ProviderException.PARSE_ERROR, "Parse error: " + e.getOriginalMessage(), null)));
        }
        if (raw == null || !raw.isObject()) {
            return serializer.serialize(JsonRpcResponse.failure(null,
                    new JsonRpcError(ProviderException.PARSE_ERROR, "Parse error: expected a JSON object", null)));
        }
        if (scenario != null) {
            scenario.record(raw);
        }

        final JsonRpcRequest request;
        try {
            request = MAPPER.treeToValue(raw, JsonRpcRequest.class);
        } catch (JsonProcessingException e) {
            return serializer.serialize(JsonRpcResponse.failure(raw.get("id"),
                    new JsonRpcError(ProviderException.INVALID_INPUT, "Invalid request: " + e.getOriginalMessage(),
                            null)));
        }
        if (request.method() == null) {
            return serializer.serialize(JsonRpcResponse.failure(request.id(),
                    new JsonRpcError(ProviderException.INVALID_INPUT, "Invalid request: missing method", null)));
        }

        DebugLogger.logRequest("[REQUEST] %s", json);
        final long start = System.nanoTime();
        JsonRpcResponse response = dispatch(request);
        final long micros = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start);
        DebugLogger.logRequest("[RESPONSE] method=%s durationMicros=%d error=%s",
                request.method(), micros, response.hasError());
        return serializer.serialize(response);
    }

    private JsonRpcResponse dispatch(final JsonRpcRequest request) {
        ProviderException error = null;
        JsonRpcResponse response;
        try {
            response = JsonRpcResponse.success(request.id(), engine.handle(request));
        } catch (ProviderException e) {
            error = e;
            response = JsonRpcResponse.failure(request.id(), new JsonRpcError(e.code(), e.getMessage(), e.data()));
        } catch (LoggerException e) {
            return loggerFailure(request, e);
        }

        try {
            logger.printMethodLogs(request.method(), error);
        } catch (LoggerException e) {
            return loggerFailure(request, e);
        }
        return response;
    }

    private static JsonRpcResponse loggerFailure(final JsonRpcRequest request, final LoggerException e) {
        log.warn("Activity logger failed during {}: {}", request.method(), e.getMessage());
        return JsonRpcResponse.failure(request.id(),
                new JsonRpcError(ProviderException.INTERNAL_ERROR, e.getMessage(), null));
    }

    /**
     * Stops interval mining and the worker, then closes the engine. The host scheduler is
     * left running.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (intervalMiner != null) {
            intervalMiner.close();
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker did not finish within 5s, interrupting");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        engine.close();
        if (scenario != null) {
            scenario.close();
        }
        log.debug("Provider closed");
    }
}
