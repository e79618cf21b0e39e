package fr.lapetina.batchinference;

import fr.lapetina.batchinference.client.InferenceClient;
import fr.lapetina.batchinference.domain.model.ActiveBatch;
import fr.lapetina.batchinference.domain.model.BatchRequest;
import fr.lapetina.batchinference.domain.model.EngineMetrics;
import fr.lapetina.batchinference.domain.model.ErrorType;
import fr.lapetina.batchinference.domain.model.InferenceParameters;
import fr.lapetina.batchinference.domain.model.InferenceResponse;
import fr.lapetina.batchinference.domain.model.MetricsSnapshot;
import fr.lapetina.batchinference.domain.model.RequestPriority;
import fr.lapetina.batchinference.domain.strategy.ClientSelectionStrategy;
import fr.lapetina.batchinference.domain.strategy.StrategyFactory;
import fr.lapetina.batchinference.infrastructure.config.ConfigurationException;
import fr.lapetina.batchinference.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.batchinference.scheduler.ActiveBatchRegistry;
import fr.lapetina.batchinference.scheduler.BatchScheduler;
import fr.lapetina.batchinference.scheduler.BatchWorker;
import fr.lapetina.batchinference.scheduler.ExpirationSweeper;
import fr.lapetina.batchinference.scheduler.MetricsCollector;
import fr.lapetina.batchinference.scheduler.RequestQueue;
import fr.lapetina.batchinference.scheduler.exception.BackpressureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dynamic batch-inference engine.
 *
 * Callers submit single prompts and get a future per prompt. Behind the
 * facade, four kinds of background task cooperate:
 *
 * 1. EXPIRATION SWEEPER: answers queued requests past their deadline with
 *    TIMEOUT.
 *
 * 2. BATCH SCHEDULER: drains the priority queue into batches, sized by the
 *    latency-aware strategy (or a fixed size when dynamic batching is off).
 *
 * 3. WORKERS: each claims one batch at a time and dispatches all of its
 *    requests concurrently to a backend client.
 *
 * 4. METRICS COLLECTOR: samples throughput and refreshes the exported gauges.
 *
 * Every submitted request receives exactly one {@link InferenceResponse}. The
 * returned futures never complete exceptionally; failures are carried by
 * {@link InferenceResponse#errorType()}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BatchInferenceEngine engine = BatchInferenceEngine.builder()
 *         .client(client)
 *         .config(BatchInferenceConfig.defaults())
 *         .build()) {
 *     engine.start();
 *     InferenceResponse response = engine.submit("Hello").join();
 * }
 * }</pre>
 */
public final class BatchInferenceEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchInferenceEngine.class);

    private static final String SHUTDOWN_MESSAGE = "Engine is shutting down";

    private final List<InferenceClient> clients;
    private final AtomicReference<BatchInferenceConfig> configRef;
    private final MetricsRegistry metricsRegistry;
    private final boolean ownsMetricsRegistry;
    private final ClientSelectionStrategy clientSelectionOverride;
    private final BatchResultListener listener;

    private final RequestQueue queue;
    private final ActiveBatchRegistry activeBatches = new ActiveBatchRegistry();
    private final EngineMetrics metrics = new EngineMetrics();
    private final AtomicLong sequence = new AtomicLong();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean schedulingStopped = new AtomicBoolean(false);
    private final BatchScheduler scheduler;

    // Written under "this", read anywhere
    private volatile EngineState state = EngineState.STOPPED;
    private volatile boolean terminated;

    private ScheduledExecutorService periodicExecutor;
    private ExecutorService workerPool;

    private BatchInferenceEngine(Builder builder) {
        this.clients = List.copyOf(builder.clients);
        this.configRef = new AtomicReference<>(builder.config);
        this.ownsMetricsRegistry = builder.metricsRegistry == null;
        this.metricsRegistry = ownsMetricsRegistry ? new MetricsRegistry() : builder.metricsRegistry;
        this.clientSelectionOverride = builder.clientSelection;
        this.listener = builder.listener != null ? builder.listener : BatchResultListener.NO_OP;
        this.queue = new RequestQueue(builder.config.maxQueueDepth());
        this.scheduler = new BatchScheduler(queue, activeBatches, configRef, running::get);

        log.info("BatchInferenceEngine created: clients={}, workers={}, maxBatchSize={}, minBatchSize={}, optimalBatchSize={}, dynamic={}",
                clients.size(), builder.config.workerCount(), builder.config.maxBatchSize(),
                builder.config.minBatchSize(), builder.config.optimalBatchSize(),
                builder.config.enableDynamicBatching());
    }

    /**
     * Starts the background tasks.
     *
     * @throws IllegalStateException  if the engine is not STOPPED or has been shut down
     * @throws ConfigurationException if no client was supplied or the client
     *                                selection strategy is unknown
     */
    public synchronized void start() {
        if (state != EngineState.STOPPED || terminated) {
            throw new IllegalStateException("Engine cannot be started from state " + state
                    + (terminated ? " (already shut down)" : ""));
        }
        if (clients.isEmpty()) {
            throw new ConfigurationException("At least one inference client is required");
        }
        BatchInferenceConfig config = configRef.get();
        ClientSelectionStrategy clientSelection = resolveClientSelection(config);

        state = EngineState.STARTING;
        running.set(true);
        scheduler.resetTimer(Instant.now());

        periodicExecutor = Executors.newScheduledThreadPool(3, new EngineThreadFactory("batch-engine"));
        schedule(new ExpirationSweeper(queue, metrics, metricsRegistry, running::get),
                config.sweepInterval());
        schedule(scheduler, config.scheduleInterval());
        schedule(new MetricsCollector(metrics, metricsRegistry, queue, activeBatches, running::get),
                config.metricsInterval());

        workerPool = Executors.newFixedThreadPool(config.workerCount(), new EngineThreadFactory("batch-worker"));
        for (int i = 0; i < config.workerCount(); i++) {
            workerPool.execute(BatchWorker.builder()
                    .workerIndex(i)
                    .activeBatches(activeBatches)
                    .clients(clients)
                    .clientSelection(clientSelection)
                    .metrics(metrics)
                    .metricsRegistry(metricsRegistry)
                    .listener(listener)
                    .schedulingStopped(schedulingStopped::get)
                    .idleInterval(() -> configRef.get().workerIdleInterval())
                    .build());
        }

        state = EngineState.RUNNING;
        log.info("BatchInferenceEngine started: workers={}, clientSelection={}, queued={}",
                config.workerCount(), clientSelection.getName(), queue.size());
    }

    private ClientSelectionStrategy resolveClientSelection(BatchInferenceConfig config) {
        if (clientSelectionOverride != null) {
            return clientSelectionOverride;
        }
        return StrategyFactory.createSelection(config.clientSelection())
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown client selection strategy: " + config.clientSelection()
                                + ", available: " + StrategyFactory.getSelectionNames()));
    }

    private void schedule(Runnable task, Duration interval) {
        long nanos = interval.toNanos();
        periodicExecutor.scheduleWithFixedDelay(task, nanos, nanos, TimeUnit.NANOSECONDS);
    }

    public CompletableFuture<InferenceResponse> submit(String prompt) {
        return submit(prompt, InferenceParameters.defaults(), RequestPriority.NORMAL);
    }

    public CompletableFuture<InferenceResponse> submit(String prompt, RequestPriority priority) {
        return submit(prompt, InferenceParameters.defaults(), priority);
    }

    /**
     * Queues a prompt for batched inference.
     *
     * Accepted while RUNNING, and before the first {@link #start()} (served
     * once started). After shutdown the returned future is already completed
     * with {@link ErrorType#SHUTDOWN}.
     *
     * @return future completed with exactly one response, never exceptionally
     * @throws BackpressureException if the queue is at its configured capacity
     */
    public CompletableFuture<InferenceResponse> submit(
            String prompt,
            InferenceParameters parameters,
            RequestPriority priority
    ) {
        Objects.requireNonNull(prompt, "Prompt is required");
        BatchInferenceConfig config = configRef.get();

        BatchRequest request = BatchRequest.builder()
                .prompt(prompt)
                .parameters(parameters != null ? parameters : InferenceParameters.defaults())
                .priority(priority != null ? priority : RequestPriority.NORMAL)
                .createdAt(Instant.now())
                .timeout(config.requestTimeout())
                .sequence(sequence.getAndIncrement())
                .build();

        boolean accepted = !terminated && queue.enqueue(request);
        metrics.recordSubmitted();

        if (!accepted) {
            reject(List.of(request));
            log.debug("Request rejected after shutdown: requestId={}", request.getId());
        } else {
            log.debug("Request submitted: requestId={}, priority={}, queueDepth={}",
                    request.getId(), request.getPriority(), queue.size());
        }
        return request.getReplyChannel().future();
    }

    /**
     * Stops the engine. Queued requests are answered with SHUTDOWN; batches
     * already formed are allowed to finish within {@code shutdownTimeout}.
     * Idempotent.
     */
    public synchronized void shutdown() {
        if (terminated) {
            return;
        }
        if (state == EngineState.STOPPED) {
            terminated = true;
            int rejected = reject(queue.closeAndDrain());
            log.info("BatchInferenceEngine shut down before start: rejected={}", rejected);
            return;
        }

        log.info("Shutting down BatchInferenceEngine: queued={}, activeBatches={}",
                queue.size(), activeBatches.size());
        state = EngineState.STOPPING;
        running.set(false);
        Duration shutdownTimeout = configRef.get().shutdownTimeout();

        periodicExecutor.shutdown();
        awaitTermination(periodicExecutor, shutdownTimeout, "periodic tasks");

        int rejected = reject(queue.closeAndDrain());
        schedulingStopped.set(true);

        workerPool.shutdown();
        awaitTermination(workerPool, shutdownTimeout, "workers");

        // Batches formed but never claimed
        List<BatchRequest> stranded = new ArrayList<>();
        for (ActiveBatch batch : activeBatches.removeUnclaimed()) {
            stranded.addAll(batch.getRequests());
        }
        rejected += reject(stranded);

        terminated = true;
        state = EngineState.STOPPED;
        log.info("BatchInferenceEngine shut down: rejected={}, totalBatches={}",
                rejected, metrics.snapshot(0, activeBatches.size()).totalBatches());
    }

    private void awaitTermination(ExecutorService executor, Duration timeout, String name) {
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting for {}, interrupting", name);
                executor.shutdownNow();
                if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    log.warn("{} did not terminate after interruption", name);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private int reject(List<BatchRequest> requests) {
        int delivered = 0;
        for (BatchRequest request : requests) {
            boolean sent = request.reply(
                    InferenceResponse.error(request, ErrorType.SHUTDOWN, SHUTDOWN_MESSAGE),
                    () -> {
                        metrics.recordRejected(1);
                        metricsRegistry.recordRejected(1);
                    });
            if (sent) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Replaces the batching thresholds of a running engine. Sizes, timeouts
     * and urgency take effect on the next scheduler tick; worker count,
     * intervals and client selection only apply to a new engine.
     */
    public void updateBatchingConfig(BatchInferenceConfig newConfig) {
        Objects.requireNonNull(newConfig, "Config is required");
        BatchInferenceConfig old = configRef.getAndSet(newConfig);
        if (old.workerCount() != newConfig.workerCount()
                || !old.clientSelection().equals(newConfig.clientSelection())) {
            log.warn("Worker count and client selection changes require a restart: workers={}, clientSelection={}",
                    old.workerCount(), old.clientSelection());
        }
        log.info("Batching config updated: maxBatchSize={}, minBatchSize={}, optimalBatchSize={}, batchTimeoutMs={}, dynamic={}",
                newConfig.maxBatchSize(), newConfig.minBatchSize(), newConfig.optimalBatchSize(),
                newConfig.batchTimeout().toMillis(), newConfig.enableDynamicBatching());
    }

    public MetricsSnapshot metrics() {
        return metrics.snapshot(queue.size(), activeBatches.size());
    }

    public EngineState state() {
        return state;
    }

    public int queueDepth() {
        return queue.size();
    }

    public int activeBatchCount() {
        return activeBatches.size();
    }

    public BatchInferenceConfig getConfig() {
        return configRef.get();
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * Shuts down, then closes the metrics registry if the engine created it.
     */
    @Override
    public void close() {
        shutdown();
        if (ownsMetricsRegistry) {
            metricsRegistry.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for engine threads.
     */
    private static class EngineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        EngineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for BatchInferenceEngine.
     */
    public static final class Builder {
        private final List<InferenceClient> clients = new ArrayList<>();
        private BatchInferenceConfig config = BatchInferenceConfig.defaults();
        private MetricsRegistry metricsRegistry;
        private ClientSelectionStrategy clientSelection;
        private BatchResultListener listener;

        public Builder client(InferenceClient client) {
            this.clients.add(Objects.requireNonNull(client, "client"));
            return this;
        }

        public Builder clients(List<? extends InferenceClient> clients) {
            clients.forEach(this::client);
            return this;
        }

        public Builder config(BatchInferenceConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Shares an existing registry; when omitted the engine creates and owns one.
         */
        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        /**
         * Overrides the strategy named by {@link BatchInferenceConfig#clientSelection()}.
         */
        public Builder clientSelection(ClientSelectionStrategy clientSelection) {
            this.clientSelection = clientSelection;
            return this;
        }

        public Builder listener(BatchResultListener listener) {
            this.listener = listener;
            return this;
        }

        public BatchInferenceEngine build() {
            return new BatchInferenceEngine(this);
        }
    }
}
