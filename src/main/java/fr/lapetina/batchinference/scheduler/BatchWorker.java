package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.BatchResultListener;
import fr.lapetina.batchinference.client.InferenceClient;
import fr.lapetina.batchinference.domain.model.ActiveBatch;
import fr.lapetina.batchinference.domain.model.BatchRequest;
import fr.lapetina.batchinference.domain.model.BatchResult;
import fr.lapetina.batchinference.domain.model.EngineMetrics;
import fr.lapetina.batchinference.domain.model.ErrorType;
import fr.lapetina.batchinference.domain.model.InferenceResponse;
import fr.lapetina.batchinference.domain.strategy.ClientSelectionStrategy;
import fr.lapetina.batchinference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Long-running loop that claims batches and dispatches them to a backend.
 *
 * Every request of a claimed batch is sent concurrently to one client. Each
 * request is answered on its own as soon as its call finishes, so one failure
 * never affects its siblings. The batch is removed from the registry and
 * metrics are recorded only after all calls have settled.
 *
 * The loop exits once scheduling has stopped and no unclaimed batch remains.
 */
public final class BatchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BatchWorker.class);

    private static final String UNKNOWN_CLIENT = "unknown";

    private final int workerIndex;
    private final ActiveBatchRegistry activeBatches;
    private final List<InferenceClient> clients;
    private final ClientSelectionStrategy clientSelection;
    private final EngineMetrics metrics;
    private final MetricsRegistry metricsRegistry;
    private final BatchResultListener listener;
    private final BooleanSupplier schedulingStopped;
    private final Supplier<Duration> idleInterval;

    private BatchWorker(Builder builder) {
        this.workerIndex = builder.workerIndex;
        this.activeBatches = builder.activeBatches;
        this.clients = List.copyOf(builder.clients);
        this.clientSelection = builder.clientSelection;
        this.metrics = builder.metrics;
        this.metricsRegistry = builder.metricsRegistry;
        this.listener = builder.listener != null ? builder.listener : BatchResultListener.NO_OP;
        this.schedulingStopped = builder.schedulingStopped;
        this.idleInterval = builder.idleInterval;
    }

    @Override
    public void run() {
        log.debug("Worker started: workerIndex={}", workerIndex);
        while (true) {
            Optional<ActiveBatch> claimed;
            try {
                claimed = activeBatches.claimNext(workerIndex);
            } catch (RuntimeException e) {
                log.error("Failed to claim batch: workerIndex={}", workerIndex, e);
                claimed = Optional.empty();
            }
            if (claimed.isPresent()) {
                processSafely(claimed.get());
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                continue;
            }
            if (schedulingStopped.getAsBoolean()) {
                break;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(idleInterval.get().toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Worker stopped: workerIndex={}", workerIndex);
    }

    /**
     * Processes a claimed batch; on any unexpected failure answers what is
     * left with INTERNAL_ERROR and drops the batch so the loop can go on.
     */
    private void processSafely(ActiveBatch batch) {
        try {
            processBatch(batch);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing batch: batchId={}, workerIndex={}",
                    batch.getId(), workerIndex, e);
            try {
                answerRemaining(batch, UNKNOWN_CLIENT, ErrorType.INTERNAL_ERROR,
                        "Internal error: " + e.getMessage(), new AtomicInteger());
                activeBatches.remove(batch.getId());
            } catch (RuntimeException cleanup) {
                log.error("Failed to clean up batch: batchId={}", batch.getId(), cleanup);
            }
        }
    }

    /**
     * Dispatches a batch already claimed by this worker and answers every request in it.
     */
    public BatchResult processBatch(ActiveBatch batch) {
        MDC.put("batchId", batch.getId());
        MDC.put("workerIndex", String.valueOf(workerIndex));
        Instant start = Instant.now();
        String clientId = UNKNOWN_CLIENT;
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();

        try {
            InferenceClient client = clientSelection.select(clients, workerIndex);
            clientId = client.getId() != null ? client.getId() : UNKNOWN_CLIENT;
            log.debug("Dispatching batch: batchId={}, size={}, clientId={}",
                    batch.getId(), batch.size(), clientId);

            List<CompletableFuture<Void>> calls = new ArrayList<>(batch.size());
            for (BatchRequest request : batch.getRequests()) {
                calls.add(dispatch(client, clientId, batch, request, successes, failures));
            }

            CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int answered = answerRemaining(batch, clientId, ErrorType.SHUTDOWN,
                    "Engine shut down before the request completed", failures);
            log.warn("Worker interrupted while dispatching: batchId={}, unanswered={}",
                    batch.getId(), answered);
        } catch (ExecutionException | RuntimeException e) {
            int answered = answerRemaining(batch, clientId, ErrorType.INTERNAL_ERROR,
                    "Internal error: " + e.getMessage(), failures);
            log.error("Batch dispatch failed: batchId={}, unanswered={}", batch.getId(), answered, e);
        }

        try {
            activeBatches.remove(batch.getId());

            BatchResult result = new BatchResult(
                    batch.getId(),
                    workerIndex,
                    clientId,
                    batch.size(),
                    successes.get(),
                    failures.get(),
                    Duration.between(start, Instant.now()),
                    batch.averageWaitTime()
            );
            metrics.recordBatch(result);
            metricsRegistry.recordBatch(result);
            notifyListener(result);

            log.info("Batch completed: batchId={}, workerIndex={}, clientId={}, size={}, succeeded={}, failed={}, durationMs={}",
                    result.batchId(), workerIndex, clientId, result.batchSize(),
                    result.successCount(), result.failureCount(), result.processingTime().toMillis());
            return result;
        } finally {
            MDC.remove("batchId");
            MDC.remove("workerIndex");
        }
    }

    private CompletableFuture<Void> dispatch(
            InferenceClient client,
            String clientId,
            ActiveBatch batch,
            BatchRequest request,
            AtomicInteger successes,
            AtomicInteger failures
    ) {
        CompletableFuture<String> call;
        try {
            call = client.complete(request.getPrompt(), request.getParameters());
            if (call == null) {
                call = CompletableFuture.failedFuture(
                        new IllegalStateException("Client returned no result"));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((text, error) -> {
            if (error == null) {
                request.reply(InferenceResponse.success(request, text, batch.getId(), clientId), () -> {
                    successes.incrementAndGet();
                    metrics.recordCompleted(1);
                    metricsRegistry.recordCompleted(1);
                });
            } else {
                Throwable cause = unwrap(error);
                log.warn("Request failed: requestId={}, batchId={}, clientId={}, error={}",
                        request.getId(), batch.getId(), clientId, cause.getMessage());
                request.reply(InferenceResponse.error(request, batch.getId(), clientId,
                        ErrorType.BACKEND_ERROR, "LLM request failed: " + cause.getMessage()),
                        () -> countFailure(ErrorType.BACKEND_ERROR, failures));
            }
            return null;
        });
    }

    private int answerRemaining(
            ActiveBatch batch,
            String clientId,
            ErrorType errorType,
            String message,
            AtomicInteger failures
    ) {
        int answered = 0;
        for (BatchRequest request : batch.getRequests()) {
            if (!request.getReplyChannel().isDelivered()
                    && request.reply(InferenceResponse.error(request, batch.getId(), clientId, errorType, message),
                    () -> countFailure(errorType, failures))) {
                answered++;
            }
        }
        return answered;
    }

    private void countFailure(ErrorType errorType, AtomicInteger failures) {
        failures.incrementAndGet();
        metrics.recordFailed(1);
        metricsRegistry.recordFailed(errorType, 1);
    }

    private void notifyListener(BatchResult result) {
        try {
            listener.onBatchCompleted(result);
        } catch (Exception e) {
            log.warn("Batch result listener failed: batchId={}", result.batchId(), e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int workerIndex;
        private ActiveBatchRegistry activeBatches;
        private List<InferenceClient> clients = List.of();
        private ClientSelectionStrategy clientSelection;
        private EngineMetrics metrics;
        private MetricsRegistry metricsRegistry;
        private BatchResultListener listener;
        private BooleanSupplier schedulingStopped = () -> false;
        private Supplier<Duration> idleInterval = () -> Duration.ofMillis(5);

        public Builder workerIndex(int workerIndex) {
            this.workerIndex = workerIndex;
            return this;
        }

        public Builder activeBatches(ActiveBatchRegistry activeBatches) {
            this.activeBatches = activeBatches;
            return this;
        }

        public Builder clients(List<InferenceClient> clients) {
            this.clients = clients;
            return this;
        }

        public Builder clientSelection(ClientSelectionStrategy clientSelection) {
            this.clientSelection = clientSelection;
            return this;
        }

        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder listener(BatchResultListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder schedulingStopped(BooleanSupplier schedulingStopped) {
            this.schedulingStopped = schedulingStopped;
            return this;
        }

        public Builder idleInterval(Supplier<Duration> idleInterval) {
            this.idleInterval = idleInterval;
            return this;
        }

        public BatchWorker build() {
            if (activeBatches == null || clientSelection == null || metrics == null || metricsRegistry == null) {
                throw new IllegalStateException(
                        "activeBatches, clientSelection, metrics and metricsRegistry are required");
            }
            if (clients == null || clients.isEmpty()) {
                throw new IllegalStateException("At least one inference client is required");
            }
            return new BatchWorker(this);
        }
    }
}
