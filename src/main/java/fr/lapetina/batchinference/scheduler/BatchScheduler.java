package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.BatchInferenceConfig;
import fr.lapetina.batchinference.domain.model.ActiveBatch;
import fr.lapetina.batchinference.domain.model.BatchRequest;
import fr.lapetina.batchinference.domain.strategy.BatchSizingStrategy;
import fr.lapetina.batchinference.domain.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Periodic task that turns queued requests into {@link ActiveBatch}es.
 *
 * A batch is formed when the queue holds at least {@code minBatchSize}
 * requests, or when it is non-empty and {@code batchTimeout} has passed since
 * the previous batch. Batch size comes from a {@link BatchSizingStrategy}:
 * latency-aware when dynamic batching is on, fixed at {@code maxBatchSize}
 * otherwise.
 *
 * Settings are read through a shared reference on every tick, so they can be
 * changed while the engine runs.
 */
public final class BatchScheduler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final RequestQueue queue;
    private final ActiveBatchRegistry activeBatches;
    private final AtomicReference<BatchInferenceConfig> configRef;
    private final BooleanSupplier running;
    private final BatchSizingStrategy dynamicSizing = StrategyFactory.sizingFor(true);
    private final BatchSizingStrategy fixedSizing = StrategyFactory.sizingFor(false);

    private volatile Instant lastScheduled;

    public BatchScheduler(
            RequestQueue queue,
            ActiveBatchRegistry activeBatches,
            AtomicReference<BatchInferenceConfig> configRef,
            BooleanSupplier running
    ) {
        this.queue = queue;
        this.activeBatches = activeBatches;
        this.configRef = configRef;
        this.running = running;
        this.lastScheduled = Instant.now();
    }

    /**
     * Restarts the batch timeout window, typically when the engine starts.
     */
    public void resetTimer(Instant now) {
        this.lastScheduled = now;
    }

    @Override
    public void run() {
        if (!running.getAsBoolean()) {
            return;
        }
        try {
            tick(Instant.now());
        } catch (Exception e) {
            log.error("Batch scheduling tick failed", e);
        }
    }

    /**
     * Forms at most one batch if the scheduling rule allows it.
     */
    public Optional<ActiveBatch> tick(Instant now) {
        if (!shouldSchedule(queue.size(), now)) {
            return Optional.empty();
        }
        return scheduleBatch(now);
    }

    boolean shouldSchedule(int queueSize, Instant now) {
        BatchInferenceConfig config = configRef.get();
        if (queueSize >= config.minBatchSize()) {
            return true;
        }
        return queueSize > 0
                && Duration.between(lastScheduled, now).compareTo(config.batchTimeout()) >= 0;
    }

    /**
     * Drains the next batch from the queue and registers it, regardless of
     * the scheduling rule.
     */
    public Optional<ActiveBatch> scheduleBatch(Instant now) {
        BatchInferenceConfig config = configRef.get();
        List<BatchRequest> snapshot = queue.snapshot();
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }

        BatchSizingStrategy sizing = config.enableDynamicBatching() ? dynamicSizing : fixedSizing;
        int size = sizing.batchSize(snapshot, now, config);
        if (size <= 0) {
            return Optional.empty();
        }

        // The sweeper may have removed entries since the snapshot
        List<BatchRequest> drained = queue.drainUpTo(size);
        if (drained.isEmpty()) {
            return Optional.empty();
        }

        ActiveBatch batch = new ActiveBatch(drained);
        activeBatches.add(batch);
        lastScheduled = now;

        log.debug("Scheduled batch: batchId={}, size={}, strategy={}, queued={}, remaining={}",
                batch.getId(), batch.size(), sizing.getName(), snapshot.size(), queue.size());
        return Optional.of(batch);
    }
}
