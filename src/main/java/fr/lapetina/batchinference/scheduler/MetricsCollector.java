package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.domain.model.EngineMetrics;
import fr.lapetina.batchinference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Periodic task that derives throughput from the completed-requests counter
 * and refreshes the exported gauges.
 */
public final class MetricsCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final EngineMetrics metrics;
    private final MetricsRegistry metricsRegistry;
    private final RequestQueue queue;
    private final ActiveBatchRegistry activeBatches;
    private final BooleanSupplier running;

    private long lastCompleted;
    private Instant lastSample;

    public MetricsCollector(
            EngineMetrics metrics,
            MetricsRegistry metricsRegistry,
            RequestQueue queue,
            ActiveBatchRegistry activeBatches,
            BooleanSupplier running
    ) {
        this.metrics = metrics;
        this.metricsRegistry = metricsRegistry;
        this.queue = queue;
        this.activeBatches = activeBatches;
        this.running = running;
        this.lastCompleted = metrics.getCompletedRequests();
        this.lastSample = Instant.now();
    }

    @Override
    public void run() {
        if (!running.getAsBoolean()) {
            return;
        }
        try {
            sample(Instant.now());
        } catch (Exception e) {
            log.error("Metrics sampling failed", e);
        }
    }

    /**
     * Recomputes throughput over the interval since the previous sample.
     */
    public void sample(Instant now) {
        long completed = metrics.getCompletedRequests();
        double elapsedSeconds = Duration.between(lastSample, now).toNanos() / 1_000_000_000.0;

        if (elapsedSeconds > 0) {
            double throughput = (completed - lastCompleted) / elapsedSeconds;
            metrics.updateThroughput(throughput, now);
            metricsRegistry.setThroughput(throughput);
        }
        metricsRegistry.setQueueDepth(queue.size());
        metricsRegistry.setActiveBatches(activeBatches.size());

        lastCompleted = completed;
        lastSample = now;

        log.debug("Metrics sampled: throughputRps={}, queueDepth={}, activeBatches={}",
                metrics.getThroughputRequestsPerSecond(), queue.size(), activeBatches.size());
    }
}
