package fr.lapetina.batchinference.domain.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live aggregate statistics for the engine.
 *
 * Counters are lock-free. The moving averages share one monitor so that a
 * batch's size, duration and wait time are folded in together.
 */
public final class EngineMetrics {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong completedRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong expiredRequests = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();

    // Guarded by "this"
    private long totalBatches;
    private double averageBatchSize;
    private double averageProcessingTimeMs;
    private double averageWaitTimeMs;

    private volatile double throughputRequestsPerSecond;
    private volatile Instant lastUpdated = Instant.now();

    public void recordSubmitted() {
        totalRequests.incrementAndGet();
    }

    public void recordCompleted(int count) {
        completedRequests.addAndGet(count);
    }

    public void recordFailed(int count) {
        failedRequests.addAndGet(count);
    }

    public void recordExpired(int count) {
        expiredRequests.addAndGet(count);
    }

    public void recordRejected(int count) {
        rejectedRequests.addAndGet(count);
    }

    /**
     * Folds a finished batch into the moving averages. Request outcomes are
     * counted as each reply is delivered, not here.
     *
     * Uses {@code avg = avg * (1 - w) + sample * w} with {@code w = 1 / totalBatches},
     * so the first batch replaces the initial zero.
     */
    public void recordBatch(BatchResult result) {
        synchronized (this) {
            totalBatches++;
            double weight = 1.0 / totalBatches;
            averageBatchSize = movingAverage(averageBatchSize, result.batchSize(), weight);
            averageProcessingTimeMs = movingAverage(
                    averageProcessingTimeMs, result.processingTime().toMillis(), weight);
            averageWaitTimeMs = movingAverage(
                    averageWaitTimeMs, result.averageWaitTime().toMillis(), weight);
        }
        lastUpdated = Instant.now();
    }

    public void updateThroughput(double requestsPerSecond, Instant at) {
        this.throughputRequestsPerSecond = requestsPerSecond;
        this.lastUpdated = at;
    }

    public long getCompletedRequests() {
        return completedRequests.get();
    }

    public double getThroughputRequestsPerSecond() {
        return throughputRequestsPerSecond;
    }

    public MetricsSnapshot snapshot(int queueDepth, int activeBatches) {
        synchronized (this) {
            return new MetricsSnapshot(
                    totalRequests.get(),
                    completedRequests.get(),
                    failedRequests.get(),
                    expiredRequests.get(),
                    rejectedRequests.get(),
                    totalBatches,
                    averageBatchSize,
                    averageProcessingTimeMs,
                    averageWaitTimeMs,
                    throughputRequestsPerSecond,
                    queueDepth,
                    activeBatches,
                    lastUpdated
            );
        }
    }

    private static double movingAverage(double current, double sample, double weight) {
        return current * (1.0 - weight) + sample * weight;
    }
}
