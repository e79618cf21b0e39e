package fr.lapetina.batchinference;

import fr.lapetina.batchinference.infrastructure.config.BatchEngineConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings for a {@link BatchInferenceEngine}.
 * Immutable; validated on construction.
 *
 * @param maxBatchSize          hard cap on requests per batch
 * @param minBatchSize          queue depth that triggers a batch immediately
 * @param optimalBatchSize      throughput sweet spot used under load
 * @param batchTimeout          longest wait before an undersized batch is forced
 * @param requestTimeout        per-request deadline, measured from submission
 * @param workerCount           number of concurrent batch workers
 * @param enableDynamicBatching false means always batch at {@code maxBatchSize}
 * @param urgencyThreshold      remaining time under which a queued request counts as urgent
 * @param sweepInterval         expiration sweeper cadence
 * @param scheduleInterval      scheduler cadence
 * @param workerIdleInterval    worker back-off when no batch is available
 * @param metricsInterval       throughput sampling cadence
 * @param maxQueueDepth         queue capacity, 0 for unbounded
 * @param shutdownTimeout       how long shutdown waits for in-flight batches
 * @param clientSelection       name of the client selection strategy
 */
public record BatchInferenceConfig(
        int maxBatchSize,
        int minBatchSize,
        int optimalBatchSize,
        Duration batchTimeout,
        Duration requestTimeout,
        int workerCount,
        boolean enableDynamicBatching,
        Duration urgencyThreshold,
        Duration sweepInterval,
        Duration scheduleInterval,
        Duration workerIdleInterval,
        Duration metricsInterval,
        int maxQueueDepth,
        Duration shutdownTimeout,
        String clientSelection
) {
    public BatchInferenceConfig {
        requirePositive(maxBatchSize, "maxBatchSize");
        requirePositive(minBatchSize, "minBatchSize");
        requirePositive(optimalBatchSize, "optimalBatchSize");
        requirePositive(workerCount, "workerCount");
        if (minBatchSize > maxBatchSize) {
            throw new IllegalArgumentException(
                    "minBatchSize (" + minBatchSize + ") exceeds maxBatchSize (" + maxBatchSize + ")");
        }
        if (optimalBatchSize > maxBatchSize) {
            throw new IllegalArgumentException(
                    "optimalBatchSize (" + optimalBatchSize + ") exceeds maxBatchSize (" + maxBatchSize + ")");
        }
        if (maxQueueDepth < 0) {
            throw new IllegalArgumentException("maxQueueDepth must be >= 0");
        }
        requirePositive(batchTimeout, "batchTimeout");
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(sweepInterval, "sweepInterval");
        requirePositive(scheduleInterval, "scheduleInterval");
        requirePositive(workerIdleInterval, "workerIdleInterval");
        requirePositive(metricsInterval, "metricsInterval");
        requirePositive(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(urgencyThreshold, "urgencyThreshold is required");
        Objects.requireNonNull(clientSelection, "clientSelection is required");
    }

    public static BatchInferenceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxBatchSize(maxBatchSize)
                .minBatchSize(minBatchSize)
                .optimalBatchSize(optimalBatchSize)
                .batchTimeout(batchTimeout)
                .requestTimeout(requestTimeout)
                .workerCount(workerCount)
                .enableDynamicBatching(enableDynamicBatching)
                .urgencyThreshold(urgencyThreshold)
                .sweepInterval(sweepInterval)
                .scheduleInterval(scheduleInterval)
                .workerIdleInterval(workerIdleInterval)
                .metricsInterval(metricsInterval)
                .maxQueueDepth(maxQueueDepth)
                .shutdownTimeout(shutdownTimeout)
                .clientSelection(clientSelection);
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public static final class Builder {
        private int maxBatchSize = 32;
        private int minBatchSize = 4;
        private int optimalBatchSize = 16;
        private Duration batchTimeout = Duration.ofMillis(100);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int workerCount = 4;
        private boolean enableDynamicBatching = true;
        private Duration urgencyThreshold = Duration.ofSeconds(5);
        private Duration sweepInterval = Duration.ofMillis(10);
        private Duration scheduleInterval = Duration.ofMillis(10);
        private Duration workerIdleInterval = Duration.ofMillis(5);
        private Duration metricsInterval = Duration.ofSeconds(1);
        private int maxQueueDepth = 0;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private String clientSelection = "worker-affinity";

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder minBatchSize(int minBatchSize) {
            this.minBatchSize = minBatchSize;
            return this;
        }

        public Builder optimalBatchSize(int optimalBatchSize) {
            this.optimalBatchSize = optimalBatchSize;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder enableDynamicBatching(boolean enableDynamicBatching) {
            this.enableDynamicBatching = enableDynamicBatching;
            return this;
        }

        public Builder urgencyThreshold(Duration urgencyThreshold) {
            this.urgencyThreshold = urgencyThreshold;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder scheduleInterval(Duration scheduleInterval) {
            this.scheduleInterval = scheduleInterval;
            return this;
        }

        public Builder workerIdleInterval(Duration workerIdleInterval) {
            this.workerIdleInterval = workerIdleInterval;
            return this;
        }

        public Builder metricsInterval(Duration metricsInterval) {
            this.metricsInterval = metricsInterval;
            return this;
        }

        public Builder maxQueueDepth(int maxQueueDepth) {
            this.maxQueueDepth = maxQueueDepth;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder clientSelection(String clientSelection) {
            this.clientSelection = clientSelection;
            return this;
        }

        /**
         * Copies every engine setting from the YAML model.
         */
        public Builder fromConfig(BatchEngineConfig config) {
            BatchEngineConfig.BatchingConfig batching = config.getBatching();
            this.maxBatchSize = batching.getMaxBatchSize();
            this.minBatchSize = batching.getMinBatchSize();
            this.optimalBatchSize = batching.getOptimalBatchSize();
            this.batchTimeout = Duration.ofMillis(batching.getBatchTimeoutMs());
            this.requestTimeout = Duration.ofMillis(batching.getRequestTimeoutMs());
            this.enableDynamicBatching = batching.isDynamic();
            this.urgencyThreshold = Duration.ofMillis(batching.getUrgencyThresholdMs());
            this.scheduleInterval = Duration.ofMillis(batching.getScheduleIntervalMs());

            BatchEngineConfig.WorkersConfig workers = config.getWorkers();
            this.workerCount = workers.getCount();
            this.workerIdleInterval = Duration.ofMillis(workers.getIdleIntervalMs());
            this.clientSelection = workers.getClientSelection();
            this.shutdownTimeout = Duration.ofMillis(workers.getShutdownTimeoutMs());

            BatchEngineConfig.QueueConfig queue = config.getQueue();
            this.maxQueueDepth = queue.getMaxDepth();
            this.sweepInterval = Duration.ofMillis(queue.getSweepIntervalMs());

            this.metricsInterval = Duration.ofMillis(config.getMetrics().getIntervalMs());
            return this;
        }

        public BatchInferenceConfig build() {
            return new BatchInferenceConfig(
                    maxBatchSize, minBatchSize, optimalBatchSize,
                    batchTimeout, requestTimeout, workerCount, enableDynamicBatching,
                    urgencyThreshold, sweepInterval, scheduleInterval, workerIdleInterval,
                    metricsInterval, maxQueueDepth, shutdownTimeout, clientSelection
            );
        }
    }
}
