package fr.lapetina.batchinference.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the batch engine.
 * Designed to be populated from YAML.
 */
public class BatchEngineConfig {

    private BatchingConfig batching = new BatchingConfig();
    private WorkersConfig workers = new WorkersConfig();
    private QueueConfig queue = new QueueConfig();
    private List<ClientConfig> clients = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public BatchingConfig getBatching() { return batching; }
    public void setBatching(BatchingConfig batching) { this.batching = batching; }

    public WorkersConfig getWorkers() { return workers; }
    public void setWorkers(WorkersConfig workers) { this.workers = workers; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public List<ClientConfig> getClients() { return clients; }
    public void setClients(List<ClientConfig> clients) { this.clients = clients; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Batch formation settings.
     */
    public static class BatchingConfig {
        private int maxBatchSize = 32;
        private int minBatchSize = 4;
        private int optimalBatchSize = 16;
        private long batchTimeoutMs = 100;
        private long requestTimeoutMs = 30000;
        private boolean dynamic = true;
        private long urgencyThresholdMs = 5000;
        private long scheduleIntervalMs = 10;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public int getMinBatchSize() { return minBatchSize; }
        public void setMinBatchSize(int minBatchSize) { this.minBatchSize = minBatchSize; }

        public int getOptimalBatchSize() { return optimalBatchSize; }
        public void setOptimalBatchSize(int optimalBatchSize) { this.optimalBatchSize = optimalBatchSize; }

        public long getBatchTimeoutMs() { return batchTimeoutMs; }
        public void setBatchTimeoutMs(long batchTimeoutMs) { this.batchTimeoutMs = batchTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public boolean isDynamic() { return dynamic; }
        public void setDynamic(boolean dynamic) { this.dynamic = dynamic; }

        public long getUrgencyThresholdMs() { return urgencyThresholdMs; }
        public void setUrgencyThresholdMs(long urgencyThresholdMs) { this.urgencyThresholdMs = urgencyThresholdMs; }

        public long getScheduleIntervalMs() { return scheduleIntervalMs; }
        public void setScheduleIntervalMs(long scheduleIntervalMs) { this.scheduleIntervalMs = scheduleIntervalMs; }
    }

    /**
     * Worker pool settings.
     */
    public static class WorkersConfig {
        private int count = 4;
        private String clientSelection = "worker-affinity";
        private long idleIntervalMs = 5;
        private long shutdownTimeoutMs = 30000;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public String getClientSelection() { return clientSelection; }
        public void setClientSelection(String clientSelection) { this.clientSelection = clientSelection; }

        public long getIdleIntervalMs() { return idleIntervalMs; }
        public void setIdleIntervalMs(long idleIntervalMs) { this.idleIntervalMs = idleIntervalMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Request queue settings.
     */
    public static class QueueConfig {
        private int maxDepth = 0;
        private long sweepIntervalMs = 10;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    /**
     * Individual Ollama backend configuration.
     */
    public static class ClientConfig {
        private String id;
        private String url;
        private String model;
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 120000;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "batch_inference";
        private long intervalMs = 1000;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }
}
