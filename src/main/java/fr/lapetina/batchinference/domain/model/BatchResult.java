package fr.lapetina.batchinference.domain.model;

import java.time.Duration;

/**
 * Summary of one processed batch.
 */
public record BatchResult(
        String batchId,
        int workerIndex,
        String clientId,
        int batchSize,
        int successCount,
        int failureCount,
        Duration processingTime,
        Duration averageWaitTime
) {
    public boolean isFullySuccessful() {
        return failureCount == 0;
    }
}
