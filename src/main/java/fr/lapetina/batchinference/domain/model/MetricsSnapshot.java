package fr.lapetina.batchinference.domain.model;

import java.time.Instant;

/**
 * Point-in-time view of engine statistics.
 *
 * Every submitted request ends up in exactly one of {@code completedRequests},
 * {@code failedRequests}, {@code expiredRequests} or {@code rejectedRequests},
 * or is still queued or in flight.
 */
public record MetricsSnapshot(
        long totalRequests,
        long completedRequests,
        long failedRequests,
        long expiredRequests,
        long rejectedRequests,
        long totalBatches,
        double averageBatchSize,
        double averageProcessingTimeMs,
        double averageWaitTimeMs,
        double throughputRequestsPerSecond,
        int queueDepth,
        int activeBatches,
        Instant lastUpdated
) {
    /**
     * Requests that have received their terminal outcome.
     */
    public long resolvedRequests() {
        return completedRequests + failedRequests + expiredRequests + rejectedRequests;
    }
}
