package fr.lapetina.batchinference.domain.strategy;

import fr.lapetina.batchinference.BatchInferenceConfig;
import fr.lapetina.batchinference.domain.model.BatchRequest;

import java.time.Instant;
import java.util.List;

/**
 * Dynamic sizing driven by deadline urgency and queue depth.
 *
 * <ol>
 *   <li>If any queued request is within the urgency threshold of its deadline,
 *       dispatch a small batch: {@code min(urgentCount, minBatchSize)}.</li>
 *   <li>Otherwise, if the queue holds at least {@code optimalBatchSize}
 *       requests, dispatch exactly that many.</li>
 *   <li>Otherwise drain what is there, capped at {@code maxBatchSize}.</li>
 * </ol>
 */
public final class LatencyAwareSizingStrategy implements BatchSizingStrategy {

    @Override
    public String getName() {
        return "dynamic";
    }

    @Override
    public int batchSize(List<BatchRequest> queued, Instant now, BatchInferenceConfig config) {
        int queueSize = queued.size();
        if (queueSize == 0) {
            return 0;
        }

        long urgentCount = queued.stream()
                .filter(request -> request.isUrgent(now, config.urgencyThreshold()))
                .count();

        int size;
        if (urgentCount > 0) {
            size = (int) Math.min(urgentCount, config.minBatchSize());
        } else if (queueSize >= config.optimalBatchSize()) {
            size = config.optimalBatchSize();
        } else {
            size = Math.min(queueSize, config.maxBatchSize());
        }
        return Math.min(size, queueSize);
    }
}
