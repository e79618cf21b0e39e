package fr.lapetina.batchinference.domain.strategy;

import fr.lapetina.batchinference.BatchInferenceConfig;
import fr.lapetina.batchinference.domain.model.BatchRequest;

import java.time.Instant;
import java.util.List;

/**
 * Always fills batches up to {@code maxBatchSize}, ignoring deadlines.
 */
public final class FixedSizingStrategy implements BatchSizingStrategy {

    @Override
    public String getName() {
        return "fixed";
    }

    @Override
    public int batchSize(List<BatchRequest> queued, Instant now, BatchInferenceConfig config) {
        return Math.min(queued.size(), config.maxBatchSize());
    }
}
