package fr.lapetina.batchinference.domain.strategy;

import fr.lapetina.batchinference.BatchInferenceConfig;
import fr.lapetina.batchinference.domain.model.BatchRequest;

import java.time.Instant;
import java.util.List;

/**
 * Decides how many queued requests go into the next batch.
 *
 * Implementations must be stateless or thread-safe; the scheduler may call
 * them from its own thread while configuration is swapped from another.
 */
public interface BatchSizingStrategy {

    /**
     * Returns the name of this strategy for configuration and logs.
     */
    String getName();

    /**
     * Computes the size of the next batch.
     *
     * @param queued snapshot of the queue, highest priority first
     * @param now    reference time for deadline checks
     * @param config current engine settings
     * @return number of requests to drain, between 0 and {@code queued.size()}
     */
    int batchSize(List<BatchRequest> queued, Instant now, BatchInferenceConfig config);
}
