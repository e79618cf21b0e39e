package fr.lapetina.batchinference.domain.strategy;

import fr.lapetina.batchinference.client.InferenceClient;

import java.util.List;

/**
 * Picks the backend client a worker dispatches its claimed batch to.
 *
 * Implementations must be thread-safe as they are called from every worker
 * concurrently.
 */
public interface ClientSelectionStrategy {

    String getName();

    /**
     * Selects a client for one batch.
     *
     * @param clients     all configured clients, never empty
     * @param workerIndex index of the calling worker
     */
    InferenceClient select(List<InferenceClient> clients, int workerIndex);
}
