package fr.lapetina.batchinference.domain.strategy;

import fr.lapetina.batchinference.client.InferenceClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rotates through clients batch by batch, regardless of which worker asks.
 *
 * Useful when there are fewer workers than clients, where worker affinity
 * would leave some clients idle.
 */
public final class RoundRobinStrategy implements ClientSelectionStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public InferenceClient select(List<InferenceClient> clients, int workerIndex) {
        return clients.get(Math.floorMod(counter.getAndIncrement(), clients.size()));
    }
}
