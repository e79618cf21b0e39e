package fr.lapetina.batchinference.domain.strategy;

import fr.lapetina.batchinference.client.InferenceClient;

import java.util.List;

/**
 * Binds each worker to one client: {@code clients[workerIndex mod clients.size()]}.
 *
 * With as many workers as clients every backend gets exactly one worker; with
 * more workers, clients are shared cyclically.
 */
public final class WorkerAffinityStrategy implements ClientSelectionStrategy {

    @Override
    public String getName() {
        return "worker-affinity";
    }

    @Override
    public InferenceClient select(List<InferenceClient> clients, int workerIndex) {
        return clients.get(Math.floorMod(workerIndex, clients.size()));
    }
}
