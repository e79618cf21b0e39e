package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.domain.model.ActiveBatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared collection of formed batches, in scheduling order.
 *
 * The claim flag of each batch is read and flipped only under this
 * registry's lock, which makes "first worker to look wins" a proper
 * compare-and-set.
 */
public final class ActiveBatchRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ActiveBatch> batches = new LinkedHashMap<>();

    public void add(ActiveBatch batch) {
        lock.lock();
        try {
            batches.put(batch.getId(), batch);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims the oldest unclaimed batch for a worker.
     *
     * @return the claimed batch, or empty if every batch is already taken
     */
    public Optional<ActiveBatch> claimNext(int workerIndex) {
        lock.lock();
        try {
            for (ActiveBatch batch : batches.values()) {
                if (batch.claim(workerIndex)) {
                    return Optional.of(batch);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String batchId) {
        lock.lock();
        try {
            return batches.remove(batchId) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the batches no worker has claimed.
     */
    public List<ActiveBatch> removeUnclaimed() {
        lock.lock();
        try {
            List<ActiveBatch> unclaimed = new ArrayList<>();
            Iterator<ActiveBatch> it = batches.values().iterator();
            while (it.hasNext()) {
                ActiveBatch batch = it.next();
                if (!batch.isClaimed()) {
                    unclaimed.add(batch);
                    it.remove();
                }
            }
            return unclaimed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return batches.size();
        } finally {
            lock.unlock();
        }
    }
}
