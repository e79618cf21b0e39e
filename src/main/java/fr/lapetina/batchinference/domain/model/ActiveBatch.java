package fr.lapetina.batchinference.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A scheduled group of requests awaiting, or undergoing, dispatch.
 *
 * The claim state is not synchronized here: it must only be read and changed
 * while holding the lock of the collection the batch lives in. Once claimed,
 * the batch belongs to a single worker and is never handed out again.
 */
public final class ActiveBatch {

    private final String id;
    private final List<BatchRequest> requests;
    private final Instant startedAt;

    private boolean claimed;
    private volatile Integer assignedWorker;

    public ActiveBatch(List<BatchRequest> requests) {
        this(UUID.randomUUID().toString(), requests, Instant.now());
    }

    public ActiveBatch(String id, List<BatchRequest> requests, Instant startedAt) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one request");
        }
        this.id = id;
        this.requests = List.copyOf(requests);
        this.startedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public List<BatchRequest> getRequests() {
        return requests;
    }

    public int size() {
        return requests.size();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public boolean isClaimed() {
        return claimed;
    }

    /**
     * Worker index that claimed this batch, or null while unclaimed.
     */
    public Integer getAssignedWorker() {
        return assignedWorker;
    }

    /**
     * Flips the batch to claimed. Caller must hold the owning collection's lock.
     *
     * @return false if another worker already claimed it
     */
    public boolean claim(int workerIndex) {
        if (claimed) {
            return false;
        }
        claimed = true;
        assignedWorker = workerIndex;
        return true;
    }

    /**
     * Mean time the batch's requests spent queued before the batch was formed.
     */
    public Duration averageWaitTime() {
        long totalMillis = 0;
        for (BatchRequest request : requests) {
            totalMillis += Math.max(0, Duration.between(request.getCreatedAt(), startedAt).toMillis());
        }
        return Duration.ofMillis(totalMillis / requests.size());
    }

    @Override
    public String toString() {
        return "ActiveBatch{" +
                "id='" + id + '\'' +
                ", size=" + requests.size() +
                ", claimed=" + claimed +
                ", assignedWorker=" + assignedWorker +
                '}';
    }
}
