package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.domain.model.BatchRequest;
import fr.lapetina.batchinference.scheduler.exception.BackpressureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority-ordered holding area for requests awaiting a batch.
 *
 * Order is {@link BatchRequest#QUEUE_ORDER}; requests that compare equal keep
 * their arrival order. Every mutation happens under one lock, so a request is
 * observed either in the queue or already handed out, never half-moved.
 *
 * Once {@link #closeAndDrain()} has run the queue refuses new requests.
 */
public final class RequestQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<BatchRequest> entries = new ArrayList<>();
    private final int maxDepth;
    private boolean closed;

    /**
     * @param maxDepth capacity, or 0 for unbounded
     */
    public RequestQueue(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public RequestQueue() {
        this(0);
    }

    /**
     * Inserts a request at its priority position.
     *
     * @return false if the queue has been closed
     * @throws BackpressureException if the queue is at capacity
     */
    public boolean enqueue(BatchRequest request) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (maxDepth > 0 && entries.size() >= maxDepth) {
                throw new BackpressureException(
                        BackpressureException.BackpressureReason.QUEUE_FULL,
                        "depth=" + entries.size());
            }
            entries.add(insertionPoint(request), request);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * First index whose entry sorts strictly after {@code request}.
     */
    private int insertionPoint(BatchRequest request) {
        int low = 0;
        int high = entries.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (BatchRequest.QUEUE_ORDER.compare(entries.get(mid), request) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Removes and returns up to {@code n} requests from the front.
     */
    public List<BatchRequest> drainUpTo(int n) {
        lock.lock();
        try {
            int count = Math.min(Math.max(n, 0), entries.size());
            List<BatchRequest> head = entries.subList(0, count);
            List<BatchRequest> drained = new ArrayList<>(head);
            head.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every request whose deadline is at or before {@code now}.
     */
    public List<BatchRequest> removeExpired(Instant now) {
        lock.lock();
        try {
            List<BatchRequest> expired = new ArrayList<>();
            Iterator<BatchRequest> it = entries.iterator();
            while (it.hasNext()) {
                BatchRequest request = it.next();
                if (request.isExpired(now)) {
                    expired.add(request);
                    it.remove();
                }
            }
            return expired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue to new requests and removes everything still in it.
     */
    public List<BatchRequest> closeAndDrain() {
        lock.lock();
        try {
            closed = true;
            List<BatchRequest> drained = new ArrayList<>(entries);
            entries.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the current contents in queue order.
     */
    public List<BatchRequest> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
