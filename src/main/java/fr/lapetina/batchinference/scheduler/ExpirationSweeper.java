package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.domain.model.BatchRequest;
import fr.lapetina.batchinference.domain.model.EngineMetrics;
import fr.lapetina.batchinference.domain.model.ErrorType;
import fr.lapetina.batchinference.domain.model.InferenceResponse;
import fr.lapetina.batchinference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Periodic task that removes queued requests past their deadline and replies
 * to them with {@link ErrorType#TIMEOUT}.
 *
 * Only the queue is inspected. Requests already in a batch are in flight and
 * belong to the worker holding that batch.
 */
public final class ExpirationSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweeper.class);

    private final RequestQueue queue;
    private final EngineMetrics metrics;
    private final MetricsRegistry metricsRegistry;
    private final BooleanSupplier running;

    public ExpirationSweeper(
            RequestQueue queue,
            EngineMetrics metrics,
            MetricsRegistry metricsRegistry,
            BooleanSupplier running
    ) {
        this.queue = queue;
        this.metrics = metrics;
        this.metricsRegistry = metricsRegistry;
        this.running = running;
    }

    @Override
    public void run() {
        if (!running.getAsBoolean()) {
            return;
        }
        try {
            sweep(Instant.now());
        } catch (Exception e) {
            // An escaping exception would cancel the periodic schedule
            log.error("Expiration sweep failed", e);
        }
    }

    /**
     * Expires every request whose deadline is at or before {@code now}.
     *
     * @return number of requests that received a timeout reply
     */
    public int sweep(Instant now) {
        List<BatchRequest> expired = queue.removeExpired(now);
        if (expired.isEmpty()) {
            return 0;
        }

        // Replies go out after the queue lock has been released
        int delivered = 0;
        for (BatchRequest request : expired) {
            boolean sent = request.reply(
                    InferenceResponse.error(request, ErrorType.TIMEOUT, "Request timed out"),
                    () -> {
                        metrics.recordExpired(1);
                        metricsRegistry.recordExpired(1);
                    });
            if (sent) {
                delivered++;
            }
            log.warn("Request timed out: requestId={}, priority={}, waitedMs={}",
                    request.getId(),
                    request.getPriority(),
                    now.toEpochMilli() - request.getCreatedAt().toEpochMilli());
        }

        log.debug("Expired {} queued requests", delivered);
        return delivered;
    }
}
