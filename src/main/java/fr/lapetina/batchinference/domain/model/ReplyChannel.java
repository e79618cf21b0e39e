package fr.lapetina.batchinference.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use reply channel between the engine and the submitter.
 *
 * The engine writes exactly one {@link InferenceResponse}; any later write is
 * rejected and logged. The submitter only ever sees a dependent copy of the
 * underlying future, so it cannot complete the channel itself.
 */
public final class ReplyChannel {

    private static final Logger log = LoggerFactory.getLogger(ReplyChannel.class);

    private final CompletableFuture<InferenceResponse> future = new CompletableFuture<>();
    private final AtomicBoolean delivered = new AtomicBoolean(false);

    /**
     * Delivers the terminal outcome.
     *
     * @return true if this call delivered it, false if a reply was already sent
     */
    public boolean deliver(InferenceResponse response) {
        return deliver(response, () -> { });
    }

    /**
     * Delivers the terminal outcome, running {@code onAccepted} once the
     * channel is won and before the submitter can observe the response.
     *
     * @return true if this call delivered it, false if a reply was already sent
     */
    public boolean deliver(InferenceResponse response, Runnable onAccepted) {
        if (!delivered.compareAndSet(false, true)) {
            log.warn("Duplicate reply rejected: requestId={}, errorType={}",
                    response.requestId(), response.errorType());
            return false;
        }
        try {
            onAccepted.run();
        } finally {
            future.complete(response);
        }
        return true;
    }

    public boolean isDelivered() {
        return delivered.get();
    }

    /**
     * Returns the read side of the channel.
     */
    public CompletableFuture<InferenceResponse> future() {
        return future.copy();
    }
}
