package fr.lapetina.batchinference.scheduler.exception;

/**
 * Thrown by {@code submit} when the engine cannot accept more work.
 *
 * The request was never queued, so no reply will follow for it.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        QUEUE_FULL("Request queue is at maximum depth");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
