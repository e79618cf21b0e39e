package fr.lapetina.batchinference.domain.model;

/**
 * Error taxonomy for inference requests.
 * Lets callers tell "never ran" apart from "ran and failed".
 */
public enum ErrorType {
    /** Deadline elapsed before the request was placed into a batch */
    TIMEOUT,

    /** The backend client reported an error for this request */
    BACKEND_ERROR,

    /** Submitted after shutdown, or still queued when shutdown occurred */
    SHUTDOWN,

    /** Internal engine error while processing the request */
    INTERNAL_ERROR
}
