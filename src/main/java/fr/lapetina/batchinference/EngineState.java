package fr.lapetina.batchinference;

/**
 * Lifecycle of a {@link BatchInferenceEngine}.
 *
 * STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED. An engine that has
 * been shut down stays STOPPED and cannot be started again.
 */
public enum EngineState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
