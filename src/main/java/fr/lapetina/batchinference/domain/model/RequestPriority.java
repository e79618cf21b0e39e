package fr.lapetina.batchinference.domain.model;

/**
 * Caller-assigned urgency tier. Declaration order is significant:
 * later constants are scheduled sooner.
 */
public enum RequestPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
