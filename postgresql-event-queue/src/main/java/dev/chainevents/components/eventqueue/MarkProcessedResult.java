package dev.chainevents.components.eventqueue;

/**
 * Outcome of {@link EventQueue#markProcessed(EventId)}
 */
public enum MarkProcessedResult {
    /**
     * This caller performed the unprocessed to processed transition
     */
    SUCCESS,
    /**
     * Another caller already performed the transition
     */
    ALREADY_PROCESSED,
    /**
     * No event with the given id exists (never appended, rolled back or deleted)
     */
    NOT_FOUND
}
