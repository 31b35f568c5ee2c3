package dev.chainevents.components.eventqueue;

/**
 * Business handler for events of a single {@link EventType}.<br>
 * <b>Handlers MUST be idempotent:</b> the same event can be delivered more than once, e.g. when two consumers
 * race for it or when a consumer stops after the handler completed but before the event was marked as processed.
 * Running a handler again for an event it already effected must be a no-op or converge to the same state.
 */
@FunctionalInterface
public interface EventHandler {
    /**
     * Handle the event. Returning normally marks the event as processed, throwing leaves it unprocessed so it will be
     * delivered again later
     *
     * @param event the event to handle
     * @throws Exception if the event couldn't be handled
     */
    void handle(QueuedEvent event) throws Exception;
}
