package dev.chainevents.components.eventqueue;

import dev.chainevents.components.common.transaction.*;

import java.util.*;

/**
 * Durable event log with processing status.<br>
 * Writers {@link #append(EventType, Object)} events inside their own {@link UnitOfWork}, so an event only exists if
 * the business change that produced it was committed. Consumers created through {@link #consume(EventQueueConsumerConfiguration, EventHandlers)}
 * discover unprocessed events, hand them to the matching {@link EventHandler} and {@link #markProcessed(EventId)} them.
 */
public interface EventQueue {
    /**
     * Append a new, unprocessed event. MUST be called inside an active {@link UnitOfWork}: if that unit of work is
     * rolled back the event never exists.
     *
     * @param eventType the event type
     * @param eventData either an {@link EventData} or an object that will be serialized to JSON
     * @return the id assigned by the store
     * @throws NoActiveUnitOfWorkException if there's no active {@link UnitOfWork}
     */
    EventId append(EventType eventType, Object eventData);

    /**
     * Fetch unprocessed events with an id strictly greater than <code>afterId</code>, in ascending id order
     *
     * @param afterId the cursor - use {@link EventId#NONE} to start from the beginning
     * @param limit   the maximum number of events returned
     * @return up to <code>limit</code> unprocessed events
     */
    List<QueuedEvent> fetchUnprocessed(EventId afterId, int limit);

    /**
     * Conditionally transition an event from unprocessed to processed. Safe to call concurrently for the same id:
     * exactly one caller observes {@link MarkProcessedResult#SUCCESS}
     *
     * @param eventId the event id
     * @return the outcome of the transition
     */
    MarkProcessedResult markProcessed(EventId eventId);

    Optional<QueuedEvent> getEvent(EventId eventId);

    long getTotalUnprocessedEvents();

    /**
     * Delete all processed events. Ids are never reused, so cursors stay valid
     *
     * @return the number of events deleted
     */
    int deleteProcessedEvents();

    /**
     * Create and start a consumer that dispatches unprocessed events to <code>eventHandlers</code>
     *
     * @param configuration the consumer configuration
     * @param eventHandlers one handler per {@link EventType}
     * @return the started consumer
     */
    EventQueueConsumer consume(EventQueueConsumerConfiguration configuration, EventHandlers eventHandlers);
}
