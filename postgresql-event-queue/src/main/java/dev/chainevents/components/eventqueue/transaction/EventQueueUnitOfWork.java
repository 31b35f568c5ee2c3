package dev.chainevents.components.eventqueue.transaction;

import dev.chainevents.components.common.transaction.*;
import dev.chainevents.components.eventqueue.*;

import java.util.List;

/**
 * Variant of the {@link UnitOfWork} that allows the {@link EventQueue} to register the events appended during the
 * {@link UnitOfWork}, such that {@link AppendedEventsCommitCallback}'s can be told once the outcome is known
 */
public interface EventQueueUnitOfWork extends HandleAwareUnitOfWork {
    void registerEventAppended(EventId eventId, EventType eventType);

    /**
     * @return the ids of the events appended in this {@link UnitOfWork}, in the order they were appended
     */
    List<EventId> appendedEvents();
}
