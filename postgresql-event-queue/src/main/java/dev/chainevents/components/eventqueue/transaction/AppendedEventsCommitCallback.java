package dev.chainevents.components.eventqueue.transaction;

import dev.chainevents.components.common.transaction.UnitOfWork;
import dev.chainevents.components.eventqueue.EventId;

import java.util.List;

/**
 * Callback that is told about the events appended in an {@link EventQueueUnitOfWork} once the {@link UnitOfWork}
 * has completed. Callbacks are only called for units of work that appended at least one event.<br>
 * Exceptions thrown by a callback are logged and otherwise ignored, as the transaction outcome is already final.
 */
public interface AppendedEventsCommitCallback {
    /**
     * The events were committed and are now visible to consumers
     */
    void afterCommit(UnitOfWork unitOfWork, List<EventId> appendedEvents);

    /**
     * The events were rolled back and will never be visible to consumers
     */
    void afterRollback(UnitOfWork unitOfWork, List<EventId> discardedEvents);
}
