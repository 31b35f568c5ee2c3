package dev.chainevents.components.eventqueue.transaction;

import dev.chainevents.components.common.transaction.*;

public interface EventQueueUnitOfWorkFactory extends HandleAwareUnitOfWorkFactory<EventQueueUnitOfWork> {
    /**
     * Register a callback that will be told about the events appended during each {@link UnitOfWork}
     *
     * @param callback the callback to register
     * @return the {@link UnitOfWorkFactory} instance this method was called on
     */
    EventQueueUnitOfWorkFactory registerAppendedEventsCommitCallback(AppendedEventsCommitCallback callback);
}
