package dev.chainevents.components.eventqueue.transaction;

import dev.chainevents.components.common.transaction.*;
import dev.chainevents.components.eventqueue.*;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link UnitOfWorkFactory} variant where the {@link EventQueue} manages the {@link UnitOfWork} and the underlying
 * database transaction itself.<br>
 * If the {@link EventQueue} {@link UnitOfWork} needs to join an existing <b>Spring</b> managed transaction then use
 * the <code>SpringManagedUnitOfWorkFactory</code> from the <b>spring-postgresql-event-queue</b> module instead.
 */
public class EventQueueManagedUnitOfWorkFactory extends GenericHandleAwareUnitOfWorkFactory<EventQueueUnitOfWork> implements EventQueueUnitOfWorkFactory {
    private final List<AppendedEventsCommitCallback> callbacks = new CopyOnWriteArrayList<>();

    public EventQueueManagedUnitOfWorkFactory(Jdbi jdbi) {
        super(jdbi);
    }

    @Override
    protected EventQueueUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<EventQueueUnitOfWork> unitOfWorkFactory) {
        return new EventQueueManagedUnitOfWork(unitOfWorkFactory, callbacks);
    }

    @Override
    public EventQueueUnitOfWorkFactory registerAppendedEventsCommitCallback(AppendedEventsCommitCallback callback) {
        callbacks.add(requireNonNull(callback, "No callback provided"));
        return this;
    }

    private static class EventQueueManagedUnitOfWork extends GenericHandleAwareUnitOfWork implements EventQueueUnitOfWork {
        private static final Logger log = LoggerFactory.getLogger(EventQueueManagedUnitOfWork.class);

        /**
         * The list is maintained by the {@link EventQueueManagedUnitOfWorkFactory} and provided in the constructor
         */
        private final List<AppendedEventsCommitCallback> callbacks;
        private final List<EventId>                      appendedEvents = new ArrayList<>();

        EventQueueManagedUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory,
                                    List<AppendedEventsCommitCallback> callbacks) {
            super(unitOfWorkFactory);
            this.callbacks = requireNonNull(callbacks, "No callbacks provided");
        }

        @Override
        public void registerEventAppended(EventId eventId, EventType eventType) {
            requireNonNull(eventId, "No eventId provided");
            log.trace("Registering {} event '{}' appended in this UnitOfWork", eventType, eventId);
            appendedEvents.add(eventId);
        }

        @Override
        public List<EventId> appendedEvents() {
            return Collections.unmodifiableList(appendedEvents);
        }

        @Override
        protected void afterCommitting() {
            if (appendedEvents.isEmpty()) {
                return;
            }
            var committed = List.copyOf(appendedEvents);
            for (var callback : callbacks) {
                try {
                    log.trace("AfterCommit AppendedEvents for {} with {} appended events", callback.getClass().getName(), committed.size());
                    callback.afterCommit(this, committed);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterCommit AppendedEvents", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        protected void afterRollback(Exception cause) {
            if (appendedEvents.isEmpty()) {
                return;
            }
            var discarded = List.copyOf(appendedEvents);
            for (var callback : callbacks) {
                try {
                    log.trace("AfterRollback AppendedEvents for {} with {} discarded events", callback.getClass().getName(), discarded.size());
                    callback.afterRollback(this, discarded);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterRollback AppendedEvents", callback.getClass().getName()), e);
                }
            }
        }
    }
}
