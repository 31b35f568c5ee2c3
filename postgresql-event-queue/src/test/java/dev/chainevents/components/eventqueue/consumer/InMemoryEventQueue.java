package dev.chainevents.components.eventqueue.consumer;

import dev.chainevents.components.eventqueue.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link EventQueue} test double that keeps events in memory and can simulate store failures
 */
class InMemoryEventQueue implements EventQueue {
    private final TreeMap<Long, QueuedEvent> events = new TreeMap<>();
    private       long                       nextId = 1;

    final AtomicInteger                                    fetchFailuresToSimulate = new AtomicInteger();
    final Set<EventId>                                     failMarkProcessedOnce   = ConcurrentHashMap.newKeySet();
    final ConcurrentMap<EventId, List<MarkProcessedResult>> markResults            = new ConcurrentHashMap<>();

    @Override
    public synchronized EventId append(EventType eventType, Object eventData) {
        var id = EventId.of(nextId++);
        events.put(id.longValue(), new QueuedEvent(id, eventType, EventData.ofJson(eventData.toString()), false));
        return id;
    }

    /**
     * Assign an id like the database sequence does at insert time, without making the event visible yet
     */
    synchronized EventId reserveId() {
        return EventId.of(nextId++);
    }

    /**
     * Make an event with a previously {@link #reserveId() reserved} id visible, like a transaction that commits late
     */
    synchronized void commitReserved(EventId eventId, EventType eventType, String eventData) {
        events.put(eventId.longValue(), new QueuedEvent(eventId, eventType, EventData.ofJson(eventData), false));
    }

    @Override
    public synchronized List<QueuedEvent> fetchUnprocessed(EventId afterId, int limit) {
        if (fetchFailuresToSimulate.getAndUpdate(remaining -> Math.max(remaining - 1, 0)) > 0) {
            throw new EventQueueException("Simulated connection failure");
        }
        var result = new ArrayList<QueuedEvent>();
        for (var event : events.tailMap(afterId.longValue(), false).values()) {
            if (result.size() == limit) {
                break;
            }
            if (!event.isProcessed) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public MarkProcessedResult markProcessed(EventId eventId) {
        if (failMarkProcessedOnce.remove(eventId)) {
            throw new EventQueueException("Simulated crash before the processed transition committed", eventId);
        }
        MarkProcessedResult result;
        synchronized (this) {
            var event = events.get(eventId.longValue());
            if (event == null) {
                result = MarkProcessedResult.NOT_FOUND;
            } else if (event.isProcessed) {
                result = MarkProcessedResult.ALREADY_PROCESSED;
            } else {
                events.put(eventId.longValue(), new QueuedEvent(eventId, event.eventType, event.eventData, true));
                result = MarkProcessedResult.SUCCESS;
            }
        }
        markResults.computeIfAbsent(eventId, id -> new CopyOnWriteArrayList<>()).add(result);
        return result;
    }

    @Override
    public synchronized Optional<QueuedEvent> getEvent(EventId eventId) {
        return Optional.ofNullable(events.get(eventId.longValue()));
    }

    @Override
    public synchronized long getTotalUnprocessedEvents() {
        return events.values().stream().filter(event -> !event.isProcessed).count();
    }

    @Override
    public synchronized int deleteProcessedEvents() {
        var before = events.size();
        events.values().removeIf(QueuedEvent::isProcessed);
        return before - events.size();
    }

    @Override
    public EventQueueConsumer consume(EventQueueConsumerConfiguration configuration, EventHandlers eventHandlers) {
        var consumer = DefaultEventQueueConsumer.create(this,
                                                        configuration,
                                                        eventHandlers,
                                                        callback -> Optional.empty(),
                                                        c -> {
                                                        });
        consumer.start();
        return consumer;
    }

    long successfulMarksFor(EventId eventId) {
        return markResults.getOrDefault(eventId, List.of())
                          .stream()
                          .filter(result -> result == MarkProcessedResult.SUCCESS)
                          .count();
    }
}
