package dev.chainevents.components.eventqueue.consumer;

import dev.chainevents.components.eventqueue.*;

import java.util.*;
import java.util.concurrent.*;

class RecordingEventHandler implements EventHandler {
    final List<EventId>                   handled     = new CopyOnWriteArrayList<>();
    final ConcurrentMap<EventId, Integer>       invocations = new ConcurrentHashMap<>();
    final Set<EventId>                    failFor     = ConcurrentHashMap.newKeySet();

    @Override
    public void handle(QueuedEvent event) {
        invocations.merge(event.id, 1, Integer::sum);
        if (failFor.contains(event.id)) {
            throw new IllegalStateException("Simulated handler failure for " + event.id);
        }
        handled.add(event.id);
    }

    int invocationsFor(EventId eventId) {
        return invocations.getOrDefault(eventId, 0);
    }
}
