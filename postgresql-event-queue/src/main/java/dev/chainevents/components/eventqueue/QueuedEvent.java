package dev.chainevents.components.eventqueue;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event as stored in the event queue
 */
public class QueuedEvent {
    public final EventId   id;
    public final EventType eventType;
    public final EventData eventData;
    public final boolean   isProcessed;

    public QueuedEvent(EventId id,
                       EventType eventType,
                       EventData eventData,
                       boolean isProcessed) {
        this.id = requireNonNull(id, "No event id provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.eventData = requireNonNull(eventData, "No eventData provided");
        this.isProcessed = isProcessed;
    }

    public EventId id() {
        return id;
    }

    public EventType eventType() {
        return eventType;
    }

    public EventData eventData() {
        return eventData;
    }

    public boolean isProcessed() {
        return isProcessed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueuedEvent)) return false;
        QueuedEvent that = (QueuedEvent) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "QueuedEvent{" +
                "id=" + id +
                ", eventType=" + eventType +
                ", isProcessed=" + isProcessed +
                ", eventData=" + eventData +
                '}';
    }
}
