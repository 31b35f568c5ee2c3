package dev.chainevents.components.eventqueue;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base exception for failures raised by the {@link EventQueue} and its consumers
 */
public class EventQueueException extends RuntimeException {
    public final Optional<EventId> eventId;

    public EventQueueException(String message) {
        this(message, null, null);
    }

    public EventQueueException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public EventQueueException(String message, EventId eventId) {
        this(message, null, eventId);
    }

    public EventQueueException(String message, Throwable cause, EventId eventId) {
        super(enrichMessage(message, eventId), cause);
        this.eventId = Optional.ofNullable(eventId);
    }

    private static String enrichMessage(String message, EventId eventId) {
        if (eventId == null) {
            return message;
        }
        return msg("[{}] {}", eventId, message != null ? message : "");
    }
}
