package dev.chainevents.components.eventqueue;

import dk.cloudcreate.essentials.types.LongType;

/**
 * The identifier the event store assigns to an appended event.<br>
 * Ids are ever-growing and never reused, so they double as the ordering key for cursor based scans.
 * The first id assigned is 1 (the initial value of a PostgreSQL BIGSERIAL column).
 */
public class EventId extends LongType<EventId> {
    /**
     * Cursor value that means "from the beginning" - no event has this id
     */
    public static final EventId NONE = EventId.of(0);

    public EventId(Long value) {
        super(value);
    }

    public static EventId of(long value) {
        return new EventId(value);
    }

    /**
     * Parse the textual id published on the notification channel
     *
     * @param value the textual id
     * @return the parsed {@link EventId}
     * @throws NumberFormatException if <code>value</code> isn't a number
     */
    public static EventId parse(String value) {
        return new EventId(Long.parseLong(value.trim()));
    }

    public boolean isAfter(EventId other) {
        return longValue() > other.longValue();
    }
}
