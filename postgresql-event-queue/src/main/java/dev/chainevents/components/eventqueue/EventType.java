package dev.chainevents.components.eventqueue;

import java.util.Arrays;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The closed set of event types. The type decides which {@link EventHandler} processes an event; the event's
 * {@link EventData} is interpreted by that handler alone.
 */
public enum EventType {
    ACCOUNT,
    BLOCK,
    TRANSACTION;

    /**
     * Resolve an event type from its tag
     *
     * @param tag the tag (e.g. <code>BLOCK</code>)
     * @return the matching {@link EventType}
     * @throws IllegalArgumentException if <code>tag</code> isn't one of the known tags
     */
    public static EventType of(String tag) {
        requireNonNull(tag, "No event type tag provided");
        for (var eventType : values()) {
            if (eventType.name().equals(tag)) {
                return eventType;
            }
        }
        throw new IllegalArgumentException(msg("Unknown event type '{}'. Supported event types: {}",
                                               tag,
                                               Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "))));
    }
}
