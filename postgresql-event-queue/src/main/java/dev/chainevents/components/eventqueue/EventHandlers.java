package dev.chainevents.components.eventqueue;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The set of {@link EventHandler}'s a consumer supplies - exactly one per {@link EventType}
 */
public final class EventHandlers {
    private final EnumMap<EventType, EventHandler> handlers;

    private EventHandlers(EnumMap<EventType, EventHandler> handlers) {
        this.handlers = handlers;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Use the same handler for every {@link EventType}
     */
    public static EventHandlers forAllEventTypes(EventHandler eventHandler) {
        requireNonNull(eventHandler, "No eventHandler provided");
        var builder = builder();
        for (var eventType : EventType.values()) {
            builder.on(eventType, eventHandler);
        }
        return builder.build();
    }

    public EventHandler handlerFor(EventType eventType) {
        requireNonNull(eventType, "No eventType provided");
        return handlers.get(eventType);
    }

    public static final class Builder {
        private final EnumMap<EventType, EventHandler> handlers = new EnumMap<>(EventType.class);

        public Builder on(EventType eventType, EventHandler eventHandler) {
            requireNonNull(eventType, "No eventType provided");
            requireNonNull(eventHandler, "No eventHandler provided");
            if (handlers.putIfAbsent(eventType, eventHandler) != null) {
                throw new IllegalArgumentException(msg("A handler for event type {} has already been registered", eventType));
            }
            return this;
        }

        public Builder onAccount(EventHandler eventHandler) {
            return on(EventType.ACCOUNT, eventHandler);
        }

        public Builder onBlock(EventHandler eventHandler) {
            return on(EventType.BLOCK, eventHandler);
        }

        public Builder onTransaction(EventHandler eventHandler) {
            return on(EventType.TRANSACTION, eventHandler);
        }

        /**
         * @throws IllegalArgumentException if a handler is missing for one or more {@link EventType}'s
         */
        public EventHandlers build() {
            var missing = EnumSet.complementOf(handlers.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(handlers.keySet()));
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException(msg("No handler registered for event type(s) {}", missing));
            }
            return new EventHandlers(new EnumMap<>(handlers));
        }
    }
}
