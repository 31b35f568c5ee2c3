package dev.chainevents.components.eventqueue.serializer.json;

import dev.chainevents.components.eventqueue.EventQueueException;

public class JSONDeserializationException extends EventQueueException {
    public JSONDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
