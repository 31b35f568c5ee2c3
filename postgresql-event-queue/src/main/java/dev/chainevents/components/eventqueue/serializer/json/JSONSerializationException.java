package dev.chainevents.components.eventqueue.serializer.json;

import dev.chainevents.components.eventqueue.EventQueueException;

public class JSONSerializationException extends EventQueueException {
    public JSONSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
