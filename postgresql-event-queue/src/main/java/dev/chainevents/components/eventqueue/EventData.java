package dev.chainevents.components.eventqueue;

import dev.chainevents.components.eventqueue.serializer.json.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The opaque payload of an event, stored as a JSON document.<br>
 * The event queue never inspects the document; the {@link EventHandler} registered for the event's {@link EventType}
 * decides how to interpret it, e.g. using {@link #deserialize(Class)} or {@link #asMap()}
 */
public final class EventData {
    private static final JSONSerializer DEFAULT_SERIALIZER = new JacksonJSONSerializer();

    private final String         json;
    private final JSONSerializer jsonSerializer;

    public EventData(String json, JSONSerializer jsonSerializer) {
        this.json = requireNonNull(json, "No json provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    /**
     * Wrap an already serialized JSON document
     */
    public static EventData ofJson(String json) {
        return new EventData(json, DEFAULT_SERIALIZER);
    }

    /**
     * Serialize <code>payload</code> using the provided serializer
     */
    public static EventData of(Object payload, JSONSerializer jsonSerializer) {
        requireNonNull(payload, "No payload provided");
        requireNonNull(jsonSerializer, "No jsonSerializer provided");
        if (payload instanceof EventData) {
            return (EventData) payload;
        }
        return new EventData(jsonSerializer.serialize(payload), jsonSerializer);
    }

    public String getJson() {
        return json;
    }

    /**
     * @throws JSONDeserializationException if the document can't be mapped to <code>javaType</code>
     */
    public <T> T deserialize(Class<T> javaType) {
        return jsonSerializer.deserialize(json, javaType);
    }

    /**
     * @throws JSONDeserializationException if the document isn't a JSON object
     */
    public Map<String, Object> asMap() {
        return jsonSerializer.deserializeToMap(json);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventData)) return false;
        return json.equals(((EventData) o).json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(json);
    }

    @Override
    public String toString() {
        return json;
    }
}
