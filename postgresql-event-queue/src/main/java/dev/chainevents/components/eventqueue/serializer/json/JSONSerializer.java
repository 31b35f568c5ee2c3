package dev.chainevents.components.eventqueue.serializer.json;

import java.util.Map;

/**
 * Serializer used to convert writer supplied payloads into the <code>event_data</code> JSON document and back
 */
public interface JSONSerializer {
    /**
     * Serialize a java object to JSON
     *
     * @param objectToSerialize the java object that will be serialized to JSON
     * @return the JSON document
     * @throws JSONSerializationException in case the object couldn't be serialized
     */
    String serialize(Object objectToSerialize);

    /**
     * Deserialize <code>json</code> into the given Java type
     *
     * @param json     the JSON document
     * @param javaType the type to deserialize into
     * @param <T>      the corresponding Java type
     * @return the deserialized object
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);

    /**
     * Deserialize a JSON object document into a generic key/value map
     *
     * @param json the JSON document
     * @return the document as an ordered map
     * @throws JSONDeserializationException in case the json isn't a JSON object
     */
    Map<String, Object> deserializeToMap(String json);
}
