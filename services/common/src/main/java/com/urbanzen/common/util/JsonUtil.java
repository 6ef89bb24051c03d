package com.urbanzen.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for telemetry, alert and artifact documents.
 */
public final class JsonUtil {

    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    private JsonUtil() {}

    public static ObjectMapper getObjectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Creates a new configured ObjectMapper instance.
     * Use this if you need a separate instance with custom configuration.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        // ISO-8601 strings, not epoch numbers
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Producers may add fields ahead of consumers
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

        return mapper;
    }

    public static String toJson(Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + obj.getClass().getSimpleName() + " to JSON", e);
        }
    }

    /**
     * Deserialize JSON string to object.
     *
     * @throws IllegalArgumentException if the payload is not valid JSON for {@code clazz}
     */
    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return OBJECT_MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + clazz.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }
}
