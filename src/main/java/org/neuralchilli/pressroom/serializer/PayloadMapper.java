package org.neuralchilli.pressroom.serializer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for the typed payloads stored inside task records.
 * <p>
 * Hazelcast instantiates serializers itself, outside CDI, so the mapper is a
 * static singleton rather than an injected bean. Output is deterministic:
 * ISO-8601 instants and map entries ordered by key.
 */
public final class PayloadMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);

    private PayloadMapper() {
    }

    public static ObjectMapper get() {
        return MAPPER;
    }
}
