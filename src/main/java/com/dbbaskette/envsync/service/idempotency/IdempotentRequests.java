package com.dbbaskette.envsync.service.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bridges request objects to the {@link IdempotencyGate}: the payload checksum is the SHA-256 of the
 * request's canonical JSON (sorted properties and map keys) and results travel as JSON text.
 */
@Component
public class IdempotentRequests {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final IdempotencyGate gate;
    private final ObjectMapper objectMapper;

    public IdempotentRequests(IdempotencyGate gate, ObjectMapper objectMapper) {
        this.gate = gate;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs {@code operation} once per key and returns its JSON form; replays return the stored text.
     */
    public String execute(String key, Object request, Supplier<?> operation) {
        return gate.run(key, checksumOf(request), () -> toJson(operation.get()));
    }

    public <T> T execute(String key, Object request, Supplier<T> operation, Class<T> resultType) {
        String json = execute(key, request, operation);
        try {
            return objectMapper.readValue(json, resultType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored idempotent result for " + key + " is unreadable", e);
        }
    }

    public static String checksumOf(Object request) {
        try {
            return IdempotencyGate.checksum(CANONICAL.writeValueAsString(request));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request is not serializable", e);
        }
    }

    private String toJson(Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Result is not serializable", e);
        }
    }
}
