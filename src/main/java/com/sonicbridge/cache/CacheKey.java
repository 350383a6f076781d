package com.sonicbridge.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * Cache key built from an operation and the semantic parameters of its query.
 *
 * Parameters are serialized with sorted property and map keys, so two queries with
 * the same values produce the same key whatever order they were assembled in.
 */
public final class CacheKey {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .build();

    private final CacheOperation operation;
    private final String value;

    private CacheKey(CacheOperation operation, String value) {
        this.operation = operation;
        this.value = value;
    }

    /**
     * Key for a parameterized query
     *
     * @throws IllegalArgumentException if the parameters cannot be serialized
     */
    public static CacheKey of(CacheOperation operation, Object parameters) {
        try {
            return new CacheKey(operation, operation.getValue() + ":" + CANONICAL.writeValueAsString(parameters));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot build cache key for " + operation, e);
        }
    }

    /**
     * Key for a query without parameters
     */
    public static CacheKey of(CacheOperation operation) {
        return new CacheKey(operation, operation.getValue() + ":current");
    }

    public CacheOperation getOperation() {
        return operation;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        return value.equals(((CacheKey) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
