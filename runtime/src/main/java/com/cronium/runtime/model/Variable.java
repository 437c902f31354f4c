package com.cronium.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A named value scoped to one execution.
 *
 * Writing null does not remove the row; it stores a tombstone (value null,
 * type "null") that reads back as not found.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Variable(
        String       key,
        JsonNode     value,
        VariableType type,
        Instant      updatedAt
) {
    public static Variable of(String key, JsonNode value, Instant updatedAt) {
        return new Variable(key, value, VariableType.of(value), updatedAt);
    }

    @JsonIgnore
    public boolean isTombstone() {
        return value == null || value.isNull();
    }
}
