package com.cronium.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON type of a stored variable value, reported back to SDKs so they can
 * restore the native type.
 */
public enum VariableType {
    STRING, NUMBER, BOOLEAN, OBJECT, ARRAY, NULL;

    public static VariableType of(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return NULL;
        if (value.isTextual())   return STRING;
        if (value.isNumber())    return NUMBER;
        if (value.isBoolean())   return BOOLEAN;
        if (value.isArray())     return ARRAY;
        return OBJECT;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
