package com.cronium.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/** Metadata about the event and run that started this script. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventContext(
        String                executionId,
        String                eventId,
        String                eventName,
        String                eventType,
        String                userId,
        Instant               startTime,
        Map<String, JsonNode> metadata
) {
    public EventContext {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
