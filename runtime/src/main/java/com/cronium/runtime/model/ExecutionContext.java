package com.cronium.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only metadata about the event and job that started an execution.
 * Written by the orchestrator before the script starts; never mutated here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionContext(
        String                executionId,
        String                eventId,
        String                eventName,
        String                eventType,
        String                userId,
        Instant               startTime,
        Map<String, JsonNode> metadata
) {
    public ExecutionContext {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
