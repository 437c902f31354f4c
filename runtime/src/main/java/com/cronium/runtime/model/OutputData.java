package com.cronium.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** The output payload of an execution. Overwritten on every write. */
public record OutputData(JsonNode data, Instant timestamp) {}
