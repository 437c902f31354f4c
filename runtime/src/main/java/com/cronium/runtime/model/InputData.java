package com.cronium.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** The single input payload of an execution, set by the orchestrator. */
public record InputData(JsonNode data, Instant timestamp) {}
