package com.cronium.runtime.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** Body of POST /executions/{id}/output. Any JSON value, including null. */
public record OutputRequest(JsonNode data) {}
