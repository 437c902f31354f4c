package com.cronium.runtime.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** Body of PUT /executions/{id}/variables/{key}. A null value deletes the variable. */
public record VariableRequest(JsonNode value) {}
