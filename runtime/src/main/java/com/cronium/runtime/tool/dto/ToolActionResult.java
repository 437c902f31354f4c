package com.cronium.runtime.tool.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of the tool-execution subsystem for one action.
 * Must match the body returned by the backend's /api/internal/tools/execute.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolActionResult(
        boolean  success,
        JsonNode data,
        String   error,
        JsonNode metadata
) {}
