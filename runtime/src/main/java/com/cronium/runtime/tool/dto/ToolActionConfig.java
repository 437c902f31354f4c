package com.cronium.runtime.tool.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /tool-actions/execute.
 *
 * params is the tool-specific parameter object. Older SDKs send it as
 * "config", which is accepted too.
 */
public record ToolActionConfig(
        String   tool,
        String   action,
        @JsonAlias("config") JsonNode params
) {}
