package com.cronium.runtime.tool.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body sent to the tool-execution subsystem. Identity fields come from the
 * verified token, never from the script.
 */
public record ToolExecutionRequest(
        String   executionId,
        String   jobId,
        String   userId,
        String   tool,
        String   action,
        JsonNode params
) {}
