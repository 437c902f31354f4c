package com.cronium.sdk.model;

import java.util.Map;

/** Body of POST /tool-actions/execute. */
public record ToolActionRequest(String tool, String action, Map<String, Object> params) {}
