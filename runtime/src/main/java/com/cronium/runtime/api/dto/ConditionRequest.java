package com.cronium.runtime.api.dto;

/**
 * Body of POST /executions/{id}/condition.
 * Boxed so a missing or null field can be told apart from false.
 */
public record ConditionRequest(Boolean condition) {}
