package com.cronium.runtime.model;

import java.time.Instant;

/** Workflow branch selection reported by the script, read by the orchestrator after completion. */
public record ConditionResult(boolean result, Instant timestamp) {}
