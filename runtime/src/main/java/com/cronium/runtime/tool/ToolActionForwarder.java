package com.cronium.runtime.tool;

import com.cronium.runtime.auth.ExecutionClaims;
import com.cronium.runtime.error.ApiException;
import com.cronium.runtime.error.ErrorCode;
import com.cronium.runtime.tool.dto.ToolActionConfig;
import com.cronium.runtime.tool.dto.ToolActionResult;
import com.cronium.runtime.tool.dto.ToolExecutionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates a generic tool action from a script and relays it to the
 * tool-execution subsystem on the script's behalf.
 *
 * The script never sees credentials: the subsystem resolves them from the
 * user id in the verified token.
 *
 * Outcome mapping:
 * <pre>
 *   success=true             → result returned
 *   success=false            → TOOL_ACTION_FAILED (the action ran and failed)
 *   timeout / lost response  → DEADLINE_EXCEEDED (outcome unknown, do not blindly retry)
 *   unreachable / 5xx        → UNAVAILABLE
 *   subsystem 4xx            → INVALID_REQUEST
 * </pre>
 */
@Service
public class ToolActionForwarder {

    private static final Logger log   = LoggerFactory.getLogger(ToolActionForwarder.class);
    private static final Logger audit = LoggerFactory.getLogger("com.cronium.runtime.audit");

    private final ToolExecutorClient client;
    private final ObjectMapper       json;
    private final MeterRegistry      meterRegistry;

    public ToolActionForwarder(ToolExecutorClient client,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry) {
        this.client        = client;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    public ToolActionResult execute(ExecutionClaims claims, ToolActionConfig config) {
        JsonNode params = validate(config);
        String tool   = config.tool().trim();
        String action = config.action().trim();

        log.info("Forwarding tool action {}.{} for {}", tool, action, claims.executionId());
        audit.info("execution={} operation=execute_tool_action detail={}.{}",
                claims.executionId(), tool, action);

        String status = "success";
        try {
            ToolActionResult result = client.execute(new ToolExecutionRequest(
                    claims.executionId(), claims.jobId(), claims.userId(), tool, action, params));
            if (!result.success()) {
                status = "failed";
                String reason = result.error() == null || result.error().isBlank()
                        ? "Tool action failed" : result.error();
                log.info("Tool action {}.{} failed: {}", tool, action, reason);
                throw new ApiException(ErrorCode.TOOL_ACTION_FAILED, reason);
            }
            return result;
        } catch (ToolExecutorException e) {
            status = e.getKind().name().toLowerCase();
            log.warn("Tool action {}.{} for {}: {}", tool, action, claims.executionId(), e.getMessage());
            throw switch (e.getKind()) {
                case TIMEOUT -> new ApiException(ErrorCode.DEADLINE_EXCEEDED,
                        "Tool action did not complete in time; it may or may not have run", e);
                case UNAVAILABLE -> new ApiException(ErrorCode.UNAVAILABLE,
                        "Tool execution service unavailable", e);
                case REJECTED -> new ApiException(ErrorCode.INVALID_REQUEST,
                        "Tool action rejected by tool execution service", e);
            };
        } finally {
            meterRegistry.counter("cronium.runtime.tool_actions",
                    "tool", tool, "status", status).increment();
        }
    }

    /**
     * Check the request shape before anything leaves this process.
     *
     * @return the params object, {} when the caller sent none
     */
    JsonNode validate(ToolActionConfig config) {
        if (config == null) {
            throw ApiException.invalidRequest("Request body is required");
        }
        if (config.tool() == null || config.tool().isBlank()) {
            throw ApiException.invalidRequest("'tool' must not be empty");
        }
        if (config.action() == null || config.action().isBlank()) {
            throw ApiException.invalidRequest("'action' must not be empty");
        }
        JsonNode params = config.params();
        if (params == null || params.isNull() || params.isMissingNode()) {
            return json.createObjectNode();
        }
        if (!params.isObject()) {
            throw ApiException.invalidRequest("'params' must be a JSON object");
        }
        return params;
    }
}
