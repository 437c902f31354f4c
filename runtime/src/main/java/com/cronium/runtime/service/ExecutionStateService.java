package com.cronium.runtime.service;

import com.cronium.runtime.error.ApiException;
import com.cronium.runtime.model.*;
import com.cronium.runtime.store.ExecutionStateStore;
import com.cronium.runtime.store.StateKey;
import com.cronium.runtime.store.StateStoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-execution state operations behind the /executions routes.
 *
 * Every method takes the execution id from verified claims; callers must
 * never pass an id taken from the request path or body without checking it
 * against the token first.
 *
 * Each operation is timed and counted:
 * <pre>
 *   cronium.runtime.operations{operation, status}
 * </pre>
 * and leaves one line on the audit logger.
 */
@Service
public class ExecutionStateService {

    private static final Logger log   = LoggerFactory.getLogger(ExecutionStateService.class);
    private static final Logger audit = LoggerFactory.getLogger("com.cronium.runtime.audit");

    static final int MAX_KEY_LENGTH = 256;

    // Context metadata field the orchestrator may use to hand over input.
    private static final String METADATA_INPUT = "input";

    private final ExecutionStateStore store;
    private final ObjectMapper        json;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;

    public ExecutionStateService(ExecutionStateStore store,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.store         = store;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Input / output
    // ------------------------------------------------------------------

    /**
     * Return the execution's input.
     *
     * Falls back to the "input" field of the execution context metadata when
     * no input entry was written, and stores it as the input entry so later
     * reads are direct.
     *
     * @throws ApiException NOT_FOUND if the execution has no input at all
     */
    public InputData getInput(String executionId) {
        return timed("get_input", () -> {
            Optional<InputData> stored = read(StateKey.input(executionId), InputData.class);
            if (stored.isPresent()) {
                audit(executionId, "get_input", null);
                return stored.get();
            }

            JsonNode fromMetadata = read(StateKey.context(executionId), ExecutionContext.class)
                    .map(ctx -> ctx.metadata().get(METADATA_INPUT))
                    .orElse(null);
            if (fromMetadata == null) {
                throw ApiException.notFound("No input for this execution");
            }
            InputData input = new InputData(fromMetadata, clock.instant());
            write(StateKey.input(executionId), input);
            log.debug("Input for {} taken from context metadata", executionId);
            audit(executionId, "get_input", null);
            return input;
        });
    }

    /** Overwrite the execution's output. Repeating the call with the same data is harmless. */
    public void setOutput(String executionId, JsonNode data) {
        timed("set_output", () -> {
            write(StateKey.output(executionId), new OutputData(orNull(data), clock.instant()));
            log.info("Output set for {}", executionId);
            audit(executionId, "set_output", null);
            return null;
        });
    }

    public OutputData getOutput(String executionId) {
        return timed("get_output", () -> read(StateKey.output(executionId), OutputData.class)
                .orElseThrow(() -> ApiException.notFound("No output for this execution")));
    }

    // ------------------------------------------------------------------
    // Variables
    // ------------------------------------------------------------------

    /**
     * @throws ApiException NOT_FOUND if the variable was never set or was deleted
     */
    public Variable getVariable(String executionId, String key) {
        validateKey(key);
        return timed("get_variable", () -> {
            Variable variable = read(StateKey.variable(executionId, key), Variable.class)
                    .filter(v -> !v.isTombstone())
                    .orElseThrow(() -> ApiException.notFound("Variable '" + key + "' not found"));
            audit(executionId, "get_variable", key);
            return variable;
        });
    }

    /**
     * Set a variable, overwriting any previous value. A null (or JSON null)
     * value deletes the variable by writing a tombstone.
     */
    public Variable setVariable(String executionId, String key, JsonNode value) {
        validateKey(key);
        return timed("set_variable", () -> {
            Variable variable = Variable.of(key, orNull(value), clock.instant());
            write(StateKey.variable(executionId, key), variable);
            log.info("Variable '{}' {} for {}", key, variable.isTombstone() ? "deleted" : "set", executionId);
            audit(executionId, variable.isTombstone() ? "delete_variable" : "set_variable", key);
            return variable;
        });
    }

    // ------------------------------------------------------------------
    // Condition / context
    // ------------------------------------------------------------------

    public ConditionResult setCondition(String executionId, boolean condition) {
        return timed("set_condition", () -> {
            ConditionResult result = new ConditionResult(condition, clock.instant());
            write(StateKey.condition(executionId), result);
            log.info("Condition set to {} for {}", condition, executionId);
            audit(executionId, "set_condition", String.valueOf(condition));
            return result;
        });
    }

    /** Read side for the orchestrator once the script has finished. */
    public Optional<ConditionResult> getCondition(String executionId) {
        return timed("get_condition", () -> read(StateKey.condition(executionId), ConditionResult.class));
    }

    public ExecutionContext getContext(String executionId) {
        return timed("get_context", () -> {
            ExecutionContext context = read(StateKey.context(executionId), ExecutionContext.class)
                    .orElseThrow(() -> ApiException.notFound("No context for this execution"));
            audit(executionId, "get_context", null);
            return context;
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw ApiException.invalidRequest("Variable key must not be empty");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw ApiException.invalidRequest("Variable key longer than " + MAX_KEY_LENGTH + " characters");
        }
        if (key.indexOf('/') >= 0 || key.chars().anyMatch(Character::isISOControl)) {
            throw ApiException.invalidRequest("Variable key contains illegal characters");
        }
    }

    private <T> Optional<T> read(StateKey key, Class<T> type) {
        return store.get(key).map(node -> {
            try {
                return json.treeToValue(node, type);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Unreadable state entry " + key, e);
            }
        });
    }

    private void write(StateKey key, Object value) {
        store.put(key, json.valueToTree(value));
    }

    private JsonNode orNull(JsonNode value) {
        return value == null ? json.nullNode() : value;
    }

    private static void audit(String executionId, String operation, String detail) {
        if (detail == null) {
            audit.info("execution={} operation={}", executionId, operation);
        } else {
            audit.info("execution={} operation={} detail={}", executionId, operation, detail);
        }
    }

    private <T> T timed(String operation, Supplier<T> op) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return op.get();
        } catch (ApiException e) {
            status = e.getCode().wireName();
            throw e;
        } catch (StateStoreUnavailableException e) {
            status = "unavailable";
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("cronium.runtime.operations",
                    "operation", operation, "status", status));
        }
    }
}
