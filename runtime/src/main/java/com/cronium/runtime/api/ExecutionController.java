package com.cronium.runtime.api;

import com.cronium.runtime.api.dto.ApiResponse;
import com.cronium.runtime.api.dto.ConditionRequest;
import com.cronium.runtime.api.dto.OutputRequest;
import com.cronium.runtime.api.dto.VariableRequest;
import com.cronium.runtime.auth.ExecutionClaims;
import com.cronium.runtime.error.ApiException;
import com.cronium.runtime.model.ConditionResult;
import com.cronium.runtime.model.ExecutionContext;
import com.cronium.runtime.model.InputData;
import com.cronium.runtime.model.OutputData;
import com.cronium.runtime.model.Variable;
import com.cronium.runtime.service.ExecutionStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

/**
 * REST API a running script uses to exchange state with the platform.
 *
 * GET  /executions/{id}/input            input data for the execution
 * POST /executions/{id}/output           set the execution's output
 * GET  /executions/{id}/output           read the output back
 * GET  /executions/{id}/context          execution context metadata
 * POST /executions/{id}/condition        set the conditional-flow flag
 * GET  /executions/{id}/variables/{key}  read a variable
 * PUT  /executions/{id}/variables/{key}  set (or, with a null value, delete) a variable
 *
 * The path id must match the token's executionId; a mismatch is rejected
 * before any state is touched.
 */
@RestController
@RequestMapping("/executions/{id}")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final ExecutionStateService stateService;

    public ExecutionController(ExecutionStateService stateService) {
        this.stateService = stateService;
    }

    @GetMapping("/input")
    public ApiResponse<Object> getInput(@PathVariable String id, ExecutionClaims claims) {
        requireOwnership(claims, id);
        InputData input = stateService.getInput(claims.executionId());
        return ApiResponse.ok(input.data());
    }

    @PostMapping("/output")
    public ApiResponse<Void> setOutput(@PathVariable String id,
                                       @RequestBody OutputRequest req,
                                       ExecutionClaims claims) {
        requireOwnership(claims, id);
        stateService.setOutput(claims.executionId(), req.data());
        return ApiResponse.ok();
    }

    @GetMapping("/output")
    public ApiResponse<OutputData> getOutput(@PathVariable String id, ExecutionClaims claims) {
        requireOwnership(claims, id);
        return ApiResponse.ok(stateService.getOutput(claims.executionId()));
    }

    @GetMapping("/context")
    public ApiResponse<ExecutionContext> getContext(@PathVariable String id, ExecutionClaims claims) {
        requireOwnership(claims, id);
        return ApiResponse.ok(stateService.getContext(claims.executionId()));
    }

    /**
     * Set the condition flag used by conditional flows.
     * The body must carry a boolean; {"condition": null} or a missing field is rejected.
     */
    @PostMapping("/condition")
    public ApiResponse<ConditionResult> setCondition(@PathVariable String id,
                                                     @RequestBody ConditionRequest req,
                                                     ExecutionClaims claims) {
        requireOwnership(claims, id);
        if (req.condition() == null) {
            throw ApiException.invalidRequest("'condition' must be true or false");
        }
        return ApiResponse.ok(stateService.setCondition(claims.executionId(), req.condition()));
    }

    @GetMapping("/variables/{key}")
    public ApiResponse<Variable> getVariable(@PathVariable String id,
                                             @PathVariable String key,
                                             ExecutionClaims claims) {
        requireOwnership(claims, id);
        return ApiResponse.ok(stateService.getVariable(claims.executionId(), key));
    }

    @PutMapping("/variables/{key}")
    public ApiResponse<Variable> setVariable(@PathVariable String id,
                                             @PathVariable String key,
                                             @RequestBody VariableRequest req,
                                             ExecutionClaims claims) {
        requireOwnership(claims, id);
        return ApiResponse.ok(stateService.setVariable(claims.executionId(), key, req.value()));
    }

    private static void requireOwnership(ExecutionClaims claims, String pathId) {
        if (!claims.owns(pathId)) {
            log.warn("Token for {} used against execution {}", claims.executionId(), pathId);
            throw ApiException.unauthorized("Token is not valid for this execution");
        }
    }
}
