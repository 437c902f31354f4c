package com.cronium.runtime.api;

import com.cronium.runtime.api.dto.ApiResponse;
import com.cronium.runtime.auth.ExecutionClaims;
import com.cronium.runtime.tool.ToolActionForwarder;
import com.cronium.runtime.tool.dto.ToolActionConfig;
import com.cronium.runtime.tool.dto.ToolActionResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /tool-actions/execute : run a tool action (email, Slack, Discord, ...)
 * on behalf of the calling execution.
 */
@RestController
@RequestMapping("/tool-actions")
public class ToolActionController {

    private final ToolActionForwarder forwarder;

    public ToolActionController(ToolActionForwarder forwarder) {
        this.forwarder = forwarder;
    }

    @PostMapping("/execute")
    public ApiResponse<JsonNode> execute(@RequestBody ToolActionConfig config, ExecutionClaims claims) {
        ToolActionResult result = forwarder.execute(claims, config);
        return ApiResponse.ok(result.data(), result.metadata());
    }
}
