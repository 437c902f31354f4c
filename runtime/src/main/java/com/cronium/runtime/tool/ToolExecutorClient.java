package com.cronium.runtime.tool;

import com.cronium.runtime.tool.dto.ToolActionResult;
import com.cronium.runtime.tool.dto.ToolExecutionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client for the backend's tool-execution endpoint.
 *
 * Uses java.net.http.HttpClient with an explicit per-request deadline; tool
 * actions can call slow third-party APIs, so the deadline is configured
 * separately from the state store's.
 *
 * Never retries: a tool action may already have sent the email or posted the
 * message by the time a response is lost.
 */
@Component
public class ToolExecutorClient {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutorClient.class);

    static final String EXECUTE_PATH = "/api/internal/tools/execute";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final Duration     timeout;

    public ToolExecutorClient(
            @Value("${runtime.tool-executor.base-url}") String baseUrl,
            @Value("${runtime.tool-executor.token:}") String token,
            @Value("${runtime.tool-executor.timeout:60s}") Duration timeout,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token   = token;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    /**
     * Forward one action and return the subsystem's verdict.
     *
     * @return the parsed result; {@code success=false} is a confirmed failure
     * @throws ToolExecutorException when no definite verdict was obtained
     */
    public ToolActionResult execute(ToolExecutionRequest request) {
        String opName = "tool action " + request.tool() + "." + request.action();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + EXECUTE_PATH))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .header("X-Execution-ID", request.executionId())
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request)));
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ToolExecutorException(ToolExecutorException.Kind.TIMEOUT,
                    opName + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ConnectException e) {
            throw new ToolExecutorException(ToolExecutorException.Kind.UNAVAILABLE,
                    opName + " could not connect", e);
        } catch (IOException e) {
            // Connection dropped after the request may have been delivered.
            throw new ToolExecutorException(ToolExecutorException.Kind.TIMEOUT,
                    opName + " lost its response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutorException(ToolExecutorException.Kind.TIMEOUT, opName + " interrupted", e);
        }

        int status = resp.statusCode();
        log.debug("{} answered HTTP {}", opName, status);
        if (status >= 500) {
            throw new ToolExecutorException(ToolExecutorException.Kind.UNAVAILABLE,
                    opName + " failed, HTTP " + status + ": " + resp.body());
        }
        if (status >= 400) {
            throw new ToolExecutorException(ToolExecutorException.Kind.REJECTED,
                    opName + " rejected, HTTP " + status + ": " + resp.body());
        }
        try {
            return json.readValue(resp.body(), ToolActionResult.class);
        } catch (JsonProcessingException e) {
            throw new ToolExecutorException(ToolExecutorException.Kind.UNAVAILABLE,
                    "Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
