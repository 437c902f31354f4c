package com.cronium.sdk;

import com.cronium.sdk.model.EventContext;
import com.cronium.sdk.model.ToolActionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client a script uses to talk to the Cronium Runtime API from inside its
 * execution container.
 *
 * Typical use:
 * <pre>
 *   CroniumClient cronium = CroniumClient.fromEnvironment();
 *   JsonNode input = cronium.input();
 *   long runs = cronium.getVariable("runs").map(JsonNode::asLong).orElse(0L);
 *   cronium.setVariable("runs", runs + 1);
 *   cronium.output(Map.of("status", "done"));
 * </pre>
 *
 * State calls (input, output, variables, condition, event) are retried per
 * the {@link RetryPolicy} on timeouts, I/O errors, 5xx and 429. Tool actions
 * are only retried on 429: any other failure may have happened after the
 * action ran, so they surface immediately.
 *
 * Instances are thread-safe.
 */
public final class CroniumClient {

    private static final Logger log = LoggerFactory.getLogger(CroniumClient.class);

    public static final String ENV_API_URL      = "CRONIUM_RUNTIME_API";
    public static final String ENV_TOKEN        = "CRONIUM_EXECUTION_TOKEN";
    public static final String ENV_EXECUTION_ID = "CRONIUM_EXECUTION_ID";

    static final String   DEFAULT_API_URL = "http://localhost:8081";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Sleeps between attempts; replaced in tests. */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private enum CallKind { STATE, TOOL_ACTION }

    private final String       baseUrl;
    private final String       token;
    private final String       executionId;
    private final Duration     timeout;
    private final RetryPolicy  retryPolicy;
    private final HttpClient   http;
    private final ObjectMapper json;
    private final Sleeper      sleeper;

    private CroniumClient(Builder b) {
        this.baseUrl     = stripTrailingSlash(Objects.requireNonNull(b.baseUrl, "baseUrl"));
        this.token       = requireText(b.token, "token");
        this.executionId = requireText(b.executionId, "executionId");
        this.timeout     = b.timeout;
        this.retryPolicy = b.retryPolicy;
        this.json        = b.objectMapper != null ? b.objectMapper : defaultObjectMapper();
        this.sleeper     = b.sleeper;
        this.http        = b.httpClient != null ? b.httpClient : HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a client from the variables the orchestrator injects into every
     * execution container.
     *
     * @throws IllegalStateException if the token or execution id is not set
     */
    public static CroniumClient fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static CroniumClient fromEnvironment(Map<String, String> env) {
        String token = env.get(ENV_TOKEN);
        String executionId = env.get(ENV_EXECUTION_ID);
        if (token == null || token.isBlank()) {
            throw new IllegalStateException(ENV_TOKEN + " environment variable not set");
        }
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalStateException(ENV_EXECUTION_ID + " environment variable not set");
        }
        return builder()
                .baseUrl(env.getOrDefault(ENV_API_URL, DEFAULT_API_URL))
                .token(token)
                .executionId(executionId)
                .build();
    }

    public String executionId() {
        return executionId;
    }

    // ------------------------------------------------------------------
    // Execution state
    // ------------------------------------------------------------------

    /**
     * Input data for this execution.
     *
     * @throws NotFoundException if the execution was started without input
     */
    public JsonNode input() {
        return call("GET", executionPath("/input"), null, CallKind.STATE);
    }

    /** Input data converted to the given type. */
    public <T> T input(Class<T> type) {
        return convert(input(), type);
    }

    /** Set this execution's output. Any JSON-serializable value; repeated calls overwrite. */
    public void output(Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", data);
        call("POST", executionPath("/output"), body, CallKind.STATE);
    }

    /** Value of a variable, or empty if it was never set or has been deleted. */
    public Optional<JsonNode> getVariable(String key) {
        try {
            JsonNode data = call("GET", variablePath(key), null, CallKind.STATE);
            return Optional.ofNullable(data).map(d -> d.get("value")).filter(v -> !v.isNull());
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    public <T> Optional<T> getVariable(String key, Class<T> type) {
        return getVariable(key).map(v -> convert(v, type));
    }

    public void setVariable(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("value", value);
        call("PUT", variablePath(key), body, CallKind.STATE);
    }

    /** Delete a variable. Deleting a variable that does not exist is not an error. */
    public void deleteVariable(String key) {
        setVariable(key, null);
    }

    /** Set the flag conditional flows branch on after this script finishes. */
    public void setCondition(boolean condition) {
        call("POST", executionPath("/condition"), Map.of("condition", condition), CallKind.STATE);
    }

    /** Metadata about the event that started this execution. */
    public EventContext event() {
        return convert(call("GET", executionPath("/context"), null, CallKind.STATE), EventContext.class);
    }

    // ------------------------------------------------------------------
    // Tool actions
    // ------------------------------------------------------------------

    /**
     * Run a tool action with the credentials configured for the event's owner.
     *
     * @return the tool's result data, may be a JSON null
     * @throws ToolActionFailedException if the tool reported a failure
     * @throws CroniumTimeoutException   if the outcome is unknown
     */
    public JsonNode executeToolAction(String tool, String action, Map<String, ?> params) {
        Map<String, Object> copy = params == null ? Map.of() : new LinkedHashMap<>(params);
        return call("POST", "/tool-actions/execute", new ToolActionRequest(tool, action, copy), CallKind.TOOL_ACTION);
    }

    public JsonNode sendEmail(List<String> to, String subject, String body) {
        return sendEmail(to, subject, body, Map.of());
    }

    /** @param options additional email options such as cc, bcc or attachments */
    public JsonNode sendEmail(List<String> to, String subject, String body, Map<String, ?> options) {
        Map<String, Object> params = new LinkedHashMap<>(options);
        params.put("to", List.copyOf(to));
        params.put("subject", subject);
        params.put("body", body);
        return executeToolAction("email", "send_message", params);
    }

    public JsonNode sendSlackMessage(String channel, String text) {
        return sendSlackMessage(channel, text, Map.of());
    }

    /** @param options additional Slack options such as blocks or attachments */
    public JsonNode sendSlackMessage(String channel, String text, Map<String, ?> options) {
        Map<String, Object> params = new LinkedHashMap<>(options);
        params.put("channel", channel);
        params.put("text", text);
        return executeToolAction("slack", "send_message", params);
    }

    public JsonNode sendDiscordMessage(String channelId, String content) {
        return sendDiscordMessage(channelId, content, Map.of());
    }

    /** @param options additional Discord options such as embeds */
    public JsonNode sendDiscordMessage(String channelId, String content, Map<String, ?> options) {
        Map<String, Object> params = new LinkedHashMap<>(options);
        params.put("channelId", channelId);
        params.put("content", content);
        return executeToolAction("discord", "send_message", params);
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    /**
     * Send one logical call, retrying per policy.
     *
     * @return the envelope's data field, JSON null when absent
     */
    private JsonNode call(String method, String path, Object body, CallKind kind) {
        String payload = body == null ? null : toJson(body);
        int maxAttempts = retryPolicy.maxAttempts();

        for (int attempt = 1; ; attempt++) {
            CroniumException failure;
            Duration retryAfter = null;
            try {
                HttpResponse<String> response = http.send(request(method, path, payload),
                        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                JsonNode envelope = parse(response);
                int status = response.statusCode();
                boolean ok = envelope.path("success").isBoolean()
                        ? envelope.get("success").asBoolean()
                        : status >= 200 && status < 300;
                if (ok) {
                    return envelope.path("data").isMissingNode() ? json.nullNode() : envelope.get("data");
                }
                retryAfter = retryAfter(response, envelope);
                failure = ErrorResponses.toException(status,
                        textOrNull(envelope, "error"), textOrNull(envelope, "message"), retryAfter);
                if (!shouldRetry(kind, status)) {
                    throw failure;
                }
            } catch (HttpConnectTimeoutException | ConnectException e) {
                // Nothing was sent, so even a tool action is safe to try again later.
                failure = new UnavailableException(method + " " + path + " could not connect: " + e.getMessage(), 0, e);
                if (kind == CallKind.TOOL_ACTION) {
                    throw failure;
                }
            } catch (HttpTimeoutException e) {
                failure = new CroniumTimeoutException(
                        method + " " + path + " timed out after " + timeout.toSeconds() + "s", 0, e);
                if (kind == CallKind.TOOL_ACTION) {
                    throw failure;
                }
            } catch (IOException e) {
                if (kind == CallKind.TOOL_ACTION) {
                    // The request may have reached the server; its outcome is unknown.
                    throw new CroniumTimeoutException(
                            method + " " + path + " failed after sending, outcome unknown: " + e.getMessage(), 0, e);
                }
                failure = new UnavailableException(method + " " + path + " failed: " + e.getMessage(), 0, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CroniumException(method + " " + path + " interrupted", e);
            }

            if (attempt >= maxAttempts) {
                log.warn("{} {} failed after {} attempts: {}", method, path, attempt, failure.getMessage());
                throw failure;
            }
            Duration delay = retryAfter != null ? retryAfter : retryPolicy.delayAfter(attempt);
            log.debug("{} {} attempt {} failed ({}), retrying in {} ms",
                    method, path, attempt, failure.getMessage(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw failure;
            }
        }
    }

    private static boolean shouldRetry(CallKind kind, int status) {
        if (status == 429) {
            return true;
        }
        return kind == CallKind.STATE && status >= 500;
    }

    private HttpRequest request(String method, String path, String payload) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
        if (payload == null) {
            return builder.method(method, HttpRequest.BodyPublishers.noBody()).build();
        }
        return builder
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
    }

    private JsonNode parse(HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return json.createObjectNode();
        }
        try {
            JsonNode node = json.readTree(body);
            return node != null && node.isObject() ? node : json.createObjectNode();
        } catch (JsonProcessingException e) {
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                throw new InternalErrorException("Unreadable response from Runtime API", response.statusCode());
            }
            // Non-JSON error page, typically from a proxy; the status code still classifies it.
            return json.createObjectNode();
        }
    }

    private static Duration retryAfter(HttpResponse<String> response, JsonNode envelope) {
        Optional<String> header = response.headers().firstValue("Retry-After");
        if (header.isPresent()) {
            try {
                return Duration.ofSeconds(Math.max(0, Long.parseLong(header.get().trim())));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After '{}'", header.get());
            }
        }
        JsonNode seconds = envelope.get("retryAfterSeconds");
        return seconds != null && seconds.canConvertToLong() ? Duration.ofSeconds(seconds.asLong()) : null;
    }

    private String executionPath(String suffix) {
        return "/executions/" + encode(executionId) + suffix;
    }

    private String variablePath(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Variable key must not be empty");
        }
        return executionPath("/variables/" + encode(key));
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return json.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CroniumException("Cannot convert response to " + type.getSimpleName(), e);
        }
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private String       baseUrl     = DEFAULT_API_URL;
        private String       token;
        private String       executionId;
        private Duration     timeout     = DEFAULT_TIMEOUT;
        private RetryPolicy  retryPolicy = RetryPolicy.defaults();
        private HttpClient   httpClient;
        private ObjectMapper objectMapper;
        private Sleeper      sleeper     = d -> Thread.sleep(d.toMillis());

        private Builder() {}

        public Builder baseUrl(String baseUrl)             { this.baseUrl = baseUrl; return this; }
        public Builder token(String token)                 { this.token = token; return this; }
        public Builder executionId(String executionId)     { this.executionId = executionId; return this; }
        public Builder timeout(Duration timeout)           { this.timeout = Objects.requireNonNull(timeout); return this; }
        public Builder retryPolicy(RetryPolicy policy)     { this.retryPolicy = Objects.requireNonNull(policy); return this; }
        public Builder httpClient(HttpClient httpClient)   { this.httpClient = httpClient; return this; }
        public Builder objectMapper(ObjectMapper mapper)   { this.objectMapper = mapper; return this; }

        Builder sleeper(Sleeper sleeper) { this.sleeper = Objects.requireNonNull(sleeper); return this; }

        public CroniumClient build() {
            return new CroniumClient(this);
        }
    }
}
