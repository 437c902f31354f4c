package com.cronium.sdk;

import com.cronium.sdk.model.EventContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for CroniumClient against a stubbed Runtime API.
 * Retry delays are recorded instead of slept.
 */
@WireMockTest
class CroniumClientTest {

    static final String EXEC      = "exec-1";
    static final String TOKEN     = "token-abc";
    static final String VARIABLE  = "/executions/exec-1/variables/counter";
    static final String TOOL_PATH = "/tool-actions/execute";

    List<Duration> sleeps;
    CroniumClient  client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wm) {
        sleeps = new ArrayList<>();
        client = clientFor(wm, Duration.ofSeconds(5));
    }

    private CroniumClient clientFor(WireMockRuntimeInfo wm, Duration timeout) {
        return CroniumClient.builder()
                .baseUrl(wm.getHttpBaseUrl())
                .token(TOKEN)
                .executionId(EXEC)
                .timeout(timeout)
                .retryPolicy(new RetryPolicy(3, Duration.ofMillis(100), 2.0, 0.0, Duration.ofSeconds(1)))
                .sleeper(sleeps::add)
                .build();
    }

    // ------------------------------------------------------------------
    // State calls
    // ------------------------------------------------------------------

    @Test
    void input_returnsEnvelopeDataAndSendsBearerToken() {
        stubFor(get("/executions/exec-1/input")
                .willReturn(okJson("{\"success\":true,\"data\":{\"orders\":[1,2,3]}}")));

        JsonNode input = client.input();

        assertThat(input.path("orders").size()).isEqualTo(3);
        verify(getRequestedFor(urlEqualTo("/executions/exec-1/input"))
                .withHeader("Authorization", equalTo("Bearer " + TOKEN)));
    }

    @Test
    void getVariable_notFound_emptyWithoutRetry() {
        stubFor(get(VARIABLE).willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"NotFound\",\"message\":\"Variable 'counter' not found\"}", 404)));

        assertThat(client.getVariable("counter")).isEmpty();
        verify(1, getRequestedFor(urlEqualTo(VARIABLE)));
    }

    @Test
    void getVariable_present_returnsValue() {
        stubFor(get(VARIABLE).willReturn(okJson(
                "{\"success\":true,\"data\":{\"key\":\"counter\",\"value\":41,\"type\":\"number\"}}")));

        Optional<Long> value = client.getVariable("counter", Long.class);

        assertThat(value).contains(41L);
    }

    @Test
    void setVariable_sendsValueEnvelope() {
        stubFor(put(VARIABLE).willReturn(okJson("{\"success\":true}")));

        client.setVariable("counter", 42);

        verify(putRequestedFor(urlEqualTo(VARIABLE)).withRequestBody(equalToJson("{\"value\":42}")));
    }

    @Test
    void deleteVariable_sendsNullValue() {
        stubFor(put(VARIABLE).willReturn(okJson("{\"success\":true}")));

        client.deleteVariable("counter");

        verify(putRequestedFor(urlEqualTo(VARIABLE)).withRequestBody(equalToJson("{\"value\":null}")));
    }

    @Test
    void variableKey_isPathEncoded() {
        stubFor(get(urlEqualTo("/executions/exec-1/variables/last%20run")).willReturn(okJson(
                "{\"success\":true,\"data\":{\"key\":\"last run\",\"value\":\"yesterday\"}}")));

        assertThat(client.getVariable("last run")).map(JsonNode::asText).contains("yesterday");
    }

    @Test
    void event_mapsContext() {
        stubFor(get("/executions/exec-1/context").willReturn(okJson("""
                {"success":true,"data":{"executionId":"exec-1","eventId":"evt-9","eventName":"Nightly",
                 "eventType":"PYTHON","userId":"u-1","startTime":"2026-01-15T10:00:00Z",
                 "metadata":{"retries":2},"unknownField":true}}
                """)));

        EventContext event = client.event();

        assertThat(event.eventName()).isEqualTo("Nightly");
        assertThat(event.startTime()).hasToString("2026-01-15T10:00:00Z");
        assertThat(event.metadata().get("retries").asInt()).isEqualTo(2);
    }

    @Test
    void setCondition_andOutput_postJsonBodies() {
        stubFor(post("/executions/exec-1/condition").willReturn(okJson("{\"success\":true,\"data\":{\"result\":true}}")));
        stubFor(post("/executions/exec-1/output").willReturn(okJson("{\"success\":true}")));

        client.setCondition(true);
        client.output(Map.of("status", "done"));

        verify(postRequestedFor(urlEqualTo("/executions/exec-1/condition"))
                .withRequestBody(equalToJson("{\"condition\":true}")));
        verify(postRequestedFor(urlEqualTo("/executions/exec-1/output"))
                .withRequestBody(equalToJson("{\"data\":{\"status\":\"done\"}}")));
    }

    // ------------------------------------------------------------------
    // Retry policy
    // ------------------------------------------------------------------

    @Test
    void serverError_retriedUpToMaxAttempts() {
        stubFor(put(VARIABLE).willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"Unavailable\",\"message\":\"State store temporarily unavailable\"}", 503)));

        assertThatThrownBy(() -> client.setVariable("counter", 1))
                .isInstanceOf(UnavailableException.class)
                .satisfies(e -> assertThat(((CroniumException) e).isRetryable()).isTrue());
        verify(3, putRequestedFor(urlEqualTo(VARIABLE)));
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void serverError_thenSuccess_recovers() {
        stubFor(get("/executions/exec-1/input").inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(serverError())
                .willSetStateTo("recovered"));
        stubFor(get("/executions/exec-1/input").inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okJson("{\"success\":true,\"data\":\"hello\"}")));

        assertThat(client.input().asText()).isEqualTo("hello");
        verify(2, getRequestedFor(urlEqualTo("/executions/exec-1/input")));
    }

    @Test
    void clientError_notRetried() {
        stubFor(put(VARIABLE).willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"InvalidRequest\",\"message\":\"Variable key contains illegal characters\"}", 400)));

        assertThatThrownBy(() -> client.setVariable("counter", 1))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("illegal characters");
        verify(1, putRequestedFor(urlEqualTo(VARIABLE)));
        assertThat(sleeps).isEmpty();
    }

    @Test
    void forbidden_mapsToUnauthorized() {
        stubFor(get("/executions/exec-1/input").willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"Unauthorized\",\"message\":\"Token is not valid for this execution\"}", 403)));

        assertThatThrownBy(() -> client.input())
                .isInstanceOf(UnauthorizedException.class)
                .satisfies(e -> assertThat(((CroniumException) e).getStatusCode()).isEqualTo(403));
    }

    @Test
    void rateLimited_honorsRetryAfterHeader() {
        stubFor(get("/executions/exec-1/input").inScenario("throttled")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(jsonResponse("{\"success\":false,\"error\":\"RateLimited\",\"retryAfterSeconds\":7}", 429)
                        .withHeader("Retry-After", "7"))
                .willSetStateTo("open"));
        stubFor(get("/executions/exec-1/input").inScenario("throttled")
                .whenScenarioStateIs("open")
                .willReturn(okJson("{\"success\":true,\"data\":1}")));

        assertThat(client.input().asInt()).isEqualTo(1);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(7));
    }

    @Test
    void requestTimeout_retriedThenSurfacedAsTimeout(WireMockRuntimeInfo wm) {
        CroniumClient impatient = clientFor(wm, Duration.ofMillis(200));
        stubFor(get("/executions/exec-1/context").willReturn(okJson("{\"success\":true}").withFixedDelay(1500)));

        assertThatThrownBy(impatient::event).isInstanceOf(CroniumTimeoutException.class);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void connectionDropped_stateCallRetried() {
        stubFor(get("/executions/exec-1/input").willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        assertThatThrownBy(() -> client.input())
                .isInstanceOf(UnavailableException.class);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    // ------------------------------------------------------------------
    // Tool actions
    // ------------------------------------------------------------------

    @Test
    void sendSlackMessage_postsToolActionBody() {
        stubFor(post(TOOL_PATH).willReturn(okJson("{\"success\":true,\"data\":{\"ts\":\"1.2\"}}")));

        JsonNode result = client.sendSlackMessage("#ops", "done");

        assertThat(result.path("ts").asText()).isEqualTo("1.2");
        verify(postRequestedFor(urlEqualTo(TOOL_PATH)).withRequestBody(equalToJson(
                "{\"tool\":\"slack\",\"action\":\"send_message\",\"params\":{\"channel\":\"#ops\",\"text\":\"done\"}}")));
    }

    @Test
    void sendEmail_wrapsRecipientsAndExtraOptions() {
        stubFor(post(TOOL_PATH).willReturn(okJson("{\"success\":true}")));

        client.sendEmail(List.of("a@example.com"), "Report", "<b>ok</b>", Map.of("cc", List.of("b@example.com")));

        verify(postRequestedFor(urlEqualTo(TOOL_PATH))
                .withRequestBody(matchingJsonPath("$.tool", equalTo("email")))
                .withRequestBody(matchingJsonPath("$.params.to[0]", equalTo("a@example.com")))
                .withRequestBody(matchingJsonPath("$.params.cc[0]", equalTo("b@example.com"))));
    }

    @Test
    void toolAction_serverError_notRetried() {
        stubFor(post(TOOL_PATH).willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"Unavailable\",\"message\":\"Tool execution service unavailable\"}", 503)));

        assertThatThrownBy(() -> client.sendDiscordMessage("123", "hi"))
                .isInstanceOf(UnavailableException.class);
        verify(1, postRequestedFor(urlEqualTo(TOOL_PATH)));
        assertThat(sleeps).isEmpty();
    }

    @Test
    void toolAction_deadlineExceeded_timeoutWithoutRetry() {
        stubFor(post(TOOL_PATH).willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"DeadlineExceeded\",\"message\":\"Tool action did not complete in time\"}", 504)));

        assertThatThrownBy(() -> client.executeToolAction("email", "send_message", Map.of()))
                .isInstanceOf(CroniumTimeoutException.class);
        verify(1, postRequestedFor(urlEqualTo(TOOL_PATH)));
    }

    @Test
    void toolAction_connectionDroppedAfterSend_outcomeUnknownNotRetryable() {
        stubFor(post(TOOL_PATH).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        assertThatThrownBy(() -> client.sendSlackMessage("#ops", "deploy finished"))
                .isInstanceOf(CroniumTimeoutException.class)
                .satisfies(e -> assertThat(((CroniumException) e).isRetryable()).isFalse());
        verify(1, postRequestedFor(urlEqualTo(TOOL_PATH)));
        assertThat(sleeps).isEmpty();
    }

    @Test
    void toolAction_serverUnreachable_unavailableWithoutRetry() {
        CroniumClient unreachable = CroniumClient.builder()
                .baseUrl("http://localhost:1")
                .token(TOKEN)
                .executionId(EXEC)
                .timeout(Duration.ofSeconds(2))
                .sleeper(sleeps::add)
                .build();

        assertThatThrownBy(() -> unreachable.sendDiscordMessage("123", "hi"))
                .isInstanceOf(UnavailableException.class);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void toolAction_failed_raisesToolActionFailed() {
        stubFor(post(TOOL_PATH).willReturn(jsonResponse(
                "{\"success\":false,\"error\":\"ToolActionFailed\",\"message\":\"channel_not_found\"}", 422)));

        assertThatThrownBy(() -> client.sendSlackMessage("#nope", "hi"))
                .isInstanceOf(ToolActionFailedException.class)
                .hasMessage("channel_not_found");
    }

    @Test
    void toolAction_rateLimited_retried() {
        stubFor(post(TOOL_PATH).inScenario("tool-throttled")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(jsonResponse("{\"success\":false,\"error\":\"RateLimited\"}", 429)
                        .withHeader("Retry-After", "2"))
                .willSetStateTo("open"));
        stubFor(post(TOOL_PATH).inScenario("tool-throttled")
                .whenScenarioStateIs("open")
                .willReturn(okJson("{\"success\":true,\"data\":\"sent\"}")));

        assertThat(client.executeToolAction("email", "send_message", Map.of()).asText()).isEqualTo("sent");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    @Test
    void fromEnvironment_readsVariables() {
        CroniumClient fromEnv = CroniumClient.fromEnvironment(Map.of(
                CroniumClient.ENV_TOKEN, "t",
                CroniumClient.ENV_EXECUTION_ID, "exec-env"));

        assertThat(fromEnv.executionId()).isEqualTo("exec-env");
    }

    @Test
    void fromEnvironment_missingToken_fails() {
        assertThatThrownBy(() -> CroniumClient.fromEnvironment(Map.of(CroniumClient.ENV_EXECUTION_ID, "exec-env")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(CroniumClient.ENV_TOKEN);
    }
}
