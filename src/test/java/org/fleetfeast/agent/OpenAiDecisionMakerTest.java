package org.fleetfeast.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fleetfeast.agent.AgentFixtures.context;
import static org.fleetfeast.agent.AgentFixtures.initial;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.fleetfeast.datapipeline.utils.JsonUtils;
import org.fleetfeast.runtime.actions.PendingAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;

/**
 * Runs the decision maker against a local stand-in for the chat-completions endpoint.
 */
@Tag("integration")
class OpenAiDecisionMakerTest {

    private Javalin fakeModel;
    private final Deque<String> answers = new ArrayDeque<>();
    private final List<JsonNode> requests = new ArrayList<>();
    private volatile int status = 200;
    private OpenAiDecisionMaker decisionMaker;

    @BeforeEach
    void setUp() {
        fakeModel = Javalin.create(config -> config.showJavalinBanner = false)
                .post("/v1/chat/completions", ctx -> {
                    synchronized (requests) {
                        requests.add(JsonUtils.mapper().readTree(ctx.body()));
                    }
                    ctx.status(status).contentType("application/json").result(answers.isEmpty() ? "{}" : answers.poll());
                })
                .start(0);
        decisionMaker = new OpenAiDecisionMaker(ConfigFactory.parseString(
                "baseUrl = \"http://localhost:" + fakeModel.port() + "/v1/\"\napiKey = test-key\nrequestTimeoutMs = 2000"));
    }

    @AfterEach
    void tearDown() {
        fakeModel.stop();
    }

    private static String toolCall(String id, String name, String arguments) {
        ObjectNode response = JsonUtils.mapper().createObjectNode();
        ObjectNode message = response.putArray("choices").addObject().putObject("message");
        message.put("role", "assistant");
        ObjectNode call = message.putArray("tool_calls").addObject();
        call.put("id", id);
        call.put("type", "function");
        call.putObject("function").put("name", name).put("arguments", arguments);
        return response.toString();
    }

    private static String plainAnswer(String content) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + content + "\"}}]}";
    }

    @Test
    @DisplayName("A dispatch tool call becomes a dispatch action")
    void dispatchToolCall() throws Exception {
        answers.add(toolCall("call_1", "dispatch_truck",
                "{\"truck_id\":\"truck-a\",\"destination_zone\":\"university\",\"reasoning\":\"lunch rush\"}"));

        Optional<PendingAction> decision = decisionMaker.decide(context(initial()));

        assertThat(decision).contains(new PendingAction.Dispatch("truck-a", "university", "lunch rush"));
        JsonNode request = requests.get(0);
        assertThat(request.path("tools")).hasSize(4);
        assertThat(request.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(request.path("messages").get(1).path("content").asText()).contains("truck-a", "travel_costs");
    }

    @Test
    @DisplayName("Forecast calls are answered in the conversation before the final action")
    void forecastRoundTrip() throws Exception {
        answers.add(toolCall("call_1", "get_zone_forecast", "{\"zone_id\":\"park\",\"hours_ahead\":2}"));
        answers.add(toolCall("call_2", "restock_inventory", "{\"truck_id\":\"truck-b\",\"reasoning\":\"low\"}"));
        AgentContext context = context(initial());

        Optional<PendingAction> decision = decisionMaker.decide(context);

        assertThat(decision).contains(new PendingAction.Restock("truck-b", "low"));
        assertThat(context.forecastRoundsUsed()).isEqualTo(1);
        assertThat(requests).hasSize(2);
        JsonNode toolMessage = requests.get(1).path("messages").get(3);
        assertThat(toolMessage.path("role").asText()).isEqualTo("tool");
        assertThat(toolMessage.path("tool_call_id").asText()).isEqualTo("call_1");
        assertThat(toolMessage.path("content").asText()).contains("hourly_demand");
    }

    @Test
    void exhaustedForecastBudgetEndsInNoAction() throws Exception {
        answers.add(toolCall("call_1", "get_zone_forecast", "{\"zone_id\":\"park\"}"));

        assertThat(decisionMaker.decide(context(initial(), 0, List.of()))).isEmpty();
    }

    @Test
    void answerWithoutToolCallIsNoAction() throws Exception {
        answers.add(plainAnswer("I would rather not decide."));

        assertThat(decisionMaker.decide(context(initial()))).isEmpty();
    }

    @Test
    void httpErrorFails() {
        status = 500;

        assertThatThrownBy(() -> decisionMaker.decide(context(initial())))
                .isInstanceOf(DecisionMakerException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void malformedToolCallFails() {
        answers.add(toolCall("call_1", "teleport_truck", "{\"truck_id\":\"truck-a\"}"));

        assertThatThrownBy(() -> decisionMaker.decide(context(initial())))
                .isInstanceOf(DecisionMakerException.class)
                .hasMessageContaining("teleport_truck");
    }

    @Test
    void missingMessageFails() {
        answers.add("{\"choices\":[]}");

        assertThatThrownBy(() -> decisionMaker.decide(context(initial())))
                .isInstanceOf(DecisionMakerException.class)
                .hasMessageContaining("no message");
    }
}
