package org.fleetfeast.agent;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.fleetfeast.datapipeline.utils.JsonUtils;
import org.fleetfeast.runtime.actions.ActionCodec;
import org.fleetfeast.runtime.actions.MalformedActionException;
import org.fleetfeast.runtime.actions.PendingAction;
import org.fleetfeast.runtime.snapshot.ZoneSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;

/**
 * Asks an OpenAI-compatible chat-completions endpoint for one tool call per cycle.
 * <p>
 * The model sees the fleet, the zones, the forecast ranking and recent decisions, and may
 * call {@code dispatch_truck}, {@code restock_inventory}, {@code hold_position} or
 * {@code get_zone_forecast}. Forecast calls are answered in the conversation and the model
 * is asked again, until the cycle's forecast budget is used up.
 * <p>
 * Options: {@code baseUrl} (default {@code https://api.openai.com/v1}), {@code apiKey},
 * {@code model} (default {@code gpt-4o-mini}), {@code requestTimeoutMs} (default 20000),
 * {@code temperature} (default 0.2).
 */
public class OpenAiDecisionMaker implements IDecisionMaker {

    private static final Logger log = LoggerFactory.getLogger(OpenAiDecisionMaker.class);

    static final String SYSTEM_PROMPT = String.join("\n",
            "You coordinate a fleet of food trucks in a small city. Every minute each zone produces",
            "orders; a truck serving a zone sells one unit per order until its inventory runs out.",
            "Trucks on the road earn nothing. Restocking takes time and costs a fixed fee plus a",
            "per-unit price. Parking spots per zone are limited.",
            "Maximize total revenue. Call exactly one tool. Use get_zone_forecast to look ahead",
            "before committing a truck to a long trip. Always explain your reasoning briefly.");

    private final HttpClient client;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final Duration requestTimeout;

    public OpenAiDecisionMaker(Config options) {
        String baseUrl = options.hasPath("baseUrl") ? options.getString("baseUrl") : "https://api.openai.com/v1";
        this.endpoint = URI.create(baseUrl.replaceAll("/+$", "") + "/chat/completions");
        this.apiKey = options.hasPath("apiKey") ? options.getString("apiKey") : "";
        this.model = options.hasPath("model") ? options.getString("model") : "gpt-4o-mini";
        this.temperature = options.hasPath("temperature") ? options.getDouble("temperature") : 0.2;
        this.requestTimeout = Duration.ofMillis(options.hasPath("requestTimeoutMs") ? options.getLong("requestTimeoutMs") : 20000L);
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
        if (apiKey.isEmpty()) {
            log.warn("OpenAiDecisionMaker has no apiKey configured, requests to {} will likely be rejected", endpoint);
        }
    }

    @Override
    public Optional<PendingAction> decide(AgentContext context) throws DecisionMakerException, InterruptedException {
        ArrayNode messages = JsonUtils.mapper().createArrayNode();
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", describe(context));

        while (true) {
            JsonNode message = complete(messages);
            JsonNode toolCalls = message.path("tool_calls");
            if (!toolCalls.isArray() || toolCalls.isEmpty()) {
                log.debug("Model answered without a tool call: {}", message.path("content").asText(""));
                return Optional.empty();
            }

            JsonNode call = toolCalls.get(0);
            String name = call.path("function").path("name").asText(null);
            JsonNode arguments = parseArguments(call.path("function").path("arguments").asText("{}"));
            PendingAction action;
            try {
                action = ActionCodec.decode(name, arguments);
            } catch (MalformedActionException e) {
                throw new DecisionMakerException("Malformed tool call '" + name + "': " + e.getMessage(), e);
            }

            if (!(action instanceof PendingAction.Forecast forecast)) {
                return Optional.of(action);
            }
            if (!context.canForecast()) {
                log.debug("Forecast budget exhausted after {} rounds, holding", context.forecastRoundsUsed());
                return Optional.empty();
            }
            Optional<List<Double>> hourly = context.hourlyForecast(forecast.zoneId(), forecast.hoursAhead());
            ObjectNode result = JsonUtils.mapper().createObjectNode();
            result.put("zone_id", forecast.zoneId());
            if (hourly.isPresent()) {
                ArrayNode values = result.putArray("hourly_demand");
                hourly.get().forEach(values::add);
            } else {
                result.put("error", "unknown zone");
            }

            messages.add(message);
            messages.addObject()
                    .put("role", "tool")
                    .put("tool_call_id", call.path("id").asText(""))
                    .put("content", result.toString());
        }
    }

    private JsonNode complete(ArrayNode messages) throws DecisionMakerException, InterruptedException {
        ObjectNode body = JsonUtils.mapper().createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);
        body.set("messages", messages);
        body.set("tools", tools());
        body.put("tool_choice", "auto");

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (!apiKey.isEmpty()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DecisionMakerException("Decision service unreachable at " + endpoint + ": " + e.getMessage(), e);
        }
        if (response.statusCode() != 200) {
            throw new DecisionMakerException("Decision service returned HTTP " + response.statusCode());
        }

        JsonNode message;
        try {
            message = JsonUtils.mapper().readTree(response.body()).path("choices").path(0).path("message");
        } catch (JsonProcessingException e) {
            throw new DecisionMakerException("Decision service returned invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (!message.isObject()) {
            throw new DecisionMakerException("Decision service response has no message");
        }
        return message;
    }

    private static JsonNode parseArguments(String raw) throws DecisionMakerException {
        try {
            return JsonUtils.mapper().readTree(raw.isBlank() ? "{}" : raw);
        } catch (JsonProcessingException e) {
            throw new DecisionMakerException("Tool call arguments are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String describe(AgentContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("current_time", context.snapshot().currentTime());
        payload.put("day", context.snapshot().day());
        payload.put("trucks", context.snapshot().trucks());
        payload.put("forecast", context.forecastRanking());
        Map<String, Map<String, Integer>> travelCosts = new LinkedHashMap<>();
        for (ZoneSnapshot zone : context.snapshot().zones()) {
            travelCosts.put(zone.id(), zone.travelCosts());
        }
        payload.put("travel_costs", travelCosts);
        payload.put("recent_decisions", context.recentDecisions());
        return JsonUtils.toJson(payload);
    }

    static ArrayNode tools() {
        ArrayNode tools = JsonUtils.mapper().createArrayNode();
        tools.add(tool("dispatch_truck", "Move a truck to another zone to serve demand there.",
                Map.of("truck_id", "The truck to move, e.g. 'truck-1'",
                        "destination_zone", "The target zone, e.g. 'stadium-1'",
                        "reasoning", "Why this move maximizes revenue"),
                List.of("truck_id", "destination_zone", "reasoning")));
        tools.add(tool("restock_inventory", "Refill an idle truck where it is parked.",
                Map.of("truck_id", "The truck to restock",
                        "reasoning", "Why restocking is necessary now"),
                List.of("truck_id", "reasoning")));
        tools.add(tool("hold_position", "Keep the fleet as it is for this cycle.",
                Map.of("reasoning", "Why no action is needed"),
                List.of("reasoning")));
        ObjectNode forecast = tool("get_zone_forecast", "Hourly average demand forecast of a zone.",
                Map.of("zone_id", "The zone to analyze"),
                List.of("zone_id"));
        ((ObjectNode) forecast.get("function").get("parameters").get("properties")).putObject("hours_ahead")
                .put("type", "integer").put("minimum", 1).put("maximum", ActionCodec.MAX_FORECAST_HOURS)
                .put("description", "How many hours into the future to look (1-3)");
        tools.add(forecast);
        return tools;
    }

    private static ObjectNode tool(String name, String description, Map<String, String> stringParams, List<String> required) {
        ObjectNode tool = JsonUtils.mapper().createObjectNode();
        tool.put("type", "function");
        ObjectNode function = tool.putObject("function");
        function.put("name", name);
        function.put("description", description);
        ObjectNode parameters = function.putObject("parameters");
        parameters.put("type", "object");
        ObjectNode properties = parameters.putObject("properties");
        stringParams.forEach((param, doc) -> properties.putObject(param).put("type", "string").put("description", doc));
        ArrayNode requiredNode = parameters.putArray("required");
        required.forEach(requiredNode::add);
        return tool;
    }
}
