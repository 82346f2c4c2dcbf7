package org.fleetfeast.runtime.actions;

import org.fleetfeast.datapipeline.utils.JsonUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Wire format of queued actions: tagged JSON objects
 * <pre>
 * {"type": "dispatch", "truck_id": "truck-1", "target_zone": "park-1", "reasoning": "..."}
 * {"type": "restock", "truck_id": "truck-1"}
 * {"type": "forecast", "zone_id": "stadium-1", "hours_ahead": 2}
 * {"type": "hold"}
 * </pre>
 * Agent tool names ({@code dispatch_truck}, {@code restock_inventory}, {@code get_zone_forecast},
 * {@code hold_position}) are accepted as type aliases, {@code action} as an alias of the
 * {@code type} field, and {@code destination_zone} as an alias of {@code target_zone}.
 */
public final class ActionCodec {

    public static final int MAX_FORECAST_HOURS = 3;

    private ActionCodec() {
    }

    public static String encode(PendingAction action) {
        ObjectNode node = JsonUtils.mapper().createObjectNode();
        node.put("type", action.type());
        action.accept(new PendingAction.Visitor<Void>() {
            @Override
            public Void visitDispatch(PendingAction.Dispatch dispatch) {
                node.put("truck_id", dispatch.truckId());
                node.put("target_zone", dispatch.targetZone());
                return null;
            }

            @Override
            public Void visitRestock(PendingAction.Restock restock) {
                node.put("truck_id", restock.truckId());
                return null;
            }

            @Override
            public Void visitForecast(PendingAction.Forecast forecast) {
                node.put("zone_id", forecast.zoneId());
                node.put("hours_ahead", forecast.hoursAhead());
                return null;
            }

            @Override
            public Void visitHold(PendingAction.Hold hold) {
                if (hold.truckId() != null) {
                    node.put("truck_id", hold.truckId());
                }
                return null;
            }
        });
        if (action.reasoning() != null && !action.reasoning().isEmpty()) {
            node.put("reasoning", action.reasoning());
        }
        return node.toString();
    }

    public static PendingAction decode(String json) throws MalformedActionException {
        JsonNode node;
        try {
            node = JsonUtils.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedActionException("Action is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedActionException("Action must be a JSON object");
        }
        String type = node.hasNonNull("type") ? text(node, "type") : text(node, "action");
        return decode(type, node);
    }

    /**
     * Decodes an action whose type is given separately, as in an agent tool call.
     *
     * @param type      action type or tool name
     * @param arguments the tool call arguments
     */
    public static PendingAction decode(String type, JsonNode arguments) throws MalformedActionException {
        if (type == null) {
            throw new MalformedActionException("Action has no type");
        }
        JsonNode args = arguments == null ? JsonUtils.mapper().createObjectNode() : arguments;
        String reasoning = args.hasNonNull("reasoning") ? args.get("reasoning").asText() : "";
        switch (type) {
            case "dispatch":
            case "dispatch_truck": {
                String zone = args.hasNonNull("target_zone") ? text(args, "target_zone") : text(args, "destination_zone");
                return new PendingAction.Dispatch(required(args, "truck_id"), requireValue(zone, "target_zone"), reasoning);
            }
            case "restock":
            case "restock_inventory":
                return new PendingAction.Restock(required(args, "truck_id"), reasoning);
            case "forecast":
            case "get_zone_forecast": {
                int hours = args.hasNonNull("hours_ahead") ? args.get("hours_ahead").asInt(1) : 1;
                if (hours < 1 || hours > MAX_FORECAST_HOURS) {
                    throw new MalformedActionException("hours_ahead must be between 1 and " + MAX_FORECAST_HOURS + ", got " + hours);
                }
                return new PendingAction.Forecast(required(args, "zone_id"), hours, reasoning);
            }
            case "hold":
            case "hold_position":
                return new PendingAction.Hold(text(args, "truck_id"), reasoning);
            default:
                throw new MalformedActionException("Unknown action type '" + type + "'");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String required(JsonNode node, String field) throws MalformedActionException {
        return requireValue(text(node, field), field);
    }

    private static String requireValue(String value, String field) throws MalformedActionException {
        if (value == null || value.isBlank()) {
            throw new MalformedActionException("Missing required field '" + field + "'");
        }
        return value;
    }
}
