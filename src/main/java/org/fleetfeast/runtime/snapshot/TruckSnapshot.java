package org.fleetfeast.runtime.snapshot;

import org.fleetfeast.runtime.model.TruckStatus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable view of a truck at one tick.
 *
 * @param destinationZone only set while moving
 * @param arrivalTime     minute of day of the expected arrival, only set while moving
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TruckSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("status") TruckStatus status,
        @JsonProperty("current_zone") String currentZone,
        @JsonProperty("destination_zone") String destinationZone,
        @JsonProperty("inventory") int inventory,
        @JsonProperty("max_inventory") int maxInventory,
        @JsonProperty("total_revenue") double totalRevenue,
        @JsonProperty("arrival_time") Integer arrivalTime,
        @JsonProperty("speed_multiplier") double speedMultiplier,
        @JsonProperty("restock_zone") String restockZone,
        @JsonProperty("units_sold") long unitsSold) {
}
