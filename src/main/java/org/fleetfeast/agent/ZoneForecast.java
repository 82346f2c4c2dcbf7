package org.fleetfeast.agent;

import org.fleetfeast.runtime.demand.DemandTrend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Projected demand of one zone over the forecast horizon.
 */
public record ZoneForecast(
        @JsonProperty("zone_id") String zoneId,
        @JsonProperty("current_demand") double currentDemand,
        @JsonProperty("projected_mean") double projectedMean,
        @JsonProperty("projected_peak") double projectedPeak,
        @JsonProperty("trend") DemandTrend trend,
        @JsonProperty("parked_trucks") int parkedTrucks,
        @JsonProperty("parking_spots") int parkingSpots) {

    public boolean hasFreeParking() {
        return parkedTrucks < parkingSpots;
    }
}
