package org.fleetfeast.runtime.snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.fleetfeast.runtime.demand.DemandTrend;
import org.fleetfeast.runtime.model.PeakWindow;
import org.fleetfeast.runtime.model.ZoneProfile;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable view of a zone at one tick.
 *
 * @param demand     recent demand values, oldest first
 * @param peakHours  peak windows as {@code [startMinute, endMinute]} pairs
 */
public record ZoneSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("demand") List<Double> demand,
        @JsonProperty("max_orders") double maxOrders,
        @JsonProperty("num_of_parking_spots") int parkingSpots,
        @JsonProperty("peak_hours") List<List<Integer>> peakHours,
        @JsonProperty("base_multiplier") double baseMultiplier,
        @JsonProperty("peak_multiplier") double peakMultiplier,
        @JsonProperty("travel_costs") Map<String, Integer> travelCosts,
        @JsonProperty("trend") DemandTrend trend) {

    public ZoneSnapshot {
        demand = List.copyOf(demand);
        peakHours = List.copyOf(peakHours);
        travelCosts = Map.copyOf(travelCosts);
    }

    /**
     * @return the most recent demand value, {@code 0} before the first tick
     */
    public double currentDemand() {
        return demand.isEmpty() ? 0.0 : demand.get(demand.size() - 1);
    }

    /**
     * Rebuilds the demand profile this snapshot was taken from.
     */
    public ZoneProfile toProfile() {
        List<PeakWindow> windows = new ArrayList<>(peakHours.size());
        for (List<Integer> pair : peakHours) {
            windows.add(new PeakWindow(pair.get(0), pair.get(1)));
        }
        return new ZoneProfile(id, baseMultiplier, peakMultiplier, maxOrders, windows);
    }
}
