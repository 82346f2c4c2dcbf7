package org.fleetfeast.runtime.snapshot;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable copy of the world published once per tick.
 *
 * @param tick        absolute tick counter
 * @param currentTime minute of the current day
 * @param day         days elapsed since tick 0
 */
public record WorldSnapshot(
        @JsonProperty("tick") long tick,
        @JsonProperty("current_time") int currentTime,
        @JsonProperty("day") long day,
        @JsonProperty("zones") List<ZoneSnapshot> zones,
        @JsonProperty("trucks") List<TruckSnapshot> trucks) {

    public WorldSnapshot {
        zones = List.copyOf(zones);
        trucks = List.copyOf(trucks);
    }

    public Optional<ZoneSnapshot> zone(String id) {
        return zones.stream().filter(z -> z.id().equals(id)).findFirst();
    }

    public Optional<TruckSnapshot> truck(String id) {
        return trucks.stream().filter(t -> t.id().equals(id)).findFirst();
    }
}
