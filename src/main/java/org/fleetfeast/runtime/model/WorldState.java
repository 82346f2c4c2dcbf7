package org.fleetfeast.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The authoritative aggregate of zones and trucks at the current tick. Exactly one
 * thread owns and mutates a world; other threads read snapshots.
 */
public final class WorldState {

    private final int dayLength;
    private final int restockDurationTicks;
    private final Map<String, Zone> zones;
    private final Map<String, Truck> trucks;
    private long currentTick;

    public WorldState(List<Zone> zones, List<Truck> trucks, int dayLength, int restockDurationTicks, long startTick) {
        this.dayLength = dayLength;
        this.restockDurationTicks = restockDurationTicks;
        this.zones = new LinkedHashMap<>();
        zones.forEach(z -> this.zones.put(z.getId(), z));
        this.trucks = new LinkedHashMap<>();
        trucks.forEach(t -> this.trucks.put(t.getId(), t));
        this.currentTick = startTick;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * Moves the clock forward by one tick.
     *
     * @param tick must equal {@code currentTick + 1}
     */
    public void advanceTo(long tick) {
        if (tick != currentTick + 1) {
            throw new IllegalStateException("World clock must advance by one tick: " + currentTick + " -> " + tick);
        }
        this.currentTick = tick;
    }

    public int getMinuteOfDay() {
        return minuteOfDay(currentTick);
    }

    public long getDay() {
        return currentTick / dayLength;
    }

    public int minuteOfDay(long tick) {
        return (int) Math.floorMod(tick, (long) dayLength);
    }

    public int getDayLength() {
        return dayLength;
    }

    public int getRestockDurationTicks() {
        return restockDurationTicks;
    }

    public Optional<Zone> zone(String id) {
        return Optional.ofNullable(zones.get(id));
    }

    public Optional<Truck> truck(String id) {
        return Optional.ofNullable(trucks.get(id));
    }

    public List<Zone> zones() {
        return Collections.unmodifiableList(new ArrayList<>(zones.values()));
    }

    public List<Truck> trucks() {
        return Collections.unmodifiableList(new ArrayList<>(trucks.values()));
    }

    /**
     * @return number of trucks occupying a spot in the zone (every truck located there
     *         that is not on the road)
     */
    public int parkedCount(String zoneId) {
        int count = 0;
        for (Truck truck : trucks.values()) {
            if (truck.getStatus() != TruckStatus.MOVING && zoneId.equals(truck.getCurrentZone())) {
                count++;
            }
        }
        return count;
    }
}
