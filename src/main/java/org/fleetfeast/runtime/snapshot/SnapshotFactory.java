package org.fleetfeast.runtime.snapshot;

import java.util.ArrayList;
import java.util.List;

import org.fleetfeast.runtime.demand.DemandTrend;
import org.fleetfeast.runtime.model.PeakWindow;
import org.fleetfeast.runtime.model.Truck;
import org.fleetfeast.runtime.model.TruckStatus;
import org.fleetfeast.runtime.model.WorldState;
import org.fleetfeast.runtime.model.Zone;

/**
 * Copies the mutable world into an immutable {@link WorldSnapshot}.
 */
public final class SnapshotFactory {

    static final double TREND_THRESHOLD = 0.05;

    private SnapshotFactory() {
    }

    public static WorldSnapshot capture(WorldState world) {
        List<ZoneSnapshot> zones = new ArrayList<>();
        for (Zone zone : world.zones()) {
            List<List<Integer>> peakHours = new ArrayList<>();
            for (PeakWindow window : zone.getProfile().peakWindows()) {
                peakHours.add(List.of(window.startMinute(), window.endMinute()));
            }
            List<Double> history = zone.getDemandHistory();
            zones.add(new ZoneSnapshot(
                    zone.getId(),
                    history,
                    zone.getProfile().maxOrders(),
                    zone.getParkingCapacity(),
                    peakHours,
                    zone.getProfile().baseMultiplier(),
                    zone.getProfile().peakMultiplier(),
                    zone.getTravelCosts(),
                    DemandTrend.of(history, TREND_THRESHOLD)));
        }

        List<TruckSnapshot> trucks = new ArrayList<>();
        for (Truck truck : world.trucks()) {
            boolean moving = truck.getStatus() == TruckStatus.MOVING;
            trucks.add(new TruckSnapshot(
                    truck.getId(),
                    truck.getStatus(),
                    truck.getCurrentZone(),
                    moving ? truck.getDestinationZone() : null,
                    truck.getInventory(),
                    truck.getMaxInventory(),
                    truck.getTotalRevenue(),
                    moving ? world.minuteOfDay(truck.getArrivalTick()) : null,
                    truck.getSpec().speedMultiplier(),
                    truck.getSpec().restockZone(),
                    truck.getUnitsSold()));
        }
        return new WorldSnapshot(world.getCurrentTick(), world.getMinuteOfDay(), world.getDay(), zones, trucks);
    }
}
