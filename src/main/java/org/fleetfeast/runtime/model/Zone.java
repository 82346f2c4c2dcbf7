package org.fleetfeast.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * A city zone: static demand profile, travel costs, parking, and a bounded history of
 * recent demand values. Only the demand history and the fractional order carry change
 * after construction.
 */
public final class Zone {

    private final ZoneProfile profile;
    private final Map<String, Integer> travelCosts;
    private final int parkingCapacity;
    private final int historyLength;
    private final Deque<Double> demandHistory;
    private double orderCarry;

    public Zone(ZoneProfile profile, Map<String, Integer> travelCosts, int parkingCapacity, int historyLength) {
        this.profile = profile;
        this.travelCosts = Collections.unmodifiableMap(new LinkedHashMap<>(travelCosts));
        this.parkingCapacity = parkingCapacity;
        this.historyLength = historyLength;
        this.demandHistory = new ArrayDeque<>(historyLength);
    }

    public String getId() {
        return profile.id();
    }

    public ZoneProfile getProfile() {
        return profile;
    }

    public int getParkingCapacity() {
        return parkingCapacity;
    }

    public Map<String, Integer> getTravelCosts() {
        return travelCosts;
    }

    /**
     * @return travel time in minutes to {@code zoneId}; {@code 0} for this zone itself,
     *         empty if the target is unknown
     */
    public OptionalInt travelCostTo(String zoneId) {
        if (getId().equals(zoneId)) {
            return OptionalInt.of(0);
        }
        Integer cost = travelCosts.get(zoneId);
        return cost == null ? OptionalInt.empty() : OptionalInt.of(cost);
    }

    public void recordDemand(double demand) {
        if (demandHistory.size() == historyLength) {
            demandHistory.pollFirst();
        }
        demandHistory.addLast(demand);
    }

    /**
     * Adds one tick's demand to the fraction left over from earlier ticks.
     *
     * @return the whole orders completed; the remaining fraction is kept for the next tick
     */
    public int accrueOrders(double demand) {
        double total = orderCarry + Math.max(0.0, demand);
        // tolerance keeps ten ticks of 0.1 from summing to 0.999...
        int whole = (int) Math.floor(total + 1e-9);
        orderCarry = Math.max(0.0, total - whole);
        return whole;
    }

    public double getOrderCarry() {
        return orderCarry;
    }

    /**
     * @return recent demand values, oldest first
     */
    public List<Double> getDemandHistory() {
        return new ArrayList<>(demandHistory);
    }

    public int getHistoryLength() {
        return historyLength;
    }
}
