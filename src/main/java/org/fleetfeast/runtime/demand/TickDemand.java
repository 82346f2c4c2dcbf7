package org.fleetfeast.runtime.demand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Demand of every zone for one tick: the real-valued signal and the whole orders that
 * remain to be served. Trucks serving the same zone draw from one shared pool in fleet
 * order. Orders nobody serves are lost at the end of the tick.
 */
public final class TickDemand {

    private final Map<String, Double> signals;
    private final Map<String, Integer> orders = new LinkedHashMap<>();
    private final Map<String, Integer> remainingOrders = new LinkedHashMap<>();

    /**
     * Orders are the floor of each signal.
     */
    public TickDemand(Map<String, Double> signals) {
        this(signals, floored(signals));
    }

    /**
     * @param orders whole orders per zone, e.g. including fractions carried over from earlier ticks
     */
    public TickDemand(Map<String, Double> signals, Map<String, Integer> orders) {
        this.signals = Collections.unmodifiableMap(new LinkedHashMap<>(signals));
        orders.forEach((zoneId, count) -> this.orders.put(zoneId, Math.max(0, count)));
        remainingOrders.putAll(this.orders);
    }

    private static Map<String, Integer> floored(Map<String, Double> signals) {
        Map<String, Integer> orders = new LinkedHashMap<>();
        signals.forEach((zoneId, signal) -> orders.put(zoneId, (int) Math.floor(Math.max(0.0, signal))));
        return orders;
    }

    /**
     * @return the demand signal of the zone, {@code 0} if unknown
     */
    public double signal(String zoneId) {
        return signals.getOrDefault(zoneId, 0.0);
    }

    /**
     * @return whole orders available in the zone at the start of the tick
     */
    public int orders(String zoneId) {
        return orders.getOrDefault(zoneId, 0);
    }

    public int remainingOrders(String zoneId) {
        return remainingOrders.getOrDefault(zoneId, 0);
    }

    public int servedOrders(String zoneId) {
        return orders(zoneId) - remainingOrders(zoneId);
    }

    /**
     * Takes up to {@code wanted} orders from the zone's pool.
     *
     * @return the number of orders granted
     */
    public int take(String zoneId, int wanted) {
        int available = remainingOrders(zoneId);
        int granted = Math.max(0, Math.min(available, wanted));
        if (granted > 0) {
            remainingOrders.put(zoneId, available - granted);
        }
        return granted;
    }

    public Map<String, Double> signals() {
        return signals;
    }
}
