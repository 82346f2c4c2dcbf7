package org.fleetfeast.runtime.model;

import java.util.List;

/**
 * Static demand parameters of a zone.
 *
 * @param id             zone id
 * @param baseMultiplier off-peak share of {@code maxOrders}
 * @param peakMultiplier share of {@code maxOrders} at the height of a peak
 * @param maxOrders      orders per minute at multiplier 1.0
 * @param peakWindows    peak windows in minutes of the day
 */
public record ZoneProfile(String id, double baseMultiplier, double peakMultiplier, double maxOrders,
                          List<PeakWindow> peakWindows) {

    public ZoneProfile {
        peakWindows = List.copyOf(peakWindows);
    }
}
