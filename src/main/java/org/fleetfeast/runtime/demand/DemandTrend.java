package org.fleetfeast.runtime.demand;

import java.util.List;

/**
 * Direction of a zone's recent demand.
 */
public enum DemandTrend {
    UP,
    DOWN,
    STABLE;

    /**
     * Compares the mean of the newer half of the history with the mean of the older half.
     * A relative change below {@code threshold} is {@link #STABLE}.
     */
    public static DemandTrend of(List<Double> history, double threshold) {
        if (history.size() < 2) {
            return STABLE;
        }
        int half = history.size() / 2;
        double older = mean(history.subList(0, half));
        double newer = mean(history.subList(history.size() - half, history.size()));
        double reference = Math.max(Math.abs(older), 1e-9);
        double change = (newer - older) / reference;
        if (change > threshold) {
            return UP;
        }
        if (change < -threshold) {
            return DOWN;
        }
        return STABLE;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0.0 : sum / values.size();
    }
}
