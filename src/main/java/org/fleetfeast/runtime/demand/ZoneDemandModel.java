package org.fleetfeast.runtime.demand;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

import org.fleetfeast.runtime.model.PeakWindow;
import org.fleetfeast.runtime.model.ZoneProfile;

/**
 * Time-of-day demand signal per zone.
 * <p>
 * {@code demand = maxOrders * (base + (peak - base) * boost) * noise}, where {@code boost} is the
 * sum of Gaussian bumps centered on each peak window (sigma = half the window, at least
 * {@link #MIN_SIGMA_MINUTES}), clamped to 1, and {@code noise} is uniform in
 * {@code [1 - noiseFraction, 1 + noiseFraction]}.
 * <p>
 * The noise depends only on {@code (seed, zoneId, minuteOfDay)}, so the same minute yields the
 * same value on every day and in every run with the same seed. Instances are immutable and
 * safe to share between threads.
 */
public final class ZoneDemandModel {

    public static final double MIN_SIGMA_MINUTES = 30.0;

    private final long seed;
    private final double noiseFraction;
    private final int dayLength;

    public ZoneDemandModel(long seed, double noiseFraction, int dayLength) {
        if (noiseFraction < 0.0 || noiseFraction > 1.0) {
            throw new IllegalArgumentException("noiseFraction must be within [0, 1], got " + noiseFraction);
        }
        if (dayLength <= 0) {
            throw new IllegalArgumentException("dayLength must be positive, got " + dayLength);
        }
        this.seed = seed;
        this.noiseFraction = noiseFraction;
        this.dayLength = dayLength;
    }

    /**
     * @return non-negative demand in orders per minute for the zone at the given tick
     */
    public double demandAt(ZoneProfile zone, long tick) {
        int minute = minuteOfDay(tick);
        return baseSignal(zone, minute) * noiseFactor(zone.id(), minute);
    }

    /**
     * Noise-free demand at a minute of the day.
     */
    public double baseSignal(ZoneProfile zone, int minuteOfDay) {
        double signal = zone.maxOrders()
                * (zone.baseMultiplier() + (zone.peakMultiplier() - zone.baseMultiplier()) * boost(zone, minuteOfDay));
        return Math.max(0.0, signal);
    }

    /**
     * Sum of the Gaussian bumps of every peak window, clamped to {@code [0, 1]}.
     */
    double boost(ZoneProfile zone, int minuteOfDay) {
        double sum = 0.0;
        for (PeakWindow window : zone.peakWindows()) {
            double sigma = Math.max(MIN_SIGMA_MINUTES, window.width(dayLength) / 2.0);
            double distance = circularDistance(minuteOfDay, window.center(dayLength));
            sum += Math.exp(-(distance * distance) / (2.0 * sigma * sigma));
        }
        return Math.min(1.0, sum);
    }

    double noiseFactor(String zoneId, int minuteOfDay) {
        if (noiseFraction == 0.0) {
            return 1.0;
        }
        long mixed = seed;
        mixed = 31 * mixed + zoneId.hashCode();
        mixed = 31 * mixed + minuteOfDay;
        double u = new SplittableRandom(mixed).nextDouble();
        return 1.0 + noiseFraction * (2.0 * u - 1.0);
    }

    private double circularDistance(double a, double b) {
        double d = Math.abs(a - b) % dayLength;
        return Math.min(d, dayLength - d);
    }

    /**
     * Projected demand for each of the next {@code horizonMinutes} ticks after {@code fromTick}.
     */
    public double[] forecast(ZoneProfile zone, long fromTick, int horizonMinutes) {
        double[] values = new double[Math.max(0, horizonMinutes)];
        for (int i = 0; i < values.length; i++) {
            values[i] = demandAt(zone, fromTick + 1 + i);
        }
        return values;
    }

    /**
     * Mean projected demand over the next {@code horizonMinutes} ticks.
     */
    public double meanDemand(ZoneProfile zone, long fromTick, int horizonMinutes) {
        double[] values = forecast(zone, fromTick, horizonMinutes);
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Average demand per hour for the next {@code hoursAhead} hours.
     */
    public List<Double> hourlyForecast(ZoneProfile zone, long fromTick, int hoursAhead) {
        List<Double> hourly = new ArrayList<>(hoursAhead);
        for (int hour = 0; hour < hoursAhead; hour++) {
            hourly.add(meanDemand(zone, fromTick + hour * 60L, 60));
        }
        return hourly;
    }

    public int minuteOfDay(long tick) {
        return (int) Math.floorMod(tick, (long) dayLength);
    }

    public int getDayLength() {
        return dayLength;
    }

    public long getSeed() {
        return seed;
    }

    public double getNoiseFraction() {
        return noiseFraction;
    }
}
