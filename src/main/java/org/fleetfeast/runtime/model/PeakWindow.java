package org.fleetfeast.runtime.model;

/**
 * A peak-demand window in minutes of the day. {@code endMinute < startMinute} wraps
 * past midnight.
 */
public record PeakWindow(int startMinute, int endMinute) {

    public PeakWindow {
        if (startMinute < 0 || endMinute < 0) {
            throw new IllegalArgumentException("Peak window bounds must be non-negative: [" + startMinute + ", " + endMinute + "]");
        }
    }

    /**
     * @param dayLength minutes per day
     * @return window length in minutes
     */
    public int width(int dayLength) {
        int width = endMinute - startMinute;
        return width < 0 ? width + dayLength : width;
    }

    /**
     * @param dayLength minutes per day
     * @return the middle of the window as a minute of the day (may be fractional)
     */
    public double center(int dayLength) {
        double center = startMinute + width(dayLength) / 2.0;
        return center % dayLength;
    }
}
