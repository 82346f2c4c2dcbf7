package org.fleetfeast.runtime.demand;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.fleetfeast.runtime.model.PeakWindow;
import org.fleetfeast.runtime.model.ZoneProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ZoneDemandModelTest {

    private static final ZoneProfile LUNCH = new ZoneProfile("downtown", 0.2, 1.0, 4,
            List.of(new PeakWindow(660, 840)));

    @Test
    @DisplayName("Signal reaches maxOrders * peakMultiplier at the centre of a peak window")
    void peakCentre() {
        ZoneDemandModel model = new ZoneDemandModel(1L, 0.0, 1440);

        assertThat(model.demandAt(LUNCH, 750)).isCloseTo(4.0, within(1e-9));
    }

    @Test
    @DisplayName("Signal falls back to maxOrders * baseMultiplier far from any peak")
    void offPeak() {
        ZoneDemandModel model = new ZoneDemandModel(1L, 0.0, 1440);

        assertThat(model.demandAt(LUNCH, 30)).isCloseTo(0.8, within(1e-6));
    }

    @Test
    @DisplayName("Overlapping windows are clamped so demand never exceeds the peak multiplier")
    void boostClamped() {
        ZoneProfile doublePeak = new ZoneProfile("campus", 0.1, 1.0, 10,
                List.of(new PeakWindow(600, 700), new PeakWindow(620, 720)));
        ZoneDemandModel model = new ZoneDemandModel(1L, 0.0, 1440);

        for (int minute = 0; minute < 1440; minute++) {
            assertThat(model.baseSignal(doublePeak, minute)).isLessThanOrEqualTo(10.0 + 1e-9);
        }
    }

    @Test
    @DisplayName("A window that wraps past midnight peaks at its circular centre")
    void wrappingWindow() {
        ZoneProfile lateNight = new ZoneProfile("stadium", 0.0, 1.0, 5, List.of(new PeakWindow(1380, 60)));
        ZoneDemandModel model = new ZoneDemandModel(1L, 0.0, 1440);

        assertThat(model.baseSignal(lateNight, 0)).isCloseTo(5.0, within(1e-9));
        assertThat(model.baseSignal(lateNight, 1430)).isCloseTo(model.baseSignal(lateNight, 10), within(1e-9));
    }

    @Test
    @DisplayName("Noise stays within the configured fraction of the base signal")
    void noiseBounded() {
        ZoneDemandModel model = new ZoneDemandModel(99L, 0.10, 1440);

        for (int minute = 0; minute < 1440; minute++) {
            double base = model.baseSignal(LUNCH, minute);
            assertThat(model.demandAt(LUNCH, minute)).isBetween(base * 0.9 - 1e-9, base * 1.1 + 1e-9);
        }
    }

    @Test
    @DisplayName("The same seed gives the same demand, another seed gives different noise")
    void seeded() {
        ZoneDemandModel first = new ZoneDemandModel(5L, 0.10, 1440);
        ZoneDemandModel again = new ZoneDemandModel(5L, 0.10, 1440);
        ZoneDemandModel other = new ZoneDemandModel(6L, 0.10, 1440);

        boolean differs = false;
        for (int minute = 0; minute < 120; minute++) {
            assertThat(first.demandAt(LUNCH, minute)).isEqualTo(again.demandAt(LUNCH, minute));
            differs |= first.demandAt(LUNCH, minute) != other.demandAt(LUNCH, minute);
        }
        assertThat(differs).isTrue();
    }

    @Test
    @DisplayName("Demand at minute 0 of the next day equals minute 0 of today")
    void dayWraparound() {
        ZoneDemandModel model = new ZoneDemandModel(3L, 0.10, 1440);

        assertThat(model.demandAt(LUNCH, 1440)).isEqualTo(model.demandAt(LUNCH, 0));
        assertThat(model.demandAt(LUNCH, 3 * 1440 + 17)).isEqualTo(model.demandAt(LUNCH, 17));
    }

    @Test
    @DisplayName("Forecast starts at the tick after the reference tick")
    void forecastWindow() {
        ZoneDemandModel model = new ZoneDemandModel(3L, 0.10, 1440);

        double[] values = model.forecast(LUNCH, 100, 5);

        assertThat(values).hasSize(5);
        assertThat(values[0]).isEqualTo(model.demandAt(LUNCH, 101));
        assertThat(values[4]).isEqualTo(model.demandAt(LUNCH, 105));
    }

    @Test
    @DisplayName("Hourly forecast averages each of the following hours")
    void hourlyForecast() {
        ZoneDemandModel model = new ZoneDemandModel(3L, 0.0, 1440);

        List<Double> hourly = model.hourlyForecast(LUNCH, 599, 3);

        assertThat(hourly).hasSize(3);
        assertThat(hourly.get(0)).isEqualTo(model.meanDemand(LUNCH, 599, 60));
        assertThat(hourly.get(2)).isGreaterThan(hourly.get(0));
    }

    @Test
    @DisplayName("Noise fraction outside [0, 1] is rejected")
    void invalidNoise() {
        assertThatThrownBy(() -> new ZoneDemandModel(1L, 1.5, 1440))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
