package org.fleetfeast.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.fleetfeast.agent.AgentFixtures.context;
import static org.fleetfeast.agent.AgentFixtures.initial;
import static org.fleetfeast.agent.AgentFixtures.withTruck;

import java.util.List;

import org.fleetfeast.runtime.TestWorlds;
import org.fleetfeast.runtime.model.TruckStatus;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ZoneForecasterTest {

    private final ZoneForecaster forecaster = new ZoneForecaster(TestWorlds.cityDemand());

    @Test
    void ranksZonesByProjectedMean() {
        List<ZoneForecast> ranking = forecaster.rank(initial(), 60);

        assertThat(ranking).extracting(ZoneForecast::zoneId).containsExactly("park", "university", "downtown");
        ZoneForecast park = ranking.get(0);
        assertThat(park.projectedMean()).isCloseTo(8.0, within(1e-9));
        assertThat(park.projectedPeak()).isCloseTo(8.0, within(1e-9));
        assertThat(park.parkedTrucks()).isEqualTo(1);
        assertThat(park.hasFreeParking()).isFalse();
    }

    @Test
    void movingTrucksDoNotOccupyParking() {
        WorldSnapshot snapshot = withTruck(initial(), "truck-b", TruckStatus.MOVING, "park", "downtown", 0);

        assertThat(ZoneForecaster.parkedTrucks(snapshot, "park")).isZero();
        assertThat(forecaster.rank(snapshot, 60).get(0).hasFreeParking()).isTrue();
    }

    @Test
    void hourlyForecastForKnownAndUnknownZones() {
        assertThat(forecaster.hourly(initial(), "park", 3)).hasValueSatisfying(hours -> {
            assertThat(hours).hasSize(3);
            assertThat(hours).allSatisfy(v -> assertThat(v).isCloseTo(8.0, within(1e-9)));
        });
        assertThat(forecaster.hourly(initial(), "airport", 1)).isEmpty();
    }

    @Test
    void contextEnforcesForecastBudget() throws DecisionMakerException {
        AgentContext context = context(initial(), 2, List.of());

        context.hourlyForecast("park", 1);
        context.hourlyForecast("downtown", 3);

        assertThat(context.canForecast()).isFalse();
        assertThat(context.forecastRoundsUsed()).isEqualTo(2);
        assertThatThrownBy(() -> context.hourlyForecast("park", 1))
                .isInstanceOf(DecisionMakerException.class)
                .hasMessageContaining("budget");
    }

    @Test
    void contextRejectsHorizonOutOfRange() {
        AgentContext context = context(initial());

        assertThatThrownBy(() -> context.hourlyForecast("park", 4)).isInstanceOf(DecisionMakerException.class);
        assertThat(context.forecastRoundsUsed()).isZero();
    }
}
