package org.fleetfeast.runtime.demand;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.fleetfeast.runtime.model.Zone;
import org.fleetfeast.runtime.model.ZoneProfile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TickDemandTest {

    @Test
    void ordersAreFlooredAndSharedBetweenTrucks() {
        TickDemand demand = new TickDemand(Map.of("park", 7.9, "downtown", 0.4));

        assertThat(demand.orders("park")).isEqualTo(7);
        assertThat(demand.orders("downtown")).isZero();

        assertThat(demand.take("park", 5)).isEqualTo(5);
        assertThat(demand.take("park", 5)).isEqualTo(2);
        assertThat(demand.take("park", 5)).isZero();
        assertThat(demand.servedOrders("park")).isEqualTo(7);
        assertThat(demand.signal("park")).isEqualTo(7.9);
    }

    @Test
    void explicitOrdersOverrideTheFlooredSignal() {
        TickDemand demand = new TickDemand(Map.of("park", 0.4), Map.of("park", 1));

        assertThat(demand.orders("park")).isEqualTo(1);
        assertThat(demand.take("park", 3)).isEqualTo(1);
        assertThat(demand.signal("park")).isEqualTo(0.4);
    }

    @Test
    void zoneCarriesFractionsOfAnOrderBetweenTicks() {
        Zone zone = new Zone(new ZoneProfile("stadium", 0.25, 0.25, 1, List.of()), Map.of(), 1, 10);

        int[] orders = new int[8];
        for (int i = 0; i < orders.length; i++) {
            orders[i] = zone.accrueOrders(0.25);
        }

        assertThat(orders).containsExactly(0, 0, 0, 1, 0, 0, 0, 1);
        assertThat(zone.getOrderCarry()).isZero();
        assertThat(zone.accrueOrders(-1.0)).isZero();
    }

    @Test
    void unknownZoneHasNoOrders() {
        TickDemand demand = new TickDemand(Map.of());

        assertThat(demand.take("nowhere", 3)).isZero();
        assertThat(demand.signal("nowhere")).isZero();
    }

    @Test
    void trendComparesNewerHalfWithOlderHalf() {
        assertThat(DemandTrend.of(List.of(1.0, 1.0, 2.0, 2.0), 0.05)).isEqualTo(DemandTrend.UP);
        assertThat(DemandTrend.of(List.of(2.0, 2.0, 1.0, 1.0), 0.05)).isEqualTo(DemandTrend.DOWN);
        assertThat(DemandTrend.of(List.of(1.0, 1.01, 1.0, 1.01), 0.05)).isEqualTo(DemandTrend.STABLE);
        assertThat(DemandTrend.of(List.of(3.0), 0.05)).isEqualTo(DemandTrend.STABLE);
    }
}
