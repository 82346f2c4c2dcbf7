package org.fleetfeast.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.fleetfeast.runtime.TestWorlds;
import org.fleetfeast.runtime.model.Truck;
import org.fleetfeast.runtime.model.WorldState;
import org.fleetfeast.runtime.model.Zone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class WorldFactoryTest {

    @Test
    @DisplayName("One-sided travel costs are mirrored into a symmetric matrix")
    void mirrorsTravelCosts() {
        WorldState world = WorldFactory.create(TestWorlds.city());

        Zone park = world.zone("park").orElseThrow();
        assertThat(park.travelCostTo("downtown")).hasValue(15);
        assertThat(park.travelCostTo("university")).hasValue(20);
        assertThat(park.travelCostTo("park")).hasValue(0);
    }

    @Test
    @DisplayName("Truck defaults: restock zone is the start zone, prices come from defaults")
    void truckDefaults() {
        WorldState world = WorldFactory.create(TestWorlds.city());

        Truck truck = world.truck("truck-a").orElseThrow();
        assertThat(truck.getSpec().restockZone()).isEqualTo("downtown");
        assertThat(truck.getSpec().unitPrice()).isEqualTo(8.0);
        assertThat(truck.getSpec().restockFixedFee()).isEqualTo(25.0);
        assertThat(truck.getSpec().restockPerUnitCost()).isEqualTo(3.0);
    }

    @Test
    void bundledWorldLoads() {
        WorldState world = WorldFactory.create(ConfigFactory.load().getConfig("fleetfeast.world"));

        assertThat(world.zones()).extracting(Zone::getId)
                .containsExactly("downtown-1", "university-1", "park-1", "stadium-1", "residential-1");
        assertThat(world.trucks()).hasSize(3);
        assertThat(world.getDayLength()).isEqualTo(1440);
    }

    @Test
    void missingTravelPairIsRejected() {
        assertThatThrownBy(() -> WorldFactory.create(TestWorlds.city("""
                zones = [
                  { id = a, baseMultiplier = 0.1, peakMultiplier = 0.5, maxOrders = 2 }
                  { id = b, baseMultiplier = 0.1, peakMultiplier = 0.5, maxOrders = 2 }
                ]
                trucks = [ { id = t, startZone = a, inventory = 1, maxInventory = 2, speedMultiplier = 1.0 } ]
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing travel cost");
    }

    @Test
    void asymmetricTravelCostIsRejected() {
        assertThatThrownBy(() -> WorldFactory.create(TestWorlds.city("""
                zones = [
                  { id = a, baseMultiplier = 0.1, peakMultiplier = 0.5, maxOrders = 2, travelCosts { b = 5 } }
                  { id = b, baseMultiplier = 0.1, peakMultiplier = 0.5, maxOrders = 2, travelCosts { a = 7 } }
                ]
                trucks = [ { id = t, startZone = a, inventory = 1, maxInventory = 2, speedMultiplier = 1.0 } ]
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Asymmetric");
    }

    @Test
    void invalidTrucksAreRejected() {
        assertThatThrownBy(() -> WorldFactory.create(TestWorlds.city(
                "trucks = [ { id = t, startZone = moon, inventory = 1, maxInventory = 2, speedMultiplier = 1.0 } ]")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("moon");
        assertThatThrownBy(() -> WorldFactory.create(TestWorlds.city(
                "trucks = [ { id = t, startZone = park, inventory = 3, maxInventory = 2, speedMultiplier = 1.0 } ]")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorldFactory.create(TestWorlds.city(
                "trucks = [ { id = t, startZone = park, inventory = 1, maxInventory = 2, speedMultiplier = 0 } ]")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void baseAbovePeakIsRejected() {
        assertThatThrownBy(() -> WorldFactory.create(TestWorlds.city("""
                zones = [ { id = a, baseMultiplier = 0.9, peakMultiplier = 0.5, maxOrders = 2 } ]
                trucks = [ { id = t, startZone = a, inventory = 1, maxInventory = 2, speedMultiplier = 1.0 } ]
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baseMultiplier");
    }

    @Test
    void missingRequiredKeyBecomesIllegalArgument() {
        assertThatThrownBy(() -> WorldFactory.create(ConfigFactory.parseString("zones = []")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
