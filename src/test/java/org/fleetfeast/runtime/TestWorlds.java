package org.fleetfeast.runtime;

import org.fleetfeast.runtime.demand.ZoneDemandModel;
import org.fleetfeast.runtime.worldgen.WorldFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Small noise-free city shared by the simulation tests.
 * <ul>
 *   <li>downtown: peak at lunch, 4 orders max, 3 spots</li>
 *   <li>university: two peaks, 3 orders max, 3 spots</li>
 *   <li>park: flat 8 orders per minute, 1 spot</li>
 * </ul>
 */
public final class TestWorlds {

    public static final String CITY = """
            dayLength = 1440
            restockDurationTicks = 10
            historyLength = 30
            demand { seed = 7, noiseFraction = 0.0 }
            zones = [
              { id = downtown, baseMultiplier = 0.2, peakMultiplier = 1.0, maxOrders = 4, parkingCapacity = 3,
                peakHours = [[660, 840]], travelCosts { university = 10, park = 15 } }
              { id = university, baseMultiplier = 0.3, peakMultiplier = 0.85, maxOrders = 3, parkingCapacity = 3,
                peakHours = [[660, 840], [1080, 1260]], travelCosts { park = 20 } }
              { id = park, baseMultiplier = 1.0, peakMultiplier = 1.0, maxOrders = 8, parkingCapacity = 1,
                peakHours = [] }
            ]
            trucks = [
              { id = truck-a, startZone = downtown, inventory = 50, maxInventory = 100, speedMultiplier = 1.0 }
              { id = truck-b, startZone = park, restockZone = downtown, inventory = 5, maxInventory = 40, speedMultiplier = 1.0 }
              { id = truck-c, startZone = university, inventory = 20, maxInventory = 20, speedMultiplier = 0.5 }
            ]
            """;

    private TestWorlds() {
    }

    public static Config city() {
        return ConfigFactory.parseString(CITY).resolve();
    }

    /**
     * @param overrides HOCON merged over the city; lists replace the city's lists
     */
    public static Config city(String overrides) {
        return ConfigFactory.parseString(overrides).withFallback(ConfigFactory.parseString(CITY)).resolve();
    }

    public static Simulation citySimulation() {
        return Simulation.fromConfig(city());
    }

    public static ZoneDemandModel cityDemand() {
        return WorldFactory.demandModel(city());
    }
}
