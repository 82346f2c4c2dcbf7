package org.fleetfeast.runtime.worldgen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.fleetfeast.runtime.demand.ZoneDemandModel;
import org.fleetfeast.runtime.model.PeakWindow;
import org.fleetfeast.runtime.model.Truck;
import org.fleetfeast.runtime.model.TruckSpec;
import org.fleetfeast.runtime.model.WorldState;
import org.fleetfeast.runtime.model.Zone;
import org.fleetfeast.runtime.model.ZoneProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

/**
 * Builds the initial world from the {@code world} configuration block and validates it.
 * Any invalid parameter raises {@link IllegalArgumentException}, which is fatal at startup.
 * <pre>
 * world {
 *   dayLength = 1440
 *   startTick = 0
 *   restockDurationTicks = 10
 *   historyLength = 60
 *   demand { seed = 42, noiseFraction = 0.10 }
 *   zones = [ { id, baseMultiplier, peakMultiplier, maxOrders, peakHours = [[660, 840]],
 *               parkingCapacity, travelCosts { "university-1" = 10 } } ]
 *   trucks = [ { id, startZone, restockZone, inventory, maxInventory, speedMultiplier,
 *                unitPrice, restockFixedFee, restockPerUnitCost } ]
 * }
 * </pre>
 * A travel cost declared in one direction only is mirrored; two directions with different
 * values are rejected.
 */
public final class WorldFactory {

    private static final Logger log = LoggerFactory.getLogger(WorldFactory.class);

    private WorldFactory() {
    }

    public static WorldState create(Config world) {
        try {
            return build(world);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid world configuration: " + e.getMessage(), e);
        }
    }

    public static ZoneDemandModel demandModel(Config world) {
        try {
            Config demand = world.hasPath("demand") ? world.getConfig("demand") : ConfigFactory.empty();
            long seed = demand.hasPath("seed") ? demand.getLong("seed") : 42L;
            double noise = demand.hasPath("noiseFraction") ? demand.getDouble("noiseFraction") : 0.10;
            return new ZoneDemandModel(seed, noise, dayLength(world));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid demand configuration: " + e.getMessage(), e);
        }
    }

    private static int dayLength(Config world) {
        int dayLength = world.hasPath("dayLength") ? world.getInt("dayLength") : 1440;
        if (dayLength <= 0) {
            throw new IllegalArgumentException("dayLength must be positive, got " + dayLength);
        }
        return dayLength;
    }

    private static WorldState build(Config world) {
        int dayLength = dayLength(world);
        int restockDuration = world.hasPath("restockDurationTicks") ? world.getInt("restockDurationTicks") : 10;
        if (restockDuration < 1) {
            throw new IllegalArgumentException("restockDurationTicks must be at least 1, got " + restockDuration);
        }
        int historyLength = world.hasPath("historyLength") ? world.getInt("historyLength") : 60;
        if (historyLength < 1) {
            throw new IllegalArgumentException("historyLength must be at least 1, got " + historyLength);
        }
        long startTick = world.hasPath("startTick") ? world.getLong("startTick") : 0L;
        if (startTick < 0) {
            throw new IllegalArgumentException("startTick must not be negative, got " + startTick);
        }

        List<? extends Config> zoneConfigs = world.getConfigList("zones");
        if (zoneConfigs.isEmpty()) {
            throw new IllegalArgumentException("At least one zone must be configured");
        }
        Set<String> zoneIds = new LinkedHashSet<>();
        for (Config zc : zoneConfigs) {
            String id = zc.getString("id");
            if (!zoneIds.add(id)) {
                throw new IllegalArgumentException("Duplicate zone id '" + id + "'");
            }
        }

        Map<String, Map<String, Integer>> costs = travelCosts(zoneConfigs, zoneIds);

        List<Zone> zones = new ArrayList<>();
        for (Config zc : zoneConfigs) {
            String id = zc.getString("id");
            ZoneProfile profile = new ZoneProfile(
                    id,
                    zc.getDouble("baseMultiplier"),
                    zc.getDouble("peakMultiplier"),
                    zc.getDouble("maxOrders"),
                    peakWindows(zc, id, dayLength));
            validateProfile(profile);
            int parking = zc.hasPath("parkingCapacity") ? zc.getInt("parkingCapacity") : 1;
            if (parking < 0) {
                throw new IllegalArgumentException("Zone '" + id + "' has negative parkingCapacity " + parking);
            }
            zones.add(new Zone(profile, costs.get(id), parking, historyLength));
        }

        List<? extends Config> truckConfigs = world.getConfigList("trucks");
        if (truckConfigs.isEmpty()) {
            throw new IllegalArgumentException("At least one truck must be configured");
        }
        Set<String> truckIds = new HashSet<>();
        List<Truck> trucks = new ArrayList<>();
        for (Config tc : truckConfigs) {
            TruckSpec spec = truckSpec(tc);
            if (!truckIds.add(spec.id())) {
                throw new IllegalArgumentException("Duplicate truck id '" + spec.id() + "'");
            }
            validateTruck(spec, zoneIds);
            trucks.add(new Truck(spec));
        }

        log.debug("World created with {} zones and {} trucks (dayLength={}, startTick={})",
                zones.size(), trucks.size(), dayLength, startTick);
        return new WorldState(zones, trucks, dayLength, restockDuration, startTick);
    }

    private static List<PeakWindow> peakWindows(Config zc, String zoneId, int dayLength) {
        List<PeakWindow> windows = new ArrayList<>();
        if (!zc.hasPath("peakHours")) {
            return windows;
        }
        for (ConfigValue value : zc.getList("peakHours")) {
            Object raw = value.unwrapped();
            if (!(raw instanceof List<?> pair) || pair.size() != 2
                    || !(pair.get(0) instanceof Number start) || !(pair.get(1) instanceof Number end)) {
                throw new IllegalArgumentException("Zone '" + zoneId + "' has malformed peak window " + value.render());
            }
            int s = start.intValue();
            int e = end.intValue();
            if (s < 0 || s > dayLength || e < 0 || e > dayLength) {
                throw new IllegalArgumentException("Zone '" + zoneId + "' peak window [" + s + ", " + e
                        + "] lies outside the day of " + dayLength + " minutes");
            }
            windows.add(new PeakWindow(s, e));
        }
        return windows;
    }

    private static void validateProfile(ZoneProfile profile) {
        if (profile.baseMultiplier() < 0) {
            throw new IllegalArgumentException("Zone '" + profile.id() + "' has negative baseMultiplier");
        }
        if (profile.baseMultiplier() > profile.peakMultiplier()) {
            throw new IllegalArgumentException("Zone '" + profile.id() + "' has baseMultiplier "
                    + profile.baseMultiplier() + " above peakMultiplier " + profile.peakMultiplier());
        }
        if (profile.maxOrders() < 0) {
            throw new IllegalArgumentException("Zone '" + profile.id() + "' has negative maxOrders");
        }
    }

    private static Map<String, Map<String, Integer>> travelCosts(List<? extends Config> zoneConfigs, Set<String> zoneIds) {
        Map<String, Map<String, Integer>> declared = new HashMap<>();
        for (Config zc : zoneConfigs) {
            String id = zc.getString("id");
            Map<String, Integer> row = new LinkedHashMap<>();
            if (zc.hasPath("travelCosts")) {
                for (Map.Entry<String, ConfigValue> entry : zc.getObject("travelCosts").entrySet()) {
                    String target = entry.getKey();
                    if (!zoneIds.contains(target)) {
                        throw new IllegalArgumentException("Zone '" + id + "' declares a travel cost to unknown zone '" + target + "'");
                    }
                    if (target.equals(id)) {
                        throw new IllegalArgumentException("Zone '" + id + "' declares a travel cost to itself");
                    }
                    if (!(entry.getValue().unwrapped() instanceof Number n) || n.doubleValue() != Math.floor(n.doubleValue())) {
                        throw new IllegalArgumentException("Travel cost " + id + " -> " + target + " must be a whole number of minutes");
                    }
                    int cost = n.intValue();
                    if (cost <= 0) {
                        throw new IllegalArgumentException("Travel cost " + id + " -> " + target + " must be positive, got " + cost);
                    }
                    row.put(target, cost);
                }
            }
            declared.put(id, row);
        }

        Map<String, Map<String, Integer>> symmetric = new LinkedHashMap<>();
        for (String from : zoneIds) {
            Map<String, Integer> row = new LinkedHashMap<>();
            for (String to : zoneIds) {
                if (from.equals(to)) {
                    continue;
                }
                Integer forward = declared.get(from).get(to);
                Integer backward = declared.get(to).get(from);
                if (forward == null && backward == null) {
                    throw new IllegalArgumentException("Missing travel cost between '" + from + "' and '" + to + "'");
                }
                if (forward != null && backward != null && !forward.equals(backward)) {
                    throw new IllegalArgumentException("Asymmetric travel cost between '" + from + "' and '" + to
                            + "': " + forward + " vs " + backward);
                }
                row.put(to, forward != null ? forward : backward);
            }
            symmetric.put(from, row);
        }
        return symmetric;
    }

    private static TruckSpec truckSpec(Config tc) {
        String startZone = tc.getString("startZone");
        return new TruckSpec(
                tc.getString("id"),
                startZone,
                tc.hasPath("restockZone") ? tc.getString("restockZone") : startZone,
                tc.getInt("inventory"),
                tc.getInt("maxInventory"),
                tc.getDouble("speedMultiplier"),
                tc.hasPath("unitPrice") ? tc.getDouble("unitPrice") : 8.0,
                tc.hasPath("restockFixedFee") ? tc.getDouble("restockFixedFee") : 25.0,
                tc.hasPath("restockPerUnitCost") ? tc.getDouble("restockPerUnitCost") : 3.0);
    }

    private static void validateTruck(TruckSpec spec, Set<String> zoneIds) {
        String id = spec.id();
        if (!zoneIds.contains(spec.startZone())) {
            throw new IllegalArgumentException("Truck '" + id + "' starts in unknown zone '" + spec.startZone() + "'");
        }
        if (!zoneIds.contains(spec.restockZone())) {
            throw new IllegalArgumentException("Truck '" + id + "' restocks in unknown zone '" + spec.restockZone() + "'");
        }
        if (spec.maxInventory() < 0) {
            throw new IllegalArgumentException("Truck '" + id + "' has negative maxInventory");
        }
        if (spec.initialInventory() < 0 || spec.initialInventory() > spec.maxInventory()) {
            throw new IllegalArgumentException("Truck '" + id + "' inventory " + spec.initialInventory()
                    + " is outside [0, " + spec.maxInventory() + "]");
        }
        if (!(spec.speedMultiplier() > 0)) {
            throw new IllegalArgumentException("Truck '" + id + "' speedMultiplier must be positive, got " + spec.speedMultiplier());
        }
        if (spec.unitPrice() < 0 || spec.restockFixedFee() < 0 || spec.restockPerUnitCost() < 0) {
            throw new IllegalArgumentException("Truck '" + id + "' has a negative price or restock cost");
        }
    }
}
