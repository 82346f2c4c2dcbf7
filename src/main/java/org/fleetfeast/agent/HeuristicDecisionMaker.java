package org.fleetfeast.agent;

import java.util.List;
import java.util.Optional;

import org.fleetfeast.runtime.actions.PendingAction;
import org.fleetfeast.runtime.model.TruckStatus;
import org.fleetfeast.runtime.snapshot.TruckSnapshot;
import org.fleetfeast.runtime.snapshot.ZoneSnapshot;

import com.typesafe.config.Config;

/**
 * Offline agent following three rules, first match wins:
 * <ol>
 *   <li>restock an idle truck whose inventory fell to {@code lowInventoryFraction} of capacity or below</li>
 *   <li>send an idle truck to the best-forecast zone with a free parking spot (or serve where it is)</li>
 *   <li>move a serving truck whose zone's projected demand trails the best zone by more than
 *       {@code switchMargin}</li>
 * </ol>
 * Otherwise it holds.
 */
public class HeuristicDecisionMaker implements IDecisionMaker {

    private final double lowInventoryFraction;
    private final double switchMargin;

    public HeuristicDecisionMaker(Config options) {
        this.lowInventoryFraction = options.hasPath("lowInventoryFraction") ? options.getDouble("lowInventoryFraction") : 0.2;
        this.switchMargin = options.hasPath("switchMargin") ? options.getDouble("switchMargin") : 0.5;
        if (lowInventoryFraction < 0 || lowInventoryFraction > 1) {
            throw new IllegalArgumentException("lowInventoryFraction must be within [0, 1]");
        }
        if (switchMargin < 0) {
            throw new IllegalArgumentException("switchMargin must not be negative");
        }
    }

    @Override
    public Optional<PendingAction> decide(AgentContext context) {
        List<TruckSnapshot> trucks = context.snapshot().trucks();
        List<ZoneForecast> ranking = context.forecastRanking();

        for (TruckSnapshot truck : trucks) {
            if (truck.status() == TruckStatus.IDLE
                    && truck.inventory() <= lowInventoryFraction * truck.maxInventory()
                    && parkingAllowsRestock(context, truck.currentZone())) {
                return Optional.of(new PendingAction.Restock(truck.id(),
                        "Inventory at " + truck.inventory() + "/" + truck.maxInventory()));
            }
        }

        for (TruckSnapshot truck : trucks) {
            if (truck.status() != TruckStatus.IDLE || truck.inventory() == 0) {
                continue;
            }
            for (ZoneForecast forecast : ranking) {
                if (forecast.zoneId().equals(truck.currentZone()) || forecast.hasFreeParking()) {
                    return Optional.of(new PendingAction.Dispatch(truck.id(), forecast.zoneId(),
                            String.format("Idle truck, %s projects %.2f orders/min", forecast.zoneId(), forecast.projectedMean())));
                }
            }
        }

        if (!ranking.isEmpty()) {
            ZoneForecast best = ranking.get(0);
            for (TruckSnapshot truck : trucks) {
                if (truck.status() != TruckStatus.SERVING || truck.currentZone().equals(best.zoneId()) || !best.hasFreeParking()) {
                    continue;
                }
                double here = projectedMean(ranking, truck.currentZone());
                if (best.projectedMean() > here * (1.0 + switchMargin)) {
                    return Optional.of(new PendingAction.Dispatch(truck.id(), best.zoneId(),
                            String.format("%s projects %.2f orders/min vs %.2f at %s",
                                    best.zoneId(), best.projectedMean(), here, truck.currentZone())));
                }
            }
        }

        return Optional.of(new PendingAction.Hold(null, "Fleet is well placed"));
    }

    private static boolean parkingAllowsRestock(AgentContext context, String zoneId) {
        Optional<ZoneSnapshot> zone = context.snapshot().zone(zoneId);
        return zone.isPresent() && ZoneForecaster.parkedTrucks(context.snapshot(), zoneId) <= zone.get().parkingSpots();
    }

    private static double projectedMean(List<ZoneForecast> ranking, String zoneId) {
        return ranking.stream()
                .filter(f -> f.zoneId().equals(zoneId))
                .mapToDouble(ZoneForecast::projectedMean)
                .findFirst()
                .orElse(0.0);
    }
}
