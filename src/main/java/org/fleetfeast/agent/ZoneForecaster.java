package org.fleetfeast.agent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.fleetfeast.runtime.demand.ZoneDemandModel;
import org.fleetfeast.runtime.model.TruckStatus;
import org.fleetfeast.runtime.snapshot.TruckSnapshot;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;
import org.fleetfeast.runtime.snapshot.ZoneSnapshot;

/**
 * Projects zone demand from a snapshot using the same demand model as the simulation.
 */
public final class ZoneForecaster {

    private final ZoneDemandModel demandModel;

    public ZoneForecaster(ZoneDemandModel demandModel) {
        this.demandModel = demandModel;
    }

    /**
     * @return every zone's forecast over the next {@code horizonMinutes}, highest projected mean first
     */
    public List<ZoneForecast> rank(WorldSnapshot snapshot, int horizonMinutes) {
        List<ZoneForecast> forecasts = new ArrayList<>();
        for (ZoneSnapshot zone : snapshot.zones()) {
            double[] projected = demandModel.forecast(zone.toProfile(), snapshot.tick(), horizonMinutes);
            double sum = 0.0;
            double peak = 0.0;
            for (double value : projected) {
                sum += value;
                peak = Math.max(peak, value);
            }
            double mean = projected.length == 0 ? 0.0 : sum / projected.length;
            forecasts.add(new ZoneForecast(zone.id(), zone.currentDemand(), mean, peak, zone.trend(),
                    parkedTrucks(snapshot, zone.id()), zone.parkingSpots()));
        }
        forecasts.sort(Comparator.comparingDouble(ZoneForecast::projectedMean).reversed());
        return forecasts;
    }

    /**
     * @return hourly average demand for the next {@code hoursAhead} hours, empty for an unknown zone
     */
    public Optional<List<Double>> hourly(WorldSnapshot snapshot, String zoneId, int hoursAhead) {
        return snapshot.zone(zoneId)
                .map(zone -> demandModel.hourlyForecast(zone.toProfile(), snapshot.tick(), hoursAhead));
    }

    static int parkedTrucks(WorldSnapshot snapshot, String zoneId) {
        int count = 0;
        for (TruckSnapshot truck : snapshot.trucks()) {
            if (truck.status() != TruckStatus.MOVING && zoneId.equals(truck.currentZone())) {
                count++;
            }
        }
        return count;
    }
}
