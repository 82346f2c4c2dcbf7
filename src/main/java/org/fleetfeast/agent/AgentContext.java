package org.fleetfeast.agent;

import java.util.List;
import java.util.Optional;

import org.fleetfeast.datapipeline.api.resources.log.DecisionLogEntry;
import org.fleetfeast.runtime.actions.ActionCodec;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;

/**
 * Everything a decision maker may look at during one agent cycle. Forecast queries are
 * answered synchronously from the snapshot, up to {@code maxForecastRounds} per cycle.
 */
public final class AgentContext {

    private final WorldSnapshot snapshot;
    private final List<ZoneForecast> forecastRanking;
    private final List<DecisionLogEntry> recentDecisions;
    private final ZoneForecaster forecaster;
    private final int maxForecastRounds;
    private int forecastRoundsUsed;

    public AgentContext(WorldSnapshot snapshot, List<ZoneForecast> forecastRanking,
                        List<DecisionLogEntry> recentDecisions, ZoneForecaster forecaster, int maxForecastRounds) {
        this.snapshot = snapshot;
        this.forecastRanking = List.copyOf(forecastRanking);
        this.recentDecisions = List.copyOf(recentDecisions);
        this.forecaster = forecaster;
        this.maxForecastRounds = maxForecastRounds;
    }

    public WorldSnapshot snapshot() {
        return snapshot;
    }

    /**
     * @return zones ordered by projected demand over the forecast horizon, best first
     */
    public List<ZoneForecast> forecastRanking() {
        return forecastRanking;
    }

    /**
     * @return recent decisions and their outcomes (including rejections), oldest first
     */
    public List<DecisionLogEntry> recentDecisions() {
        return recentDecisions;
    }

    public boolean canForecast() {
        return forecastRoundsUsed < maxForecastRounds;
    }

    public int forecastRoundsUsed() {
        return forecastRoundsUsed;
    }

    /**
     * Answers a forecast query and counts it against this cycle's budget.
     *
     * @return hourly average demand, empty if the zone is unknown
     * @throws DecisionMakerException if the forecast budget is used up or {@code hoursAhead}
     *                                is outside 1 to {@value ActionCodec#MAX_FORECAST_HOURS}
     */
    public Optional<List<Double>> hourlyForecast(String zoneId, int hoursAhead) throws DecisionMakerException {
        if (!canForecast()) {
            throw new DecisionMakerException("Forecast budget of " + maxForecastRounds + " rounds exhausted");
        }
        if (hoursAhead < 1 || hoursAhead > ActionCodec.MAX_FORECAST_HOURS) {
            throw new DecisionMakerException("hours_ahead must be between 1 and " + ActionCodec.MAX_FORECAST_HOURS);
        }
        forecastRoundsUsed++;
        return forecaster.hourly(snapshot, zoneId, hoursAhead);
    }
}
