package org.fleetfeast.runtime.actions;

import java.util.Optional;

/**
 * An instruction from the agent, applied at the next tick boundary. The set of variants is
 * closed; {@link Visitor} forces every consumer to handle each of them.
 */
public sealed interface PendingAction
        permits PendingAction.Dispatch, PendingAction.Restock, PendingAction.Forecast, PendingAction.Hold {

    /**
     * @return free-text justification supplied by the agent, may be empty
     */
    String reasoning();

    /**
     * @return the truck this action targets, if any
     */
    Optional<String> targetTruck();

    /**
     * @return the wire name of the variant
     */
    String type();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitDispatch(Dispatch dispatch);

        R visitRestock(Restock restock);

        R visitForecast(Forecast forecast);

        R visitHold(Hold hold);
    }

    record Dispatch(String truckId, String targetZone, String reasoning) implements PendingAction {
        @Override
        public Optional<String> targetTruck() {
            return Optional.of(truckId);
        }

        @Override
        public String type() {
            return "dispatch";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDispatch(this);
        }

        @Override
        public String toString() {
            return "dispatch " + truckId + " -> " + targetZone;
        }
    }

    record Restock(String truckId, String reasoning) implements PendingAction {
        @Override
        public Optional<String> targetTruck() {
            return Optional.of(truckId);
        }

        @Override
        public String type() {
            return "restock";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRestock(this);
        }

        @Override
        public String toString() {
            return "restock " + truckId;
        }
    }

    /**
     * Read-only demand query. Answered by the agent bridge; never changes the world.
     *
     * @param hoursAhead hours of hourly averages requested (1 to 3)
     */
    record Forecast(String zoneId, int hoursAhead, String reasoning) implements PendingAction {
        @Override
        public Optional<String> targetTruck() {
            return Optional.empty();
        }

        @Override
        public String type() {
            return "forecast";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForecast(this);
        }

        @Override
        public String toString() {
            return "forecast " + zoneId + " (" + hoursAhead + "h)";
        }
    }

    /**
     * @param truckId optional truck the agent chose to keep in place, {@code null} for the whole fleet
     */
    record Hold(String truckId, String reasoning) implements PendingAction {
        @Override
        public Optional<String> targetTruck() {
            return Optional.ofNullable(truckId);
        }

        @Override
        public String type() {
            return "hold";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHold(this);
        }

        @Override
        public String toString() {
            return truckId == null ? "hold" : "hold " + truckId;
        }
    }
}
