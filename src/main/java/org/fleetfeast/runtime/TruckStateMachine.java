package org.fleetfeast.runtime;

import java.util.OptionalInt;

import org.fleetfeast.runtime.demand.TickDemand;
import org.fleetfeast.runtime.model.Truck;
import org.fleetfeast.runtime.model.TruckStatus;
import org.fleetfeast.runtime.model.WorldState;
import org.fleetfeast.runtime.model.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-truck transition rules:
 * {@code IDLE -> MOVING -> SERVING -> (MOVING to restock) -> RESTOCKING -> IDLE}.
 * <p>
 * Transitions started at a tick boundary (dispatch, in-place restock) are stamped with the
 * boundary tick; transitions started while advancing are stamped with the tick being
 * computed. A truck is advanced exactly once per tick.
 */
public final class TruckStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TruckStateMachine.class);

    /**
     * Advances one truck to tick {@code now}.
     *
     * @param demand this tick's demand; serving trucks take their sales out of it
     * @return units sold by this truck during the tick
     */
    public int advance(WorldState world, Truck truck, long now, TickDemand demand) {
        switch (truck.getStatus()) {
            case IDLE:
                if (truck.getInventory() == 0) {
                    beginRestockReturn(world, truck, now);
                }
                return 0;
            case MOVING:
                if (now >= truck.getArrivalTick()) {
                    arrive(world, truck, now, demand);
                }
                return 0;
            case SERVING:
                if (truck.getInventory() == 0) {
                    beginRestockReturn(world, truck, now);
                    return 0;
                }
                int sold = demand.take(truck.getCurrentZone(), truck.getInventory());
                truck.sell(sold);
                return sold;
            case RESTOCKING:
                if (now >= truck.getRestockCompleteTick()) {
                    double cost = truck.refill();
                    truck.becomeIdle();
                    log.debug("{} restocked at {} for {}", truck.getId(), truck.getCurrentZone(), cost);
                }
                return 0;
            default:
                throw new IllegalStateException("Unhandled truck status " + truck.getStatus());
        }
    }

    private void arrive(WorldState world, Truck truck, long now, TickDemand demand) {
        boolean towardRestock = truck.isRestockBound();
        truck.arrive();
        if (towardRestock) {
            truck.startRestocking(now + world.getRestockDurationTicks());
        } else if (truck.getInventory() > 0 && demand.signal(truck.getCurrentZone()) > 0.0) {
            truck.startServing();
        } else if (truck.getInventory() == 0) {
            beginRestockReturn(world, truck, now);
        } else {
            truck.becomeIdle();
        }
    }

    /**
     * Sends an empty truck to its restock zone, or starts restocking if it is already there.
     */
    void beginRestockReturn(WorldState world, Truck truck, long tick) {
        String restockZone = truck.getSpec().restockZone();
        if (restockZone.equals(truck.getCurrentZone())) {
            truck.startRestocking(tick + world.getRestockDurationTicks());
        } else {
            truck.startMoving(restockZone, tick, tick + travelTicks(world, truck, truck.getCurrentZone(), restockZone), true);
        }
    }

    /**
     * Starts (or redirects) a trip to {@code targetZone}.
     * <p>
     * A moving truck is somewhere on the road from the zone it departed. Turning back to that
     * zone takes as long as the truck has been travelling; any other target takes the trip from
     * the departure zone, and never less than the way back.
     */
    public void dispatch(WorldState world, Truck truck, String targetZone, long boundaryTick) {
        long travel = travelTicks(world, truck, truck.getCurrentZone(), targetZone);
        if (truck.getStatus() == TruckStatus.MOVING && truck.getDepartureTick() != Truck.NO_TICK) {
            long travelled = Math.max(0L, boundaryTick - truck.getDepartureTick());
            travel = targetZone.equals(truck.getCurrentZone()) ? travelled : Math.max(travel, travelled);
        }
        truck.startMoving(targetZone, boundaryTick, boundaryTick + travel, false);
    }

    /**
     * Starts restocking in place.
     */
    public void startRestock(WorldState world, Truck truck, long boundaryTick) {
        truck.startRestocking(boundaryTick + world.getRestockDurationTicks());
    }

    /**
     * @return {@code ceil(travelCost / speedMultiplier)}
     */
    public long travelTicks(WorldState world, Truck truck, String fromZone, String toZone) {
        Zone from = world.zone(fromZone)
                .orElseThrow(() -> new IllegalArgumentException("Unknown zone '" + fromZone + "'"));
        OptionalInt cost = from.travelCostTo(toZone);
        if (cost.isEmpty()) {
            throw new IllegalArgumentException("No travel cost from '" + fromZone + "' to '" + toZone + "'");
        }
        // tolerance keeps e.g. 30 / 0.6 from rounding up to 51
        return (long) Math.ceil(cost.getAsInt() / truck.getSpec().speedMultiplier() - 1e-9);
    }
}
