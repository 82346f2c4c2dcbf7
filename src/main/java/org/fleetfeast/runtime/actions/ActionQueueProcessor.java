package org.fleetfeast.runtime.actions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.fleetfeast.runtime.TruckStateMachine;
import org.fleetfeast.runtime.model.Truck;
import org.fleetfeast.runtime.model.TruckStatus;
import org.fleetfeast.runtime.model.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a drained batch of actions to the world in FIFO order at a tick boundary.
 * <p>
 * Each truck undergoes at most one structural transition per batch. The first accepted
 * action for a truck remembers the truck's pre-batch state; any later action for the same
 * truck is evaluated against that pre-batch state and, if accepted, replaces the earlier
 * effect. A rejected later action leaves the earlier effect in place.
 * <p>
 * Rejections are returned as outcomes and never thrown.
 */
public final class ActionQueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(ActionQueueProcessor.class);

    private final TruckStateMachine stateMachine;

    public ActionQueueProcessor(TruckStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    public List<ActionOutcome> applyPending(WorldState world, List<PendingAction> actions) {
        List<ActionOutcome> outcomes = new ArrayList<>(actions.size());
        Map<String, Truck.Checkpoint> preBatch = new HashMap<>();
        long boundary = world.getCurrentTick();

        for (PendingAction action : actions) {
            ActionOutcome outcome = applyOne(world, action, boundary, preBatch);
            if (!outcome.accepted()) {
                log.debug("Rejected {} at tick {}: {}", action, boundary, outcome.detail());
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private ActionOutcome applyOne(WorldState world, PendingAction action, long boundary,
                                   Map<String, Truck.Checkpoint> preBatch) {
        Optional<Truck> target = action.targetTruck().flatMap(world::truck);
        if (target.isEmpty() || !mutates(action)) {
            return action.accept(new Evaluator(world, boundary));
        }

        Truck truck = target.get();
        Truck.Checkpoint earlier = preBatch.get(truck.getId());
        Truck.Checkpoint current = truck.checkpoint();
        if (earlier != null) {
            truck.restore(earlier);
        }
        ActionOutcome outcome = action.accept(new Evaluator(world, boundary));
        if (outcome.accepted()) {
            preBatch.putIfAbsent(truck.getId(), earlier != null ? earlier : current);
        } else {
            truck.restore(current);
        }
        return outcome;
    }

    private static boolean mutates(PendingAction action) {
        return action instanceof PendingAction.Dispatch || action instanceof PendingAction.Restock;
    }

    private final class Evaluator implements PendingAction.Visitor<ActionOutcome> {

        private final WorldState world;
        private final long boundary;

        Evaluator(WorldState world, long boundary) {
            this.world = world;
            this.boundary = boundary;
        }

        @Override
        public ActionOutcome visitDispatch(PendingAction.Dispatch dispatch) {
            Optional<Truck> found = world.truck(dispatch.truckId());
            if (found.isEmpty()) {
                return ActionOutcome.rejected(dispatch, RejectionReason.UNKNOWN_TRUCK,
                        "no truck '" + dispatch.truckId() + "'");
            }
            if (world.zone(dispatch.targetZone()).isEmpty()) {
                return ActionOutcome.rejected(dispatch, RejectionReason.UNKNOWN_ZONE,
                        "no zone '" + dispatch.targetZone() + "'");
            }
            Truck truck = found.get();
            String targetZone = dispatch.targetZone();
            switch (truck.getStatus()) {
                case RESTOCKING:
                    return ActionOutcome.rejected(dispatch, RejectionReason.INVALID_STATE_FOR_DISPATCH,
                            truck.getId() + " is restocking at " + truck.getCurrentZone());
                case IDLE:
                    if (targetZone.equals(truck.getCurrentZone())) {
                        truck.startServing();
                        return ActionOutcome.accepted(dispatch, truck.getId() + " serving at " + targetZone);
                    }
                    break;
                case SERVING:
                    if (targetZone.equals(truck.getCurrentZone())) {
                        return ActionOutcome.accepted(dispatch, truck.getId() + " already serving at " + targetZone);
                    }
                    break;
                case MOVING:
                    if (targetZone.equals(truck.getDestinationZone()) && !truck.isRestockBound()) {
                        return ActionOutcome.accepted(dispatch, truck.getId() + " already heading to " + targetZone);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled truck status " + truck.getStatus());
            }
            stateMachine.dispatch(world, truck, targetZone, boundary);
            return ActionOutcome.accepted(dispatch, truck.getId() + " heading to " + targetZone
                    + ", arriving at tick " + truck.getArrivalTick());
        }

        @Override
        public ActionOutcome visitRestock(PendingAction.Restock restock) {
            Optional<Truck> found = world.truck(restock.truckId());
            if (found.isEmpty()) {
                return ActionOutcome.rejected(restock, RejectionReason.UNKNOWN_TRUCK,
                        "no truck '" + restock.truckId() + "'");
            }
            Truck truck = found.get();
            if (truck.getStatus() != TruckStatus.IDLE) {
                return ActionOutcome.rejected(restock, RejectionReason.INVALID_STATE_FOR_RESTOCK,
                        truck.getId() + " is " + truck.getStatus());
            }
            String zoneId = truck.getCurrentZone();
            int capacity = world.zone(zoneId).map(z -> z.getParkingCapacity()).orElse(0);
            int parked = world.parkedCount(zoneId);
            if (parked > capacity) {
                return ActionOutcome.rejected(restock, RejectionReason.NO_PARKING_CAPACITY,
                        zoneId + " has " + parked + " trucks parked for " + capacity + " spots");
            }
            stateMachine.startRestock(world, truck, boundary);
            return ActionOutcome.accepted(restock, truck.getId() + " restocking at " + zoneId
                    + " until tick " + truck.getRestockCompleteTick());
        }

        @Override
        public ActionOutcome visitForecast(PendingAction.Forecast forecast) {
            return ActionOutcome.accepted(forecast, "forecast requests do not change the world");
        }

        @Override
        public ActionOutcome visitHold(PendingAction.Hold hold) {
            return ActionOutcome.accepted(hold, "holding");
        }
    }
}
