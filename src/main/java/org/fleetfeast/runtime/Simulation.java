package org.fleetfeast.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.fleetfeast.runtime.actions.ActionOutcome;
import org.fleetfeast.runtime.actions.ActionQueueProcessor;
import org.fleetfeast.runtime.actions.PendingAction;
import org.fleetfeast.runtime.demand.TickDemand;
import org.fleetfeast.runtime.demand.ZoneDemandModel;
import org.fleetfeast.runtime.model.Truck;
import org.fleetfeast.runtime.model.WorldState;
import org.fleetfeast.runtime.model.Zone;
import org.fleetfeast.runtime.snapshot.SnapshotFactory;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;
import org.fleetfeast.runtime.worldgen.WorldFactory;

import com.typesafe.config.Config;

/**
 * Owns a {@link WorldState} and advances it one tick at a time. Not thread-safe: exactly one
 * thread drives a simulation.
 * <p>
 * A tick runs, in order: apply the drained actions at the boundary, compute and record the
 * demand of every zone for the new tick, advance every truck, advance the clock, capture a
 * snapshot. Fractions of an order carry over to the zone's next tick. Given the same initial
 * world, seed and action sequence, the resulting worlds are identical.
 */
public class Simulation {

    private final WorldState world;
    private final ZoneDemandModel demandModel;
    private final TruckStateMachine stateMachine;
    private final ActionQueueProcessor processor;

    public Simulation(WorldState world, ZoneDemandModel demandModel) {
        if (world.getDayLength() != demandModel.getDayLength()) {
            throw new IllegalArgumentException("World day length " + world.getDayLength()
                    + " differs from demand model day length " + demandModel.getDayLength());
        }
        this.world = world;
        this.demandModel = demandModel;
        this.stateMachine = new TruckStateMachine();
        this.processor = new ActionQueueProcessor(stateMachine);
    }

    /**
     * Creates a simulation from the {@code world} configuration block.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static Simulation fromConfig(Config worldConfig) {
        return new Simulation(WorldFactory.create(worldConfig), WorldFactory.demandModel(worldConfig));
    }

    public TickResult tick(List<PendingAction> actions) {
        List<ActionOutcome> outcomes = processor.applyPending(world, actions);

        long now = world.getCurrentTick() + 1;
        Map<String, Double> signals = new LinkedHashMap<>();
        Map<String, Integer> orders = new LinkedHashMap<>();
        for (Zone zone : world.zones()) {
            double demand = demandModel.demandAt(zone.getProfile(), now);
            zone.recordDemand(demand);
            signals.put(zone.getId(), demand);
            orders.put(zone.getId(), zone.accrueOrders(demand));
        }
        TickDemand demand = new TickDemand(signals, orders);

        int unitsSold = 0;
        for (Truck truck : world.trucks()) {
            unitsSold += stateMachine.advance(world, truck, now, demand);
        }

        world.advanceTo(now);
        return new TickResult(now, outcomes, demand, unitsSold, SnapshotFactory.capture(world));
    }

    public WorldSnapshot snapshot() {
        return SnapshotFactory.capture(world);
    }

    public long getCurrentTick() {
        return world.getCurrentTick();
    }

    public ZoneDemandModel getDemandModel() {
        return demandModel;
    }

    /**
     * Direct access to the owned world, for the owning thread and tests only.
     */
    WorldState world() {
        return world;
    }
}
