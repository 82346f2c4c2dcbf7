package org.fleetfeast.runtime;

import java.util.List;

import org.fleetfeast.runtime.actions.ActionOutcome;
import org.fleetfeast.runtime.demand.TickDemand;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;

/**
 * What one call to {@link Simulation#tick(List)} produced.
 *
 * @param tick      the tick the world advanced to
 * @param outcomes  outcome of every action applied at the boundary, in FIFO order
 * @param demand    the tick's demand, including what was served
 * @param unitsSold units sold by the whole fleet during the tick
 * @param snapshot  the world after the tick
 */
public record TickResult(long tick, List<ActionOutcome> outcomes, TickDemand demand, int unitsSold,
                         WorldSnapshot snapshot) {
}
