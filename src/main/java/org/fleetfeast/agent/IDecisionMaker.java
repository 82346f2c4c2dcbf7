package org.fleetfeast.agent;

import java.util.Optional;

import org.fleetfeast.runtime.actions.PendingAction;

/**
 * Chooses at most one action per agent cycle.
 * <p>
 * Implementations are instantiated by class name through a public constructor taking a
 * {@link com.typesafe.config.Config} with their options. They are called from a single
 * thread at a time.
 */
public interface IDecisionMaker {

    /**
     * @param context read-only view of the world for this cycle
     * @return the chosen action, or empty to do nothing this cycle
     * @throws DecisionMakerException if no usable answer could be obtained
     * @throws InterruptedException   if the cycle was cancelled
     */
    Optional<PendingAction> decide(AgentContext context) throws DecisionMakerException, InterruptedException;
}
