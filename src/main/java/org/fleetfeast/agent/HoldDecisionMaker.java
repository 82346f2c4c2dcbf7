package org.fleetfeast.agent;

import java.util.Optional;

import org.fleetfeast.runtime.actions.PendingAction;

import com.typesafe.config.Config;

/**
 * Never acts. Used when no agent is configured.
 */
public class HoldDecisionMaker implements IDecisionMaker {

    public HoldDecisionMaker(Config options) {
    }

    @Override
    public Optional<PendingAction> decide(AgentContext context) {
        return Optional.empty();
    }
}
