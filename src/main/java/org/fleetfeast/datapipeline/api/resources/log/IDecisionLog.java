package org.fleetfeast.datapipeline.api.resources.log;

import java.util.List;

import org.fleetfeast.datapipeline.api.resources.IResource;

/**
 * Bounded, thread-safe log of recent agent decisions and their outcomes.
 */
public interface IDecisionLog extends IResource {

    void append(DecisionLogEntry entry);

    /**
     * @param limit maximum number of entries to return
     * @return the newest entries, oldest first
     */
    List<DecisionLogEntry> recent(int limit);
}
