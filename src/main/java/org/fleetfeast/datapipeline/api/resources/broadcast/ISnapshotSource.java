package org.fleetfeast.datapipeline.api.resources.broadcast;

import java.util.Optional;

import org.fleetfeast.datapipeline.api.resources.IResource;

/**
 * Read side of the snapshot hand-off.
 *
 * @param <T> snapshot type
 */
public interface ISnapshotSource<T> extends IResource {

    /**
     * @return the most recently published snapshot, or empty before the first publish
     */
    Optional<T> latest();

    /**
     * Registers a new independently paced subscriber. The subscription only sees
     * snapshots published after this call.
     *
     * @param subscriberName name used in logs and metrics
     */
    ISnapshotSubscription<T> subscribe(String subscriberName);

    int subscriberCount();
}
