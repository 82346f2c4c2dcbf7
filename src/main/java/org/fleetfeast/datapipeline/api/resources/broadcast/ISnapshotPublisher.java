package org.fleetfeast.datapipeline.api.resources.broadcast;

import org.fleetfeast.datapipeline.api.resources.IResource;

/**
 * Write side of the snapshot hand-off. Publishing never blocks on subscribers.
 *
 * @param <T> snapshot type
 */
public interface ISnapshotPublisher<T> extends IResource {

    void publish(T snapshot);
}
