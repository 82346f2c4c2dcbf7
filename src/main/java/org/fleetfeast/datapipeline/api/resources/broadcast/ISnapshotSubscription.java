package org.fleetfeast.datapipeline.api.resources.broadcast;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One subscriber's view of the snapshot stream. Closing it stops delivery to
 * this subscriber only.
 *
 * @param <T> snapshot type
 */
public interface ISnapshotSubscription<T> extends AutoCloseable {

    /**
     * Waits up to the timeout for the next unread snapshot.
     *
     * @return the snapshot, or empty on timeout or after close
     */
    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * @return number of snapshots discarded because this subscriber fell behind
     */
    long droppedCount();

    boolean isClosed();

    @Override
    void close();
}
