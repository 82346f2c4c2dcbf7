package org.fleetfeast.datapipeline.api.resources.queues;

import java.util.List;

import org.fleetfeast.datapipeline.api.resources.IResource;

/**
 * Consumer side of an ordered queue.
 *
 * @param <T> element type
 */
public interface IInputQueueResource<T> extends IResource {

    /**
     * Atomically removes up to {@code maxSize} elements in FIFO order without blocking.
     * Elements offered while a drain is in progress are left for the next drain.
     *
     * @param maxSize upper bound on the number of elements returned, {@code <= 0} means unbounded
     * @return the drained elements, possibly empty
     */
    List<T> drainBatch(int maxSize);

    int size();
}
