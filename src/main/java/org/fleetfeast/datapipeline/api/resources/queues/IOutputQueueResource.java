package org.fleetfeast.datapipeline.api.resources.queues;

import java.util.concurrent.TimeUnit;

import org.fleetfeast.datapipeline.api.resources.IResource;

/**
 * Producer side of an ordered queue.
 *
 * @param <T> element type
 */
public interface IOutputQueueResource<T> extends IResource {

    /**
     * Enqueues without blocking.
     *
     * @return {@code false} if the queue is full
     */
    boolean offer(T element);

    /**
     * Enqueues, waiting up to the given timeout for space.
     *
     * @return {@code false} if the timeout elapsed before space became available
     */
    boolean offer(T element, long timeout, TimeUnit unit) throws InterruptedException;
}
