package org.fleetfeast.datapipeline.api.resources.store;

import java.util.Optional;

import org.fleetfeast.datapipeline.api.resources.IResource;

/**
 * Durable key-value slots holding the latest serialized world state.
 */
public interface IStateStore extends IResource {

    /**
     * Replaces the value stored under {@code key}.
     *
     * @throws StateStoreException if the backing store rejected or could not receive the write
     */
    void put(String key, String value) throws StateStoreException;

    Optional<String> get(String key) throws StateStoreException;

    /**
     * @return {@code true} if the backing store currently answers requests
     */
    boolean isReachable();
}
