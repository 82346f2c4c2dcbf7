package org.fleetfeast.datapipeline.api.resources;

/**
 * Marker for shared objects (queues, stores, broadcasters) that services are
 * wired to through named ports.
 */
public interface IResource {

    /**
     * @return the name under which this resource is declared in the pipeline configuration.
     */
    String getResourceName();
}
