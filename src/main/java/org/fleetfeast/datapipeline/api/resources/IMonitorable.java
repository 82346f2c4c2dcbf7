package org.fleetfeast.datapipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Components that expose health, metrics and a record of transient errors.
 */
public interface IMonitorable {

    Map<String, Number> getMetrics();

    List<OperationalError> getErrors();

    void clearErrors();

    boolean isHealthy();
}
