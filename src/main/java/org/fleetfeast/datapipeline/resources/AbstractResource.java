package org.fleetfeast.datapipeline.resources;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.fleetfeast.datapipeline.api.resources.IMonitorable;
import org.fleetfeast.datapipeline.api.resources.IResource;
import org.fleetfeast.datapipeline.api.resources.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for pipeline resources. Holds the resource name and options and
 * keeps a bounded record of transient errors, mirroring the error handling of
 * {@link org.fleetfeast.datapipeline.services.AbstractService}.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    private static final int MAX_ERRORS = 1000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String name;
    protected final Config options;
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected AbstractResource(String name, Config options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        this.name = name;
        this.options = options;
    }

    @Override
    public String getResourceName() {
        return name;
    }

    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > MAX_ERRORS) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for resource-specific metrics. Overrides should call {@code super} first.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
