package org.fleetfeast.datapipeline.resources.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.fleetfeast.datapipeline.api.resources.store.IStateStore;
import org.fleetfeast.datapipeline.resources.AbstractResource;

import com.typesafe.config.Config;

/**
 * Non-durable state store for tests and single-process runs.
 */
public class InMemoryStateStore extends AbstractResource implements IStateStore {

    private final Map<String, String> slots = new ConcurrentHashMap<>();

    public InMemoryStateStore(String name, Config options) {
        super(name, options);
    }

    @Override
    public void put(String key, String value) {
        slots.put(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(slots.get(key));
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("slot_count", slots.size());
    }
}
