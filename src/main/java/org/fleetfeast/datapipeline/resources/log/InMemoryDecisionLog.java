package org.fleetfeast.datapipeline.resources.log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import org.fleetfeast.datapipeline.api.resources.log.DecisionLogEntry;
import org.fleetfeast.datapipeline.api.resources.log.IDecisionLog;
import org.fleetfeast.datapipeline.resources.AbstractResource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Keeps the newest {@code maxEntries} decisions (default 200) in memory.
 */
public class InMemoryDecisionLog extends AbstractResource implements IDecisionLog {

    private final int maxEntries;
    private final Deque<DecisionLogEntry> entries = new ArrayDeque<>();

    public InMemoryDecisionLog(String name, Config options) {
        super(name, options);
        this.maxEntries = options.withFallback(ConfigFactory.parseMap(Map.of("maxEntries", 200))).getInt("maxEntries");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive for resource '" + name + "'.");
        }
    }

    @Override
    public synchronized void append(DecisionLogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
            entries.pollFirst();
        }
    }

    @Override
    public synchronized List<DecisionLogEntry> recent(int limit) {
        List<DecisionLogEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    @Override
    protected synchronized void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("entries", entries.size());
    }
}
