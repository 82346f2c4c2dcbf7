package org.fleetfeast.node;

import java.util.ArrayList;
import java.util.List;

import org.fleetfeast.datapipeline.ServiceManager;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSource;
import org.fleetfeast.datapipeline.api.resources.log.IDecisionLog;
import org.fleetfeast.datapipeline.api.resources.store.IStateStore;
import org.fleetfeast.datapipeline.services.SimulationLoop;
import org.fleetfeast.node.processes.PipelineProcess;
import org.fleetfeast.node.processes.http.HttpServerProcess;
import org.fleetfeast.node.processes.http.api.FleetController;
import org.fleetfeast.node.spi.IProcess;
import org.fleetfeast.runtime.snapshot.PublishedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A running Fleet Feast server: the pipeline (simulation loop, agent bridge and their resources)
 * plus the HTTP server. Expects the {@code fleetfeast} configuration block.
 */
public class Node {

    private static final Logger log = LoggerFactory.getLogger(Node.class);

    static final String SNAPSHOT_SOURCE = "snapshot-broadcaster";
    static final String STATE_STORE = "state-store";
    static final String DECISION_LOG = "decision-log";
    static final String SIMULATION_LOOP = "simulation-loop";

    private final Config config;
    private final List<IProcess> processes = new ArrayList<>();
    private ServiceManager serviceManager;
    private HttpServerProcess httpServer;
    private volatile boolean running;

    public Node(Config config) {
        if (!config.hasPath("pipeline")) {
            throw new IllegalArgumentException("Configuration must contain 'pipeline' section");
        }
        this.config = config;
    }

    @SuppressWarnings("unchecked")
    public synchronized void start() {
        if (running) {
            log.warn("Node already running");
            return;
        }
        PipelineProcess pipeline = new PipelineProcess(config);
        serviceManager = pipeline.getServiceManager();
        processes.add(pipeline);

        ISnapshotSource<PublishedSnapshot> snapshots = serviceManager.getResource(SNAPSHOT_SOURCE, ISnapshotSource.class);
        IStateStore store = optionalResource(STATE_STORE, IStateStore.class);
        IDecisionLog decisionLog = optionalResource(DECISION_LOG, IDecisionLog.class);
        SimulationLoop loop = serviceManager.getService(SIMULATION_LOOP, SimulationLoop.class);

        Config httpOptions = config.hasPath("http") ? config.getConfig("http") : ConfigFactory.empty();
        httpServer = new HttpServerProcess(httpOptions, new FleetController(snapshots, store, loop, decisionLog, httpOptions));
        processes.add(httpServer);

        for (IProcess process : processes) {
            process.start();
        }
        running = true;
        log.info("Fleet Feast node started");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        for (int i = processes.size() - 1; i >= 0; i--) {
            try {
                processes.get(i).stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop process: {}", e.getMessage());
            }
        }
        processes.clear();
        running = false;
        log.info("Fleet Feast node stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public ServiceManager getServiceManager() {
        return serviceManager;
    }

    public int getHttpPort() {
        return httpServer != null ? httpServer.getPort() : -1;
    }

    private <T> T optionalResource(String name, Class<T> type) {
        try {
            return serviceManager.getResource(name, type);
        } catch (IllegalArgumentException e) {
            log.debug("Optional resource '{}' not available: {}", name, e.getMessage());
            return null;
        }
    }
}
