package org.fleetfeast.node.processes;

import org.fleetfeast.datapipeline.ServiceManager;
import org.fleetfeast.node.spi.IProcess;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Owns the {@link ServiceManager}. Resources and services are built on construction so that later
 * processes can look them up; services only start with {@link #start()}.
 */
public class PipelineProcess implements IProcess {

    private final ServiceManager serviceManager;

    public PipelineProcess(Config config) {
        this.serviceManager = new ServiceManager(
                ConfigFactory.parseString("pipeline.autoStart = false").withFallback(config));
    }

    @Override
    public void start() {
        serviceManager.startAll();
    }

    @Override
    public void stop() {
        serviceManager.shutdown();
    }

    public ServiceManager getServiceManager() {
        return serviceManager;
    }
}
