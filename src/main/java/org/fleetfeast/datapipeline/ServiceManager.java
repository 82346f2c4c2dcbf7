package org.fleetfeast.datapipeline;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import org.fleetfeast.datapipeline.api.resources.IMonitorable;
import org.fleetfeast.datapipeline.api.resources.IResource;
import org.fleetfeast.datapipeline.api.resources.OperationalError;
import org.fleetfeast.datapipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

/**
 * Builds the resources and services declared in the {@code pipeline} configuration and
 * manages their lifecycle.
 * <pre>
 * pipeline {
 *   resources { name { className = "...", options { ... } } }
 *   services  { name { className = "...", resources { port = "resourceName" }, options { ... } } }
 *   startupSequence = ["simulation-loop", "agent-bridge"]
 *   autoStart = true
 * }
 * </pre>
 * Resources are created with a {@code (String, Config)} constructor, services with
 * {@code (String, Config, Map<String, List<IResource>>)}. Any construction failure is a
 * configuration error and aborts startup. Services start in {@code startupSequence} order
 * and stop in reverse.
 */
public class ServiceManager implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(ServiceManager.class);

    private final Map<String, IResource> resources = new LinkedHashMap<>();
    private final Map<String, IService> services = new LinkedHashMap<>();
    private final List<String> startupSequence;

    public ServiceManager(Config rootConfig) {
        if (!rootConfig.hasPath("pipeline")) {
            throw new IllegalArgumentException("Configuration must contain 'pipeline' section");
        }
        Config pipelineConfig = rootConfig.getConfig("pipeline");
        log.info("Initializing ServiceManager...");

        instantiateResources(pipelineConfig);
        instantiateServices(pipelineConfig);

        this.startupSequence = pipelineConfig.hasPath("startupSequence")
                ? pipelineConfig.getStringList("startupSequence")
                : new ArrayList<>(services.keySet());
        for (String name : startupSequence) {
            if (!services.containsKey(name)) {
                throw new IllegalArgumentException("startupSequence references unknown service '" + name + "'");
            }
        }

        log.info("ServiceManager initialized with {} resources and {} services.", resources.size(), services.size());

        boolean autoStart = !pipelineConfig.hasPath("autoStart") || pipelineConfig.getBoolean("autoStart");
        if (autoStart) {
            startAll();
        } else {
            log.info("Auto-start is disabled. Services must be started explicitly.");
        }
    }

    private void instantiateResources(Config config) {
        if (!config.hasPath("resources")) {
            log.debug("No resources configured.");
            return;
        }
        Config resourcesConfig = config.getConfig("resources");
        for (String resourceName : resourcesConfig.root().keySet()) {
            Config definition = resourcesConfig.getConfig(quote(resourceName));
            String className = definition.getString("className");
            Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();
            IResource resource = (IResource) construct("resource", resourceName, className,
                    new Class<?>[]{String.class, Config.class}, resourceName, options);
            resources.put(resourceName, resource);
            log.info("Instantiated resource '{}' of type {}", resourceName, className);
        }
    }

    private void instantiateServices(Config config) {
        if (!config.hasPath("services")) {
            log.debug("No services configured.");
            return;
        }
        Config servicesConfig = config.getConfig("services");
        for (String serviceName : servicesConfig.root().keySet()) {
            Config definition = servicesConfig.getConfig(quote(serviceName));
            String className = definition.getString("className");
            Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();

            Map<String, List<IResource>> bindings = new LinkedHashMap<>();
            if (definition.hasPath("resources")) {
                for (Map.Entry<String, ConfigValue> entry : definition.getObject("resources").entrySet()) {
                    String portName = entry.getKey();
                    List<IResource> bound = new ArrayList<>();
                    Object raw = entry.getValue().unwrapped();
                    List<?> names = raw instanceof List<?> list ? list : List.of(raw);
                    for (Object resourceName : names) {
                        IResource resource = resources.get(resourceName.toString());
                        if (resource == null) {
                            throw new IllegalArgumentException(String.format(
                                    "Service '%s' references unknown resource '%s' for port '%s'", serviceName, resourceName, portName));
                        }
                        bound.add(resource);
                    }
                    bindings.put(portName, Collections.unmodifiableList(bound));
                }
            }

            IService service = (IService) construct("service", serviceName, className,
                    new Class<?>[]{String.class, Config.class, Map.class}, serviceName, options, bindings);
            services.put(serviceName, service);
            log.info("Instantiated service '{}' of type {}", serviceName, className);
        }
    }

    private static Object construct(String kind, String name, String className, Class<?>[] signature, Object... args) {
        try {
            return Class.forName(className).getConstructor(signature).newInstance(args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException(String.format("Failed to create %s '%s' (%s): %s",
                    kind, name, className, cause.getMessage()), cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException(String.format("Cannot instantiate %s '%s': class %s has no usable constructor (%s)",
                    kind, name, className, e.getClass().getSimpleName()), e);
        }
    }

    private static String quote(String key) {
        return ConfigUtil.joinPath(key);
    }

    private void applyToServices(Consumer<IService> action, List<String> names) {
        for (String name : names) {
            IService service = services.get(name);
            try {
                action.accept(service);
            } catch (IllegalStateException e) {
                log.warn("Could not perform action on service '{}': {}", name, e.getMessage());
            }
        }
    }

    public void startAll() {
        applyToServices(IService::start, startupSequence);
    }

    public void stopAll() {
        List<String> toStop = new ArrayList<>(startupSequence);
        services.keySet().stream().filter(s -> !toStop.contains(s)).forEach(toStop::add);
        Collections.reverse(toStop);
        List<String> running = new ArrayList<>();
        for (String name : toStop) {
            IService.State state = services.get(name).getCurrentState();
            if (state == IService.State.RUNNING || state == IService.State.PAUSED) {
                running.add(name);
            }
        }
        applyToServices(IService::stop, running);
    }

    /**
     * Stops every service and closes every {@link AutoCloseable} resource. Not restartable.
     */
    public void shutdown() {
        stopAll();
        for (Map.Entry<String, IResource> entry : resources.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                    log.debug("Closed resource: {}", entry.getKey());
                } catch (Exception e) {
                    log.error("Failed to close resource '{}': {}", entry.getKey(), e.getMessage());
                }
            }
        }
    }

    public void pauseAll() {
        applyToServices(IService::pause, new ArrayList<>(services.keySet()));
    }

    public void resumeAll() {
        applyToServices(IService::resume, new ArrayList<>(services.keySet()));
    }

    /**
     * @throws IllegalArgumentException if no resource has that name or it has another type
     */
    public <T> T getResource(String name, Class<T> expectedType) {
        IResource resource = resources.get(name);
        if (resource == null) {
            throw new IllegalArgumentException("Resource '" + name + "' not found");
        }
        if (!expectedType.isInstance(resource)) {
            throw new IllegalArgumentException("Resource '" + name + "' is of type " + resource.getClass().getName()
                    + ", not " + expectedType.getName());
        }
        return expectedType.cast(resource);
    }

    /**
     * @throws IllegalArgumentException if no service has that name or it has another type
     */
    public <T> T getService(String name, Class<T> expectedType) {
        IService service = services.get(name);
        if (service == null) {
            throw new IllegalArgumentException("Service '" + name + "' not found");
        }
        if (!expectedType.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + name + "' is of type " + service.getClass().getName()
                    + ", not " + expectedType.getName());
        }
        return expectedType.cast(service);
    }

    public Map<String, IService.State> getServiceStates() {
        Map<String, IService.State> states = new LinkedHashMap<>();
        services.forEach((name, service) -> states.put(name, service.getCurrentState()));
        return states;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        forEachMonitorable((name, monitorable) ->
                monitorable.getMetrics().forEach((key, value) -> metrics.put(name + "." + key, value)));
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        List<OperationalError> errors = new ArrayList<>();
        forEachMonitorable((name, monitorable) -> errors.addAll(monitorable.getErrors()));
        return errors;
    }

    @Override
    public void clearErrors() {
        forEachMonitorable((name, monitorable) -> monitorable.clearErrors());
    }

    @Override
    public boolean isHealthy() {
        boolean[] healthy = {true};
        forEachMonitorable((name, monitorable) -> healthy[0] &= monitorable.isHealthy());
        return healthy[0];
    }

    private void forEachMonitorable(BiConsumer<String, IMonitorable> action) {
        resources.forEach((name, resource) -> {
            if (resource instanceof IMonitorable monitorable) {
                action.accept(name, monitorable);
            }
        });
        services.forEach((name, service) -> {
            if (service instanceof IMonitorable monitorable) {
                action.accept(name, monitorable);
            }
        });
    }
}
