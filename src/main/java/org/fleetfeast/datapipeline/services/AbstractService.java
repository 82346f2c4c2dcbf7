package org.fleetfeast.datapipeline.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.fleetfeast.datapipeline.api.resources.IMonitorable;
import org.fleetfeast.datapipeline.api.resources.IResource;
import org.fleetfeast.datapipeline.api.resources.OperationalError;
import org.fleetfeast.datapipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * An abstract base class for all services, providing lifecycle management, a dedicated
 * thread, resource port lookup and error tracking. Subclasses implement {@link #run()}.
 * <p>
 * Error Tracking: Services use {@link #recordError(String, String, String)} for transient
 * errors that must not stop the service.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    protected final Map<String, List<IResource>> resources;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private Thread serviceThread;
    private final int shutdownTimeoutSeconds;

    /**
     * Set when a graceful shutdown has been requested. {@link #run()} loops check
     * {@link #isStopRequested()} and return once it is set.
     */
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    /**
     * WAITING: the thread may be interrupted immediately on shutdown.
     * PROCESSING: the thread is inside a store write and gets the full timeout first.
     */
    private volatile ShutdownPhase currentShutdownPhase = ShutdownPhase.WAITING;

    /**
     * Bounded by {@link #getMaxErrors()}; oldest entries are evicted first.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * @param name      The name of the service instance.
     * @param options   The configuration for this service.
     * @param resources A map of resource ports to lists of resources.
     */
    protected AbstractService(String name, Config options, Map<String, List<IResource>> resources) {
        this.serviceName = name;
        this.options = options;
        this.resources = resources;
        this.shutdownTimeoutSeconds = options.hasPath("shutdownTimeout")
            ? options.getInt("shutdownTimeout")
            : 5;
    }

    public String getServiceName() {
        return serviceName;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs service startup. Services override this to log their effective settings.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }

        stopRequested.set(true);

        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }

        if (serviceThread != null) {
            try {
                long totalTimeoutMs = shutdownTimeoutSeconds * 1000L;
                long startTime = System.currentTimeMillis();

                if (getShutdownPhase() == ShutdownPhase.WAITING) {
                    serviceThread.interrupt();
                }

                while (serviceThread.isAlive()
                        && (System.currentTimeMillis() - startTime) < totalTimeoutMs) {
                    serviceThread.join(50);
                }

                if (serviceThread.isAlive()) {
                    log.warn("{} did not stop within {}s, forcing interrupt",
                        this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                    serviceThread.interrupt();
                    serviceThread.join(1000);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
            }

            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} seconds! Forcing ERROR state.",
                    this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                currentState.set(State.ERROR);
                return;
            }
        }

        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("{} stopped", this.getClass().getSimpleName());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Runs {@link #run()} and maps its outcome to a lifecycle state: an
     * {@link InterruptedException} is a clean shutdown, any other exception puts the
     * service into {@link State#ERROR}.
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (isInterruptInduced(e)) {
                log.debug("Service thread interrupted, shutting down.");
                Thread.currentThread().interrupt();
            } else {
                log.error("{} stopped with ERROR due to {}: {}",
                    this.getClass().getSimpleName(),
                    e.getClass().getSimpleName(),
                    e.getMessage());
                log.debug("Exception details:", e);
                currentState.set(State.ERROR);
            }
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    private static boolean isInterruptInduced(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException
                    || current instanceof java.nio.channels.ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    /**
     * The main logic of the service, executed on its dedicated thread.
     * <p>
     * <strong>Error Handling Guidelines for Services:</strong>
     * <ul>
     *   <li>Transient errors: {@code log.warn(...)} without the exception, then
     *       {@link #recordError(String, String, String)}; keep running.</li>
     *   <li>Fatal errors: {@code log.error(...)} and throw; the service enters ERROR.</li>
     *   <li>Shutdown: let {@link InterruptedException} propagate.</li>
     * </ul>
     * Stack traces are logged at DEBUG only.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is {@link State#PAUSED}.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !isStopRequested()) {
                log.debug("Service is paused, waiting...");
                pauseLock.wait();
            }
        }
    }

    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    @Override
    public ShutdownPhase getShutdownPhase() {
        return currentShutdownPhase;
    }

    /**
     * Marks an IO-critical section. Callers entering PROCESSING should clear a pending
     * interrupt with {@code Thread.interrupted()} first.
     */
    protected void setShutdownPhase(ShutdownPhase phase) {
        this.currentShutdownPhase = phase;
    }

    /**
     * Gets the single resource bound to a port, checking its type.
     *
     * @throws IllegalStateException if the port is missing, holds zero or several resources,
     *                               or the resource is of the wrong type.
     */
    protected <T> T getRequiredResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.get(portName);
        if (resourceList == null) {
            throw new IllegalStateException("Resource port '" + portName + "' is not configured.");
        }
        if (resourceList.size() != 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but exactly one is required.");
        }
        return cast(portName, resourceList.get(0), expectedType);
    }

    /**
     * Like {@link #getRequiredResource(String, Class)}, but an unbound port yields empty.
     */
    protected <T> Optional<T> getOptionalResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.getOrDefault(portName, Collections.emptyList());
        if (resourceList.isEmpty()) {
            return Optional.empty();
        }
        if (resourceList.size() > 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but at most one is allowed.");
        }
        return Optional.of(cast(portName, resourceList.get(0), expectedType));
    }

    private static <T> T cast(String portName, IResource resource, Class<T> expectedType) {
        if (!expectedType.isInstance(resource)) {
            throw new IllegalStateException("Resource at port '" + portName + "' is of type " + resource.getClass().getName() + ", but expected type is " + expectedType.getName());
        }
        return expectedType.cast(resource);
    }

    /**
     * Records a transient error. Only for errors the service survives; fatal errors
     * are thrown from {@link #run()} instead.
     *
     * @param code    Error code for categorization (e.g., "STORE_WRITE_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
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

    /**
     * Default health: not in ERROR and no recorded errors. Subclasses override this when
     * some recorded errors are expected during normal operation.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
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
     * Hook for service-specific metrics. Overrides should call {@code super} first.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
