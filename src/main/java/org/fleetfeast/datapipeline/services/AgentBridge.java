package org.fleetfeast.datapipeline.services;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import org.fleetfeast.agent.AgentContext;
import org.fleetfeast.agent.DecisionMakerException;
import org.fleetfeast.agent.IDecisionMaker;
import org.fleetfeast.agent.ZoneForecast;
import org.fleetfeast.agent.ZoneForecaster;
import org.fleetfeast.datapipeline.api.resources.IResource;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSource;
import org.fleetfeast.datapipeline.api.resources.log.DecisionLogEntry;
import org.fleetfeast.datapipeline.api.resources.log.IDecisionLog;
import org.fleetfeast.datapipeline.api.resources.queues.IOutputQueueResource;
import org.fleetfeast.runtime.actions.ActionCodec;
import org.fleetfeast.runtime.actions.PendingAction;
import org.fleetfeast.runtime.snapshot.PublishedSnapshot;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;
import org.fleetfeast.runtime.worldgen.WorldFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Runs the decision maker on its own period and is the only producer of the action queue.
 * <p>
 * Each cycle takes the latest snapshot, ranks zones by projected demand, and gives the
 * decision maker a bounded time to choose one action. A timeout, a failure or no answer
 * is a hold for the cycle: nothing is enqueued and the simulation evolves on its own.
 * Forecast requests are answered inside the cycle and never enqueued.
 * <p>
 * Resource ports:
 * <ul>
 *   <li>{@code snapshots} (required) - {@link ISnapshotSource} of {@link PublishedSnapshot}</li>
 *   <li>{@code actions} (required) - {@link IOutputQueueResource} receiving JSON-encoded actions</li>
 *   <li>{@code decisionLog} (optional) - {@link IDecisionLog} read for context and written with decisions</li>
 * </ul>
 * Options: {@code agentPeriodMs} (30000), {@code decisionTimeoutMs} (20000),
 * {@code forecastHorizonMinutes} (60), {@code maxForecastRounds} (3), {@code recentDecisions} (10),
 * {@code decisionMaker { className, options }}, {@code world} (for the demand model).
 */
public class AgentBridge extends AbstractService {

    private final ISnapshotSource<PublishedSnapshot> snapshots;
    private final IOutputQueueResource<String> actionQueue;
    private final IDecisionLog decisionLog;
    private final IDecisionMaker decisionMaker;
    private final ZoneForecaster forecaster;
    private volatile ExecutorService decider;

    private final long agentPeriodMs;
    private final long decisionTimeoutMs;
    private final int forecastHorizonMinutes;
    private final int maxForecastRounds;
    private final int recentDecisions;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong actionsQueued = new AtomicLong();
    private final AtomicLong holds = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public AgentBridge(String name, Config options, Map<String, List<IResource>> resources) {
        this(name, options, resources, createDecisionMaker(name, options));
    }

    @SuppressWarnings("unchecked")
    AgentBridge(String name, Config options, Map<String, List<IResource>> resources, IDecisionMaker decisionMaker) {
        super(name, options, resources);
        this.snapshots = getRequiredResource("snapshots", ISnapshotSource.class);
        this.actionQueue = getRequiredResource("actions", IOutputQueueResource.class);
        this.decisionLog = getOptionalResource("decisionLog", IDecisionLog.class).orElse(null);
        this.decisionMaker = decisionMaker;

        this.agentPeriodMs = options.hasPath("agentPeriodMs") ? options.getLong("agentPeriodMs") : 30000L;
        this.decisionTimeoutMs = options.hasPath("decisionTimeoutMs") ? options.getLong("decisionTimeoutMs") : 20000L;
        this.forecastHorizonMinutes = options.hasPath("forecastHorizonMinutes") ? options.getInt("forecastHorizonMinutes") : 60;
        this.maxForecastRounds = options.hasPath("maxForecastRounds") ? options.getInt("maxForecastRounds") : 3;
        this.recentDecisions = options.hasPath("recentDecisions") ? options.getInt("recentDecisions") : 10;
        if (agentPeriodMs <= 0 || decisionTimeoutMs <= 0) {
            throw new IllegalArgumentException("agentPeriodMs and decisionTimeoutMs must be positive for service '" + name + "'");
        }
        if (forecastHorizonMinutes < 1 || maxForecastRounds < 0 || recentDecisions < 0) {
            throw new IllegalArgumentException("Invalid forecast or history settings for service '" + name + "'");
        }

        Config world = options.hasPath("world") ? options.getConfig("world") : ConfigFactory.empty();
        this.forecaster = new ZoneForecaster(WorldFactory.demandModel(world));
        this.decider = newDecider();
    }

    private ExecutorService newDecider() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, getServiceName() + "-decider");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static IDecisionMaker createDecisionMaker(String serviceName, Config options) {
        if (!options.hasPath("decisionMaker.className")) {
            throw new IllegalArgumentException("Service '" + serviceName + "' requires decisionMaker.className");
        }
        String className = options.getString("decisionMaker.className");
        Config makerOptions = options.hasPath("decisionMaker.options")
                ? options.getConfig("decisionMaker.options")
                : ConfigFactory.empty();
        try {
            return (IDecisionMaker) Class.forName(className)
                    .getConstructor(Config.class)
                    .newInstance(makerOptions);
        } catch (ReflectiveOperationException | ClassCastException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Cannot create decision maker '" + className + "' for service '"
                    + serviceName + "': " + cause.getMessage(), e);
        }
    }

    @Override
    protected void logStarted() {
        log.info("AgentBridge started: decisionMaker={}, period={}ms, timeout={}ms, horizon={}min, forecastRounds={}",
                decisionMaker.getClass().getSimpleName(), agentPeriodMs, decisionTimeoutMs, forecastHorizonMinutes, maxForecastRounds);
    }

    @Override
    protected void run() throws InterruptedException {
        // a stopped bridge can be started again
        if (decider.isShutdown()) {
            decider = newDecider();
        }
        try {
            while (!isStopRequested()) {
                checkPause();
                Thread.sleep(agentPeriodMs);
                if (isStopRequested()) {
                    break;
                }
                runCycle();
            }
        } finally {
            decider.shutdownNow();
        }
    }

    /**
     * Runs one agent cycle.
     *
     * @return the action that was enqueued, empty if the cycle ended in a hold
     */
    Optional<PendingAction> runCycle() throws InterruptedException {
        Optional<PublishedSnapshot> latest = snapshots.latest();
        if (latest.isEmpty()) {
            log.debug("No snapshot published yet, skipping agent cycle");
            return Optional.empty();
        }
        cycles.incrementAndGet();
        WorldSnapshot snapshot = latest.get().snapshot();
        List<ZoneForecast> ranking = forecaster.rank(snapshot, forecastHorizonMinutes);
        List<DecisionLogEntry> recent = decisionLog != null ? decisionLog.recent(recentDecisions) : List.of();
        AgentContext context = new AgentContext(snapshot, ranking, recent, forecaster, maxForecastRounds);

        Future<Optional<PendingAction>> pending = decider.submit(() -> decisionMaker.decide(context));
        Optional<PendingAction> decision;
        try {
            decision = pending.get(decisionTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            timeouts.incrementAndGet();
            log.warn("Decision maker did not answer within {}ms at tick {}, holding", decisionTimeoutMs, snapshot.tick());
            recordError("DECISION_TIMEOUT", "Decision maker timed out", String.format("Tick: %d, Timeout: %dms", snapshot.tick(), decisionTimeoutMs));
            return hold(snapshot.tick(), "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failures.incrementAndGet();
            String code = cause instanceof DecisionMakerException ? "DECISION_FAILED" : "DECISION_ERROR";
            log.warn("Decision maker failed at tick {}, holding: {}", snapshot.tick(), cause.getMessage());
            log.debug("Decision maker failure details:", cause);
            recordError(code, "Decision maker failed", String.format("Tick: %d, Cause: %s", snapshot.tick(), cause.getMessage()));
            return hold(snapshot.tick(), "error: " + cause.getMessage());
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        }

        if (decision.isEmpty()) {
            log.debug("Decision maker chose no action at tick {}", snapshot.tick());
            return hold(snapshot.tick(), "no action");
        }

        PendingAction action = decision.get();
        if (action instanceof PendingAction.Forecast) {
            log.debug("Decision maker ended the cycle with a forecast request, nothing to enqueue");
            appendDecision(snapshot.tick(), action, "answered");
            holds.incrementAndGet();
            return Optional.empty();
        }

        if (!actionQueue.offer(ActionCodec.encode(action))) {
            log.warn("Action queue '{}' is full, dropping {}", actionQueue.getResourceName(), action);
            recordError("QUEUE_FULL", "Action queue full", String.format("Queue: %s, Action: %s", actionQueue.getResourceName(), action));
            appendDecision(snapshot.tick(), action, "dropped: queue full");
            return Optional.empty();
        }
        actionsQueued.incrementAndGet();
        log.info("Agent queued {} at tick {}: {}", action, snapshot.tick(), action.reasoning());
        appendDecision(snapshot.tick(), action, "queued");
        return Optional.of(action);
    }

    private Optional<PendingAction> hold(long tick, String cause) {
        holds.incrementAndGet();
        if (decisionLog != null) {
            decisionLog.append(new DecisionLogEntry(System.currentTimeMillis(), tick, "agent", "hold",
                    "implicit hold (" + cause + ")", "hold"));
        }
        return Optional.empty();
    }

    private void appendDecision(long tick, PendingAction action, String outcome) {
        if (decisionLog != null) {
            String description = action.reasoning() == null || action.reasoning().isEmpty()
                    ? action.toString()
                    : action + ": " + action.reasoning();
            decisionLog.append(new DecisionLogEntry(System.currentTimeMillis(), tick, "agent", action.type(), description, outcome));
        }
    }

    /**
     * Timeouts and decision failures end in a hold and do not make the bridge unhealthy.
     */
    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("cycles", cycles.get());
        metrics.put("actions_queued", actionsQueued.get());
        metrics.put("holds", holds.get());
        metrics.put("timeouts", timeouts.get());
        metrics.put("failures", failures.get());
    }
}
