package org.fleetfeast.datapipeline.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.fleetfeast.datapipeline.api.resources.IResource;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotPublisher;
import org.fleetfeast.datapipeline.api.resources.log.DecisionLogEntry;
import org.fleetfeast.datapipeline.api.resources.log.IDecisionLog;
import org.fleetfeast.datapipeline.api.resources.queues.IInputQueueResource;
import org.fleetfeast.datapipeline.api.resources.store.IStateStore;
import org.fleetfeast.datapipeline.api.resources.store.StateStoreException;
import org.fleetfeast.datapipeline.utils.JsonUtils;
import org.fleetfeast.runtime.Simulation;
import org.fleetfeast.runtime.TickResult;
import org.fleetfeast.runtime.actions.ActionCodec;
import org.fleetfeast.runtime.actions.ActionOutcome;
import org.fleetfeast.runtime.actions.MalformedActionException;
import org.fleetfeast.runtime.actions.PendingAction;
import org.fleetfeast.runtime.snapshot.PublishedSnapshot;
import org.fleetfeast.runtime.snapshot.WorldSnapshot;

import com.typesafe.config.Config;

/**
 * Fixed-rate driver of the {@link Simulation}. Each tick it drains the action queue, advances
 * the world by one minute, publishes the snapshot and writes it to the state store.
 * <p>
 * Ticks are never skipped or compressed: when a tick overruns its period the loop waits for
 * the next period boundary.
 * <p>
 * Resource ports:
 * <ul>
 *   <li>{@code actions} (required) - {@link IInputQueueResource} of JSON-encoded actions</li>
 *   <li>{@code snapshots} (required) - {@link ISnapshotPublisher} of {@link PublishedSnapshot}</li>
 *   <li>{@code stateStore} (optional) - {@link IStateStore} receiving the snapshot JSON</li>
 *   <li>{@code decisionLog} (optional) - {@link IDecisionLog} receiving action outcomes</li>
 * </ul>
 * Options: {@code tickPeriodMs} (1000), {@code maxActionsPerTick} (0 = all), {@code stateKey}
 * ({@code fleet_feast:game_state}), {@code requireDurability} (false),
 * {@code unhealthyAfterFailures} (30), {@code world} (world definition).
 */
public class SimulationLoop extends AbstractService {

    private final Simulation simulation;
    private final IInputQueueResource<String> actionQueue;
    private final ISnapshotPublisher<PublishedSnapshot> publisher;
    private final IStateStore stateStore;
    private final IDecisionLog decisionLog;

    private final long tickPeriodMs;
    private final int maxActionsPerTick;
    private final String stateKey;
    private final boolean requireDurability;
    private final int unhealthyAfterFailures;

    private final AtomicLong ticksCompleted = new AtomicLong();
    private final AtomicLong actionsAccepted = new AtomicLong();
    private final AtomicLong actionsRejected = new AtomicLong();
    private final AtomicLong malformedActions = new AtomicLong();
    private final AtomicLong unitsSold = new AtomicLong();
    private final AtomicLong overruns = new AtomicLong();
    private final AtomicLong storeFailuresTotal = new AtomicLong();
    private final AtomicInteger consecutiveStoreFailures = new AtomicInteger();
    private volatile long lastTickDurationMicros;
    private volatile long currentTick;

    public SimulationLoop(String name, Config options, Map<String, List<IResource>> resources) {
        this(name, options, resources, Simulation.fromConfig(options.getConfig("world")));
    }

    @SuppressWarnings("unchecked")
    SimulationLoop(String name, Config options, Map<String, List<IResource>> resources, Simulation simulation) {
        super(name, options, resources);
        this.simulation = simulation;
        this.actionQueue = getRequiredResource("actions", IInputQueueResource.class);
        this.publisher = getRequiredResource("snapshots", ISnapshotPublisher.class);
        this.stateStore = getOptionalResource("stateStore", IStateStore.class).orElse(null);
        this.decisionLog = getOptionalResource("decisionLog", IDecisionLog.class).orElse(null);

        this.tickPeriodMs = options.hasPath("tickPeriodMs") ? options.getLong("tickPeriodMs") : 1000L;
        this.maxActionsPerTick = options.hasPath("maxActionsPerTick") ? options.getInt("maxActionsPerTick") : 0;
        this.stateKey = options.hasPath("stateKey") ? options.getString("stateKey") : "fleet_feast:game_state";
        this.requireDurability = options.hasPath("requireDurability") && options.getBoolean("requireDurability");
        this.unhealthyAfterFailures = options.hasPath("unhealthyAfterFailures") ? options.getInt("unhealthyAfterFailures") : 30;

        if (tickPeriodMs <= 0) {
            throw new IllegalArgumentException("tickPeriodMs must be positive for service '" + name + "'");
        }
        if (unhealthyAfterFailures < 0) {
            throw new IllegalArgumentException("unhealthyAfterFailures must not be negative for service '" + name + "'");
        }

        // Observers connecting before the first tick see the initial world.
        this.currentTick = simulation.getCurrentTick();
        WorldSnapshot initial = simulation.snapshot();
        publisher.publish(new PublishedSnapshot(initial, JsonUtils.toJson(initial)));
    }

    @Override
    protected void logStarted() {
        log.info("SimulationLoop started: tickPeriod={}ms, startTick={}, stateKey={}, store={}, requireDurability={}",
                tickPeriodMs, currentTick, stateKey,
                stateStore != null ? stateStore.getResourceName() : "none", requireDurability);
    }

    @Override
    protected void run() throws InterruptedException {
        final long periodNanos = TimeUnit.MILLISECONDS.toNanos(tickPeriodMs);
        long nextBoundary = System.nanoTime() + periodNanos;

        while (!isStopRequested()) {
            checkPause();

            long wait = nextBoundary - System.nanoTime();
            if (wait > 0) {
                TimeUnit.NANOSECONDS.sleep(wait);
            }
            if (isStopRequested()) {
                break;
            }

            long started = System.nanoTime();
            runTick();
            long finished = System.nanoTime();
            lastTickDurationMicros = TimeUnit.NANOSECONDS.toMicros(finished - started);

            nextBoundary += periodNanos;
            if (finished > nextBoundary) {
                // Overrun (or resumed from pause): wait for the next boundary instead of catching up.
                long missed = (finished - nextBoundary) / periodNanos + 1;
                nextBoundary += missed * periodNanos;
                overruns.incrementAndGet();
                log.debug("Tick {} overran its period, next tick in {}ms", simulation.getCurrentTick(),
                        TimeUnit.NANOSECONDS.toMillis(nextBoundary - finished));
            }
        }
        log.info("Simulation loop finished at tick {}.", currentTick);
    }

    /**
     * Executes exactly one tick. Only the loop thread (or a test driving a stopped loop)
     * may call this.
     *
     * @throws IllegalStateException if durability is required and the state store failed
     *                               more than {@code unhealthyAfterFailures} times in a row
     */
    TickResult runTick() {
        List<PendingAction> actions = drainActions();
        TickResult result = simulation.tick(actions);
        currentTick = result.tick();
        ticksCompleted.incrementAndGet();
        unitsSold.addAndGet(result.unitsSold());

        for (ActionOutcome outcome : result.outcomes()) {
            handleOutcome(result.tick(), outcome);
        }

        String json = JsonUtils.toJson(result.snapshot());
        publisher.publish(new PublishedSnapshot(result.snapshot(), json));
        persist(result.tick(), json);
        return result;
    }

    private List<PendingAction> drainActions() {
        List<String> payloads = actionQueue.drainBatch(maxActionsPerTick);
        List<PendingAction> actions = new ArrayList<>(payloads.size());
        for (String payload : payloads) {
            try {
                actions.add(ActionCodec.decode(payload));
            } catch (MalformedActionException e) {
                malformedActions.incrementAndGet();
                log.warn("Discarding malformed action at tick {}: {}", simulation.getCurrentTick(), e.getMessage());
                recordError("MALFORMED_ACTION", "Failed to decode queued action", e.getMessage());
                appendDecision(simulation.getCurrentTick(), "unknown", payload, "rejected: malformed (" + e.getMessage() + ")");
            }
        }
        return actions;
    }

    private void handleOutcome(long tick, ActionOutcome outcome) {
        PendingAction action = outcome.action();
        if (outcome.accepted()) {
            actionsAccepted.incrementAndGet();
            log.debug("Applied {} at tick {}: {}", action, tick, outcome.detail());
        } else {
            actionsRejected.incrementAndGet();
            log.warn("Rejected {} at tick {}: {}", action, tick, outcome.describe());
            recordError("ACTION_REJECTED", "Action rejected: " + outcome.reason().getDescription(),
                    String.format("Action: %s, Tick: %d, Detail: %s", action, tick, outcome.detail()));
        }
        String description = action.reasoning() == null || action.reasoning().isEmpty()
                ? action.toString()
                : action + ": " + action.reasoning();
        appendDecision(tick, action.type(), description, outcome.describe());
    }

    private void appendDecision(long tick, String type, String description, String outcome) {
        if (decisionLog != null) {
            decisionLog.append(new DecisionLogEntry(System.currentTimeMillis(), tick, "simulation", type, description, outcome));
        }
    }

    private void persist(long tick, String json) {
        if (stateStore == null) {
            return;
        }
        setShutdownPhase(ShutdownPhase.PROCESSING);
        try {
            stateStore.put(stateKey, json);
            int previous = consecutiveStoreFailures.getAndSet(0);
            if (previous > 0) {
                log.info("State store '{}' recovered after {} failed writes", stateStore.getResourceName(), previous);
            }
        } catch (StateStoreException e) {
            int failures = consecutiveStoreFailures.incrementAndGet();
            storeFailuresTotal.incrementAndGet();
            log.warn("State store write failed at tick {} ({} consecutive): {}", tick, failures, e.getMessage());
            recordError("STORE_WRITE_FAILED", "Failed to write state snapshot",
                    String.format("Tick: %d, Store: %s, Consecutive: %d", tick, stateStore.getResourceName(), failures));
            if (requireDurability && failures > unhealthyAfterFailures) {
                log.error("State store '{}' failed {} consecutive writes and durability is required, stopping simulation",
                        stateStore.getResourceName(), failures);
                throw new IllegalStateException("State store unavailable for " + failures + " consecutive ticks", e);
            }
        } finally {
            setShutdownPhase(ShutdownPhase.WAITING);
        }
    }

    public int getConsecutiveStoreFailures() {
        return consecutiveStoreFailures.get();
    }

    /**
     * Healthy unless the loop has died or the state store has failed for more than
     * {@code unhealthyAfterFailures} consecutive ticks. Rejected actions do not affect health.
     */
    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR && consecutiveStoreFailures.get() <= unhealthyAfterFailures;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("current_tick", currentTick);
        metrics.put("ticks_completed", ticksCompleted.get());
        metrics.put("actions_accepted", actionsAccepted.get());
        metrics.put("actions_rejected", actionsRejected.get());
        metrics.put("actions_malformed", malformedActions.get());
        metrics.put("units_sold", unitsSold.get());
        metrics.put("tick_overruns", overruns.get());
        metrics.put("last_tick_micros", lastTickDurationMicros);
        metrics.put("store_failures_total", storeFailuresTotal.get());
        metrics.put("store_failures_consecutive", consecutiveStoreFailures.get());
    }
}
