package org.fleetfeast.node.processes.http.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.fleetfeast.datapipeline.api.resources.IMonitorable;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSource;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSubscription;
import org.fleetfeast.datapipeline.api.resources.log.DecisionLogEntry;
import org.fleetfeast.datapipeline.api.resources.log.IDecisionLog;
import org.fleetfeast.datapipeline.api.resources.store.IStateStore;
import org.fleetfeast.runtime.snapshot.PublishedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.http.sse.SseClient;

/**
 * HTTP endpoints for observers of the fleet.
 * <ul>
 *   <li>{@code GET /api/state}: latest snapshot JSON (503 before the first tick is published)</li>
 *   <li>{@code GET /api/events}: server-sent events, one {@code message} event per tick</li>
 *   <li>{@code GET /api/decisions?limit=n}: recent agent decisions, oldest first</li>
 *   <li>{@code GET /health}: store reachability and simulation loop health</li>
 * </ul>
 * Each stream client gets its own subscription and sender task, so a slow or disconnected client
 * never delays the tick thread or other clients.
 */
public class FleetController {

    private static final Logger LOGGER = LoggerFactory.getLogger(FleetController.class);

    private static final int DEFAULT_DECISION_LIMIT = 20;
    private static final int MAX_DECISION_LIMIT = 200;

    private final ISnapshotSource<PublishedSnapshot> snapshots;
    private final IStateStore stateStore;
    private final IMonitorable simulationLoop;
    private final IDecisionLog decisionLog;
    private final long keepAliveMillis;
    private final ExecutorService senders;
    private final AtomicInteger clientCounter = new AtomicInteger();

    /**
     * @param snapshots      source of published snapshots
     * @param stateStore     store checked by the health endpoint, may be {@code null}
     * @param simulationLoop loop whose health is reported, may be {@code null}
     * @param decisionLog    decision log, may be {@code null}
     * @param options        the {@code http} configuration block
     */
    public FleetController(ISnapshotSource<PublishedSnapshot> snapshots,
                           IStateStore stateStore,
                           IMonitorable simulationLoop,
                           IDecisionLog decisionLog,
                           Config options) {
        this.snapshots = snapshots;
        this.stateStore = stateStore;
        this.simulationLoop = simulationLoop;
        this.decisionLog = decisionLog;
        long keepAliveSeconds = options.hasPath("sseKeepAliveSeconds") ? options.getLong("sseKeepAliveSeconds") : 15L;
        this.keepAliveMillis = TimeUnit.SECONDS.toMillis(Math.max(1L, keepAliveSeconds));
        this.senders = Executors.newCachedThreadPool(senderThreads());
    }

    /**
     * Daemon threads named {@code sse-sender-N}, numbered independently of the clients.
     */
    static ThreadFactory senderThreads() {
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sse-sender-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public void registerRoutes(final Javalin app, final String basePath) {
        final String apiPath = (basePath + "/api").replaceAll("//", "/");
        LOGGER.debug("Registering fleet endpoints under {}", apiPath);

        app.get(apiPath + "/state", this::getState);
        app.get(apiPath + "/decisions", this::getDecisions);
        app.sse(apiPath + "/events", this::streamSnapshots);
        app.get((basePath + "/health").replaceAll("//", "/"), this::getHealth);

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.debug("Bad request for {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(Map.of("error", e.getMessage()));
        });
    }

    void getState(final Context ctx) {
        Optional<PublishedSnapshot> latest = snapshots.latest();
        if (latest.isEmpty()) {
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE).json(Map.of("error", "No snapshot published yet"));
            return;
        }
        ctx.contentType("application/json").result(latest.get().json());
    }

    void getDecisions(final Context ctx) {
        int limit = DEFAULT_DECISION_LIMIT;
        String raw = ctx.queryParam("limit");
        if (raw != null) {
            try {
                limit = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Query parameter 'limit' must be an integer, got '" + raw + "'");
            }
            if (limit < 1 || limit > MAX_DECISION_LIMIT) {
                throw new IllegalArgumentException("Query parameter 'limit' must be between 1 and " + MAX_DECISION_LIMIT);
            }
        }
        List<DecisionLogEntry> entries = decisionLog != null ? decisionLog.recent(limit) : List.of();
        ctx.json(Map.of("decisions", entries));
    }

    void getHealth(final Context ctx) {
        boolean storeReachable = stateStore == null || stateStore.isReachable();
        boolean loopHealthy = simulationLoop == null || simulationLoop.isHealthy();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", storeReachable && loopHealthy ? "healthy" : "unhealthy");
        body.put("store", storeReachable ? "connected" : "disconnected");
        if (!loopHealthy) {
            body.put("simulation", "degraded");
        }
        ctx.status(storeReachable && loopHealthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).json(body);
    }

    void streamSnapshots(final SseClient client) {
        String subscriberName = "sse-" + clientCounter.incrementAndGet();
        ISnapshotSubscription<PublishedSnapshot> subscription = snapshots.subscribe(subscriberName);
        LOGGER.debug("Stream client {} connected ({} subscribers)", subscriberName, snapshots.subscriberCount());

        client.keepAlive();
        client.onClose(() -> {
            subscription.close();
            LOGGER.debug("Stream client {} disconnected", subscriberName);
        });

        snapshots.latest().ifPresent(latest -> client.sendEvent("message", latest.json()));
        senders.submit(() -> pump(client, subscription, subscriberName));
    }

    private void pump(SseClient client, ISnapshotSubscription<PublishedSnapshot> subscription, String subscriberName) {
        long lastSent = System.currentTimeMillis();
        try {
            while (!client.terminated() && !subscription.isClosed()) {
                Optional<PublishedSnapshot> next = subscription.poll(500, TimeUnit.MILLISECONDS);
                if (next.isPresent()) {
                    client.sendEvent("message", next.get().json());
                    lastSent = System.currentTimeMillis();
                } else if (System.currentTimeMillis() - lastSent >= keepAliveMillis) {
                    client.sendComment("keep-alive");
                    lastSent = System.currentTimeMillis();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOGGER.debug("Stream client {} failed: {}", subscriberName, e.getMessage());
        } finally {
            subscription.close();
            if (subscription.droppedCount() > 0) {
                LOGGER.debug("Stream client {} skipped {} snapshots", subscriberName, subscription.droppedCount());
            }
        }
    }

    /**
     * Stops all sender tasks. Open streams end on their next send attempt.
     */
    public void close() {
        senders.shutdownNow();
    }
}
