package org.fleetfeast.datapipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.util.concurrent.TimeUnit;

import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSource;
import org.fleetfeast.datapipeline.api.resources.store.IStateStore;
import org.fleetfeast.datapipeline.api.services.IService;
import org.fleetfeast.datapipeline.resources.queues.InMemoryBlockingQueue;
import org.fleetfeast.datapipeline.services.AgentBridge;
import org.fleetfeast.datapipeline.services.SimulationLoop;
import org.fleetfeast.runtime.TestWorlds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class ServiceManagerTest {

    private static final String PIPELINE = """
            pipeline {
              autoStart = false
              resources {
                action-queue { className = "org.fleetfeast.datapipeline.resources.queues.InMemoryBlockingQueue", options { capacity = 8 } }
                snapshot-broadcaster { className = "org.fleetfeast.datapipeline.resources.broadcast.SnapshotBroadcaster" }
                state-store { className = "org.fleetfeast.datapipeline.resources.store.InMemoryStateStore" }
                decision-log { className = "org.fleetfeast.datapipeline.resources.log.InMemoryDecisionLog" }
              }
              services {
                simulation-loop {
                  className = "org.fleetfeast.datapipeline.services.SimulationLoop"
                  resources {
                    actions = "action-queue"
                    snapshots = "snapshot-broadcaster"
                    stateStore = "state-store"
                    decisionLog = "decision-log"
                  }
                  options { tickPeriodMs = 20 }
                }
                agent-bridge {
                  className = "org.fleetfeast.datapipeline.services.AgentBridge"
                  resources {
                    snapshots = "snapshot-broadcaster"
                    actions = "action-queue"
                    decisionLog = "decision-log"
                  }
                  options {
                    agentPeriodMs = 20
                    decisionMaker.className = "org.fleetfeast.agent.HoldDecisionMaker"
                  }
                }
              }
              startupSequence = ["simulation-loop", "agent-bridge"]
            }
            """;

    private ServiceManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
    }

    private static Config pipeline(String overrides) {
        Config world = TestWorlds.city();
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseString(PIPELINE))
                .withValue("pipeline.services.simulation-loop.options.world", world.root())
                .withValue("pipeline.services.agent-bridge.options.world", world.root());
    }

    @Test
    @DisplayName("Resources and services are wired by name and stay stopped without autoStart")
    void buildsPipeline() {
        manager = new ServiceManager(pipeline(""));

        assertThat(manager.getServiceStates())
                .containsOnlyKeys("simulation-loop", "agent-bridge")
                .allSatisfy((name, state) -> assertThat(state).isEqualTo(IService.State.STOPPED));
        assertThat(manager.getResource("action-queue", InMemoryBlockingQueue.class).getCapacity()).isEqualTo(8);
        assertThat(manager.getService("simulation-loop", SimulationLoop.class).getServiceName()).isEqualTo("simulation-loop");
        assertThat(manager.getResource("snapshot-broadcaster", ISnapshotSource.class).latest()).isPresent();
    }

    @Test
    void lookupsCheckNameAndType() {
        manager = new ServiceManager(pipeline(""));

        assertThatThrownBy(() -> manager.getResource("missing", IStateStore.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> manager.getResource("action-queue", IStateStore.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.getService("simulation-loop", AgentBridge.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Started services tick, persist state and report prefixed metrics")
    void startAndStop() {
        manager = new ServiceManager(pipeline(""));
        IStateStore store = manager.getResource("state-store", IStateStore.class);

        manager.startAll();

        await().atMost(5, TimeUnit.SECONDS).until(() -> store.get("fleet_feast:game_state").isPresent());
        assertThat(manager.getServiceStates().values()).containsOnly(IService.State.RUNNING);
        assertThat(manager.getMetrics()).containsKeys("simulation-loop.ticks_completed", "action-queue.capacity",
                "agent-bridge.cycles");
        assertThat(manager.isHealthy()).isTrue();

        manager.pauseAll();
        assertThat(manager.getServiceStates().values()).containsOnly(IService.State.PAUSED);
        manager.resumeAll();

        manager.stopAll();
        assertThat(manager.getServiceStates().values()).containsOnly(IService.State.STOPPED);
    }

    @Test
    void autoStartStartsServices() {
        manager = new ServiceManager(pipeline("pipeline.autoStart = true"));

        assertThat(manager.getServiceStates().values()).containsOnly(IService.State.RUNNING);
    }

    @Test
    void unknownResourceBindingIsRejected() {
        Config config = pipeline("pipeline.services.agent-bridge.resources.actions = \"nope\"");

        assertThatThrownBy(() -> new ServiceManager(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown resource 'nope'");
    }

    @Test
    void unknownClassIsRejected() {
        Config config = pipeline("pipeline.resources.decision-log.className = \"org.example.Missing\"");

        assertThatThrownBy(() -> new ServiceManager(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("decision-log");
    }

    @Test
    void failingConstructorIsReported() {
        Config config = pipeline("pipeline.resources.action-queue.options.capacity = 0");

        assertThatThrownBy(() -> new ServiceManager(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Capacity must be positive");
    }

    @Test
    void unknownServiceInStartupSequenceIsRejected() {
        Config config = pipeline("pipeline.startupSequence = [\"simulation-loop\", \"ghost\"]");

        assertThatThrownBy(() -> new ServiceManager(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void missingPipelineSection() {
        assertThatThrownBy(() -> new ServiceManager(ConfigFactory.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pipeline");
    }
}
