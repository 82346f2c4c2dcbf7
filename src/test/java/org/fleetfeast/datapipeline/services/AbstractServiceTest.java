package org.fleetfeast.datapipeline.services;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.fleetfeast.datapipeline.api.resources.IResource;
import org.fleetfeast.datapipeline.api.resources.log.IDecisionLog;
import org.fleetfeast.datapipeline.api.services.IService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
public class AbstractServiceTest {

    private Config config;
    private Map<String, List<IResource>> resources;

    @BeforeEach
    void setUp() {
        config = ConfigFactory.empty();
        resources = new HashMap<>();
    }

    private static class TestService extends AbstractService {
        final AtomicInteger iterations = new AtomicInteger();
        volatile boolean failNextIteration;

        TestService(String name, Config options, Map<String, List<IResource>> resources) {
            super(name, options, resources);
        }

        @Override
        protected void run() throws InterruptedException {
            while (!isStopRequested()) {
                checkPause();
                if (failNextIteration) {
                    throw new IllegalStateException("boom");
                }
                iterations.incrementAndGet();
                Thread.sleep(10);
            }
        }

        @Override
        protected int getMaxErrors() {
            return 3;
        }

        void fail(String code) {
            recordError(code, "failure", "details");
        }
    }

    @Test
    void serviceStartsAndStopsCorrectly() {
        TestService service = new TestService("test-service", config, resources);
        assertEquals(IService.State.STOPPED, service.getCurrentState());

        service.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.iterations.get() > 0);
        assertEquals(IService.State.RUNNING, service.getCurrentState());

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void servicePausesAndResumesCorrectly() {
        TestService service = new TestService("test-service", config, resources);
        service.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.iterations.get() > 0);

        service.pause();
        assertEquals(IService.State.PAUSED, service.getCurrentState());
        int pausedAt = service.iterations.get();
        await().during(100, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .until(() -> service.iterations.get() <= pausedAt + 1);

        service.resume();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.iterations.get() > pausedAt + 1);

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void pausedServiceCanBeStopped() {
        TestService service = new TestService("test-service", config, resources);
        service.start();
        service.pause();

        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void invalidTransitionsThrow() {
        TestService service = new TestService("test-service", config, resources);
        assertThrows(IllegalStateException.class, service::stop);
        assertThrows(IllegalStateException.class, service::pause);
        assertThrows(IllegalStateException.class, service::resume);

        service.start();
        assertThrows(IllegalStateException.class, service::start);
        service.stop();
    }

    @Test
    void exceptionInRunPutsServiceIntoError() {
        TestService service = new TestService("test-service", config, resources);
        service.failNextIteration = true;

        service.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> service.getCurrentState() == IService.State.ERROR);
        assertFalse(service.isHealthy());
    }

    @Test
    void getRequiredResourceReturnsCorrectResource() {
        IResource mockResource = mock(IResource.class);
        resources.put("testPort", Collections.singletonList(mockResource));
        TestService service = new TestService("test-service", config, resources);

        IResource retrieved = service.getRequiredResource("testPort", IResource.class);
        assertSame(mockResource, retrieved);
    }

    @Test
    void getRequiredResourceThrowsWhenPortNotConfigured() {
        TestService service = new TestService("test-service", config, resources);
        assertThrows(IllegalStateException.class, () -> service.getRequiredResource("nonExistent", IResource.class));
    }

    @Test
    void getRequiredResourceThrowsWhenNoResources() {
        resources.put("emptyPort", Collections.emptyList());
        TestService service = new TestService("test-service", config, resources);
        assertThrows(IllegalStateException.class, () -> service.getRequiredResource("emptyPort", IResource.class));
    }

    @Test
    void getRequiredResourceThrowsOnWrongType() {
        resources.put("testPort", Collections.singletonList(mock(IResource.class)));
        TestService service = new TestService("test-service", config, resources);
        assertThrows(IllegalStateException.class, () -> service.getRequiredResource("testPort", IDecisionLog.class));
    }

    @Test
    void getOptionalResourceIsEmptyForUnboundPort() {
        TestService service = new TestService("test-service", config, resources);
        Optional<IDecisionLog> log = service.getOptionalResource("decisionLog", IDecisionLog.class);
        assertTrue(log.isEmpty());
    }

    @Test
    void recordedErrorsAreBoundedAndAffectHealth() {
        TestService service = new TestService("test-service", config, resources);
        assertTrue(service.isHealthy());

        for (int i = 0; i < 5; i++) {
            service.fail("E" + i);
        }

        assertEquals(3, service.getErrors().size());
        assertEquals("E2", service.getErrors().get(0).code());
        assertEquals(3, service.getMetrics().get("error_count").intValue());
        assertFalse(service.isHealthy());

        service.clearErrors();
        assertTrue(service.isHealthy());
    }
}
