package com.deepknow.livebridge.domain.session;

import com.deepknow.livebridge.codec.EnvelopeCodec;
import com.deepknow.livebridge.config.BridgeProperties;
import com.deepknow.livebridge.domain.error.CapacityExceededException;
import com.deepknow.livebridge.domain.session.model.LiveSession;
import com.deepknow.livebridge.domain.session.model.SessionState;
import com.deepknow.livebridge.domain.session.model.TerminationCause;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionRegistryTest {
    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private BridgeProperties props;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        props = new BridgeProperties();
        props.setIdleTimeoutMs(0);
        props.setMaxSessions(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private SessionBridge bridge(String id, SessionRegistry registry) {
        LiveSession session = new LiveSession(id, new FakeClientConnection(id), new FakeUpstreamSession(id));
        return new SessionBridge(session, new EnvelopeCodec(1024), props, scheduler, b -> registry.unregister(b.getId()));
    }

    @Test
    void reserveFailsOnceCapacityIsTaken() throws Exception {
        SessionRegistry registry = new SessionRegistry(props);
        registry.reserve();
        registry.reserve();

        assertThrows(CapacityExceededException.class, registry::reserve);
        registry.release();
        registry.reserve();
    }

    @Test
    void unregisterReturnsThePermit() throws Exception {
        SessionRegistry registry = new SessionRegistry(props);
        registry.reserve();
        registry.reserve();
        SessionBridge a = bridge("a", registry);
        registry.register(a);
        assertSame(a, registry.get("a"));
        assertEquals(1, registry.activeCount());

        registry.unregister("a");
        registry.unregister("a");
        assertNull(registry.get("a"));
        assertEquals(0, registry.activeCount());
        registry.reserve();
        assertThrows(CapacityExceededException.class, registry::reserve);
    }

    @Test
    void duplicateIdIsRejected() {
        SessionRegistry registry = new SessionRegistry(props);
        registry.register(bridge("a", registry));

        assertThrows(IllegalStateException.class, () -> registry.register(bridge("a", registry)));
    }

    @Test
    void shutdownAllClosesEverySessionAndRefusesNewOnes() throws Exception {
        SessionRegistry registry = new SessionRegistry(props);
        registry.reserve();
        registry.reserve();
        SessionBridge a = bridge("a", registry);
        SessionBridge b = bridge("b", registry);
        registry.register(a);
        registry.register(b);
        a.start(executor);
        b.start(executor);

        registry.shutdownAll();

        assertEquals(TerminationCause.SERVER_SHUTDOWN, a.terminationFuture().get(5, TimeUnit.SECONDS));
        assertEquals(TerminationCause.SERVER_SHUTDOWN, b.terminationFuture().get(5, TimeUnit.SECONDS));
        assertEquals(SessionState.CLOSED, a.getState());
        assertEquals(0, registry.activeCount());
        assertThrows(CapacityExceededException.class, registry::reserve);
    }
}
