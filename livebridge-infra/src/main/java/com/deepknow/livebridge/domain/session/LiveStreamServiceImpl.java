package com.deepknow.livebridge.domain.session;

import com.deepknow.livebridge.codec.EnvelopeCodec;
import com.deepknow.livebridge.config.BridgeProperties;
import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.UpstreamConnectException;
import com.deepknow.livebridge.domain.session.model.LiveSession;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import com.deepknow.livebridge.domain.session.model.SessionConfig;
import com.deepknow.livebridge.domain.session.model.TerminationCause;
import com.deepknow.livebridge.domain.session.service.ClientConnection;
import com.deepknow.livebridge.domain.session.service.LiveStreamService;
import com.deepknow.livebridge.domain.upstream.UpstreamConnector;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;
import com.deepknow.livebridge.upstream.gemini.GeminiLiveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class LiveStreamServiceImpl implements LiveStreamService {
    private static final Logger logger = LoggerFactory.getLogger(LiveStreamServiceImpl.class);

    private final SessionRegistry registry;
    private final UpstreamConnector connector;
    private final EnvelopeCodec codec;
    private final BridgeProperties bridgeProperties;
    private final GeminiLiveProperties geminiProperties;
    private final ExecutorService bridgeExecutor;
    private final ScheduledExecutorService scheduler;

    @Autowired
    public LiveStreamServiceImpl(SessionRegistry registry,
                                 UpstreamConnector connector,
                                 EnvelopeCodec codec,
                                 BridgeProperties bridgeProperties,
                                 GeminiLiveProperties geminiProperties) {
        this(registry, connector, codec, bridgeProperties, geminiProperties, newBridgeExecutor(), BridgeSchedulers.get());
    }

    public LiveStreamServiceImpl(SessionRegistry registry,
                                 UpstreamConnector connector,
                                 EnvelopeCodec codec,
                                 BridgeProperties bridgeProperties,
                                 GeminiLiveProperties geminiProperties,
                                 ExecutorService bridgeExecutor,
                                 ScheduledExecutorService scheduler) {
        this.registry = registry;
        this.connector = connector;
        this.codec = codec;
        this.bridgeProperties = bridgeProperties;
        this.geminiProperties = geminiProperties;
        this.bridgeExecutor = bridgeExecutor;
        this.scheduler = scheduler;
        logger.info("Live stream service ready: provider={}, maxSessions={}", connector.getProvider(), registry.getMaxSessions());
    }

    private static ExecutorService newBridgeExecutor() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "live-bridge-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        // 每个会话占用两个循环线程，受 SessionRegistry 准入限制
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(), threadFactory);
    }

    @Override
    public void open(ClientConnection connection) {
        try {
            bridgeExecutor.execute(() -> acceptOrReject(connection));
        } catch (RejectedExecutionException e) {
            logger.warn("Accept rejected, executor unavailable: wsSessionId={}", connection.getId());
            reject(connection, TerminationCause.SERVER_SHUTDOWN, "server is shutting down");
        }
    }

    private void acceptOrReject(ClientConnection connection) {
        try {
            accept(connection);
        } catch (BridgeException e) {
            reject(connection, TerminationCause.from(e.getCode()), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reject(connection, TerminationCause.SERVER_SHUTDOWN, "accept interrupted");
        } catch (RuntimeException e) {
            logger.error("Accept failed: wsSessionId={}", connection.getId(), e);
            reject(connection, TerminationCause.INTERNAL_ERROR, "accept failed");
        }
    }

    /**
     * 同步受理：准入 -> 建立上游 -> 登记 -> 启动两个转发循环。失败时不登记任何会话。
     */
    public SessionBridge accept(ClientConnection connection) throws BridgeException, InterruptedException {
        registry.reserve();
        UpstreamSession upstream;
        try {
            upstream = connector.open(buildConfig(connection.getId()));
        } catch (UpstreamConnectException | InterruptedException | RuntimeException e) {
            registry.release();
            throw e;
        }

        LiveSession session = new LiveSession(connection.getId(), connection, upstream);
        SessionBridge bridge = new SessionBridge(session, codec, bridgeProperties, scheduler,
                closed -> registry.unregister(closed.getId()));
        try {
            registry.register(bridge);
        } catch (IllegalStateException e) {
            registry.release();
            upstream.close();
            throw e;
        }
        logger.info("Open session: wsSessionId={}, provider={}, active={}",
                connection.getId(), connector.getProvider(), registry.activeCount());
        bridge.start(bridgeExecutor);
        return bridge;
    }

    private SessionConfig buildConfig(String sessionId) {
        SessionConfig config = new SessionConfig();
        config.setSessionId(sessionId);
        config.setModel(geminiProperties.getModel());
        config.setSystemInstruction(geminiProperties.getSystemInstruction());
        config.setResponseModalities(new ArrayList<>(geminiProperties.getResponseModalities()));
        config.setVoiceName(geminiProperties.getVoiceName());
        config.setInputSampleRate(geminiProperties.getInputSampleRate());
        config.setHandshakeTimeout(Duration.ofMillis(geminiProperties.getHandshakeTimeoutMs()));
        return config;
    }

    private void reject(ClientConnection connection, TerminationCause cause, String message) {
        logger.warn("Reject session: wsSessionId={}, cause={}, message={}", connection.getId(), cause, message);
        if (bridgeProperties.isSendErrorFrame() && connection.isOpen()) {
            try {
                connection.writeEnvelope(RawEnvelope.error(cause.name(), message));
            } catch (BridgeException e) {
                logger.debug("Reject frame not delivered: wsSessionId={}, error={}", connection.getId(), e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        connection.close(cause.getCloseCode(), cause.name());
    }

    @Override
    public int activeSessions() {
        return registry.activeCount();
    }

    @PreDestroy
    public void shutdown() {
        registry.shutdownAll();
        bridgeExecutor.shutdownNow();
    }
}
