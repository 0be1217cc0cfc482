package com.deepknow.livebridge.domain.session;

import com.deepknow.livebridge.config.BridgeProperties;
import com.deepknow.livebridge.domain.error.CapacityExceededException;
import com.deepknow.livebridge.domain.session.model.TerminationCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 进程级活动会话表，只用于准入控制与关闭广播，不参与逐条消息的转发。
 * <p>
 * 准入分两步：{@link #reserve()} 在建立上游前占位，{@link #register(SessionBridge)} 在上游就绪后登记；
 * 上游失败时用 {@link #release()} 归还占位。
 */
@Component
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, SessionBridge> sessions = new ConcurrentHashMap<>();
    private final Semaphore permits;
    private final int maxSessions;
    private final long shutdownDeadlineMs;
    private volatile boolean shuttingDown = false;

    public SessionRegistry(BridgeProperties props) {
        this.maxSessions = Math.max(0, props.getMaxSessions());
        this.shutdownDeadlineMs = props.getShutdownDeadlineMs();
        this.permits = new Semaphore(maxSessions);
    }

    public void reserve() throws CapacityExceededException {
        if (shuttingDown) {
            throw new CapacityExceededException("server is shutting down");
        }
        if (!permits.tryAcquire()) {
            throw new CapacityExceededException("max concurrent sessions reached: " + maxSessions);
        }
    }

    public void release() {
        permits.release();
    }

    public void register(SessionBridge bridge) {
        SessionBridge previous = sessions.putIfAbsent(bridge.getId(), bridge);
        if (previous != null) {
            throw new IllegalStateException("duplicate session id: " + bridge.getId());
        }
        log.debug("Session registered: sessionId={}, active={}", bridge.getId(), sessions.size());
    }

    public void unregister(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            permits.release();
            log.debug("Session unregistered: sessionId={}, active={}", sessionId, sessions.size());
        }
    }

    public SessionBridge get(String sessionId) {
        return sessions.get(sessionId);
    }

    public int activeCount() {
        return sessions.size();
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    /**
     * 先复制再广播关闭，遍历期间不修改注册表；等待所有会话在期限内关闭。
     */
    @PreDestroy
    public void shutdownAll() {
        shuttingDown = true;
        List<SessionBridge> snapshot = new ArrayList<>(sessions.values());
        if (snapshot.isEmpty()) {
            return;
        }
        log.info("Shutting down {} active sessions", snapshot.size());
        for (SessionBridge bridge : snapshot) {
            bridge.shutdown(TerminationCause.SERVER_SHUTDOWN, "server shutting down");
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(shutdownDeadlineMs);
        for (SessionBridge bridge : snapshot) {
            long remaining = deadline - System.nanoTime();
            try {
                if (remaining <= 0 || !bridge.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Session did not close before shutdown deadline: sessionId={}", bridge.getId());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for sessions to close");
                return;
            }
        }
    }
}
