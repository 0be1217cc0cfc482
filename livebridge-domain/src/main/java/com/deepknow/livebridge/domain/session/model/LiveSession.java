package com.deepknow.livebridge.domain.session.model;

import com.deepknow.livebridge.domain.session.service.ClientConnection;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次会话：独占一个客户端句柄与一个上游会话，生命周期 ACTIVE -> CLOSING -> CLOSED。
 * 状态是两个转发循环之间唯一共享的可变数据，迁移均为 CAS。
 */
public class LiveSession {
    private final String id;
    private final ClientConnection client;
    private final UpstreamSession upstream;
    private final Instant createdAt;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.ACTIVE);
    private volatile long lastActivityMillis;

    public LiveSession(String id, ClientConnection client, UpstreamSession upstream) {
        this.id = Objects.requireNonNull(id, "id");
        this.client = Objects.requireNonNull(client, "client");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.createdAt = Instant.now();
        this.lastActivityMillis = System.currentTimeMillis();
    }

    public String getId() { return id; }
    public ClientConnection getClient() { return client; }
    public UpstreamSession getUpstream() { return upstream; }
    public Instant getCreatedAt() { return createdAt; }
    public SessionState getState() { return state.get(); }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    /** 仅一个调用者能成功发起关闭。 */
    public boolean beginClosing() {
        return state.compareAndSet(SessionState.ACTIVE, SessionState.CLOSING);
    }

    public boolean markClosed() {
        return state.compareAndSet(SessionState.CLOSING, SessionState.CLOSED);
    }

    public void touch() {
        this.lastActivityMillis = System.currentTimeMillis();
    }

    public long getLastActivityMillis() {
        return lastActivityMillis;
    }

    public long idleMillis(long nowMillis) {
        return nowMillis - lastActivityMillis;
    }
}
