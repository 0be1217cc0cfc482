package com.deepknow.livebridge.domain.session.model;

import java.util.Objects;

/**
 * 上游协议级事件，不携带媒体。是否转发给客户端由桥接层的映射表决定，从不原样转发。
 */
public final class SessionSignal implements UpstreamEvent {

    public enum Type {
        GENERATION_COMPLETE,
        TURN_COMPLETE,
        INTERRUPTED,
        GO_AWAY,
        UPSTREAM_ERROR
    }

    private final Type type;
    private final String reason;

    private SessionSignal(Type type, String reason) {
        this.type = Objects.requireNonNull(type, "type");
        this.reason = reason;
    }

    public static SessionSignal of(Type type) {
        return new SessionSignal(type, null);
    }

    public static SessionSignal of(Type type, String reason) {
        return new SessionSignal(type, reason);
    }

    public static SessionSignal upstreamError(String reason) {
        return new SessionSignal(Type.UPSTREAM_ERROR, reason);
    }

    public Type getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return reason == null ? "SessionSignal{" + type + "}" : "SessionSignal{" + type + ", " + reason + "}";
    }
}
