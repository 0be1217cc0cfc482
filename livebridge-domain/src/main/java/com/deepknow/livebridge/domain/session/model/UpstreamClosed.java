package com.deepknow.livebridge.domain.session.model;

/**
 * 上游连接已关闭。code 沿用 WebSocket 关闭码，1000 视为正常关闭。
 */
public final class UpstreamClosed implements UpstreamEvent {
    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;

    private final int code;
    private final String reason;

    public UpstreamClosed(int code, String reason) {
        this.code = code;
        this.reason = reason == null ? "" : reason;
    }

    public static UpstreamClosed normal() {
        return new UpstreamClosed(NORMAL, "closed");
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    public boolean isNormal() {
        return code == NORMAL || code == GOING_AWAY;
    }

    @Override
    public String toString() {
        return "UpstreamClosed{code=" + code + ", reason=" + reason + "}";
    }
}
