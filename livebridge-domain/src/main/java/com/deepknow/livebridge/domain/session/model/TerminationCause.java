package com.deepknow.livebridge.domain.session.model;

import com.deepknow.livebridge.domain.error.ErrorCode;

/**
 * 会话终止原因及对应的 WebSocket 关闭码。
 */
public enum TerminationCause {
    CLIENT_CLOSED(1000, false),
    UPSTREAM_CLOSED(1000, false),
    SERVER_SHUTDOWN(1001, false),
    IDLE_TIMEOUT(1001, true),
    MALFORMED_ENVELOPE(1007, true),
    READ_ERROR(1007, true),
    UNENCODABLE_CHUNK(1011, true),
    SEND_ERROR(1011, true),
    RECEIVE_ERROR(1011, true),
    WRITE_ERROR(1011, true),
    UPSTREAM_ERROR(1011, true),
    CONNECT_ERROR(1011, true),
    INTERNAL_ERROR(1011, true),
    CAPACITY_EXCEEDED(1013, true);

    private final int closeCode;
    private final boolean error;

    TerminationCause(int closeCode, boolean error) {
        this.closeCode = closeCode;
        this.error = error;
    }

    public int getCloseCode() {
        return closeCode;
    }

    public boolean isError() {
        return error;
    }

    public static TerminationCause from(ErrorCode code) {
        switch (code) {
            case MALFORMED_ENVELOPE:
                return MALFORMED_ENVELOPE;
            case READ_ERROR:
                return READ_ERROR;
            case WRITE_ERROR:
                return WRITE_ERROR;
            case SEND_ERROR:
                return SEND_ERROR;
            case RECEIVE_ERROR:
                return RECEIVE_ERROR;
            case UNENCODABLE_CHUNK:
                return UNENCODABLE_CHUNK;
            case CONNECT_ERROR:
                return CONNECT_ERROR;
            case CAPACITY_EXCEEDED:
                return CAPACITY_EXCEEDED;
            default:
                return INTERNAL_ERROR;
        }
    }
}
