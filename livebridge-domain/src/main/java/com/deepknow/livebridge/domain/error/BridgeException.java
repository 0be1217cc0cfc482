package com.deepknow.livebridge.domain.error;

import java.util.Objects;

/**
 * 桥接过程中的受检异常，错误只影响所属会话。
 */
public class BridgeException extends Exception {
    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    public BridgeException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public BridgeException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }
}
