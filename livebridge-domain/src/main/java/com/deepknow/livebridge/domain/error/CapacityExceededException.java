package com.deepknow.livebridge.domain.error;

/**
 * 并发会话已达上限，在分配任何资源前拒绝。
 */
public class CapacityExceededException extends BridgeException {
    private static final long serialVersionUID = 1L;

    public CapacityExceededException(String message) {
        super(ErrorCode.CAPACITY_EXCEEDED, message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(ErrorCode.CAPACITY_EXCEEDED, message, cause);
    }
}
