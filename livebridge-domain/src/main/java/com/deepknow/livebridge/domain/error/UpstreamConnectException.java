package com.deepknow.livebridge.domain.error;

/**
 * 上游连接或握手失败（网络、鉴权、握手超时）。
 */
public class UpstreamConnectException extends BridgeException {
    private static final long serialVersionUID = 1L;

    public UpstreamConnectException(String message) {
        super(ErrorCode.CONNECT_ERROR, message);
    }

    public UpstreamConnectException(String message, Throwable cause) {
        super(ErrorCode.CONNECT_ERROR, message, cause);
    }
}
