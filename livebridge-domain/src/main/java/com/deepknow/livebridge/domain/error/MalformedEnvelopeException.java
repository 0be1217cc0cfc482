package com.deepknow.livebridge.domain.error;

/**
 * 客户端信封格式非法（base64
 */
public class MalformedEnvelopeException extends BridgeException {
    private static final long serialVersionUID = 1L;

    public MalformedEnvelopeException(String message) {
        super(ErrorCode.MALFORMED_ENVELOPE, message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_ENVELOPE, message, cause);
    }
}
