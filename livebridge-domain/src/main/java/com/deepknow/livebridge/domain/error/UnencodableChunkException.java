package com.deepknow.livebridge.domain.error;

/**
 * 上游分片无法编码（超出单片上限），会话将被终止而不是转发损坏数据。
 */
public class UnencodableChunkException extends BridgeException {
    private static final long serialVersionUID = 1L;

    public UnencodableChunkException(String message) {
        super(ErrorCode.UNENCODABLE_CHUNK, message);
    }

    public UnencodableChunkException(String message, Throwable cause) {
        super(ErrorCode.UNENCODABLE_CHUNK, message, cause);
    }
}
