package com.deepknow.livebridge.domain.error;

public enum ErrorCode {
    MALFORMED_ENVELOPE,
    READ_ERROR,
    WRITE_ERROR,
    CONNECT_ERROR,
    SEND_ERROR,
    RECEIVE_ERROR,
    CAPACITY_EXCEEDED,
    UNENCODABLE_CHUNK
}
