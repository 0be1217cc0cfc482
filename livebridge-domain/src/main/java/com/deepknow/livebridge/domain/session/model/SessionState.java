package com.deepknow.livebridge.domain.session.model;

public enum SessionState {
    ACTIVE,
    CLOSING,
    CLOSED
}
