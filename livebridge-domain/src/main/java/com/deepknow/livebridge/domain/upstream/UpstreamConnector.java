package com.deepknow.livebridge.domain.upstream;

import com.deepknow.livebridge.domain.error.UpstreamConnectException;
import com.deepknow.livebridge.domain.session.model.SessionConfig;

public interface UpstreamConnector {

    /**
     * 建立上游连接并完成握手（握手超时由 {@link SessionConfig#getHandshakeTimeout()} 限定）。
     */
    UpstreamSession open(SessionConfig config) throws UpstreamConnectException, InterruptedException;

    String getProvider();
}
