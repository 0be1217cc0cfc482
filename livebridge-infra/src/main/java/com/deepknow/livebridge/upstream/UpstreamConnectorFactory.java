package com.deepknow.livebridge.upstream;

import com.deepknow.livebridge.config.BridgeProperties;
import com.deepknow.livebridge.domain.upstream.UpstreamConnector;
import com.deepknow.livebridge.upstream.echo.EchoUpstreamConnector;
import com.deepknow.livebridge.upstream.gemini.GeminiLiveConnector;
import com.deepknow.livebridge.upstream.gemini.GeminiLiveProperties;
import com.deepknow.livebridge.upstream.gemini.GeminiMessages;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 按 bridge.upstream-provider 选择上游实现。
 */
public class UpstreamConnectorFactory {

    public UpstreamConnector create(BridgeProperties bridge, GeminiLiveProperties gemini, ObjectMapper objectMapper) {
        String provider = bridge.getUpstreamProvider() == null ? "gemini" : bridge.getUpstreamProvider().trim().toLowerCase();
        switch (provider) {
            case "echo":
            case "mock":
                return new EchoUpstreamConnector(bridge.getUpstreamBufferFrames());
            case "gemini":
                return new GeminiLiveConnector(gemini, new GeminiMessages(objectMapper), bridge.getUpstreamBufferFrames());
            default:
                throw new IllegalArgumentException("Unknown upstream provider: " + bridge.getUpstreamProvider());
        }
    }
}
