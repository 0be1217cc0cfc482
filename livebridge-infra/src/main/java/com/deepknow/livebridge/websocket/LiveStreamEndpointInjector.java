package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.domain.session.service.LiveStreamService;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

@Component
public class LiveStreamEndpointInjector {

    private final LiveStreamService liveStreamService;
    private final WebSocketConnectionFactory connectionFactory;

    public LiveStreamEndpointInjector(LiveStreamService liveStreamService, WebSocketConnectionFactory connectionFactory) {
        this.liveStreamService = liveStreamService;
        this.connectionFactory = connectionFactory;
    }

    @PostConstruct
    public void inject() {
        LiveStreamWebSocketHandler.setup(liveStreamService, connectionFactory);
    }
}
