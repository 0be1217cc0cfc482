package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.codec.EnvelopeJson;
import com.deepknow.livebridge.config.BridgeProperties;
import org.springframework.stereotype.Component;

import javax.websocket.Session;

@Component
public class WebSocketConnectionFactory {
    private final EnvelopeJson json;
    private final BridgeProperties props;

    public WebSocketConnectionFactory(EnvelopeJson json, BridgeProperties props) {
        this.json = json;
        this.props = props;
    }

    public WebSocketClientConnection create(Session session) {
        ClientInbox inbox = new ClientInbox(props.getInboundQueueCapacity(), json, props.getBinaryMimeType());
        return new WebSocketClientConnection(session, inbox, json, props.getWriteTimeoutMs());
    }

    public int getMaxClientFrameBytes() {
        return props.getMaxClientFrameBytes();
    }
}
