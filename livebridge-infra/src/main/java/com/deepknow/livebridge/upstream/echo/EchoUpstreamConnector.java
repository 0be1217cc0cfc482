package com.deepknow.livebridge.upstream.echo;

import com.deepknow.livebridge.domain.session.model.SessionConfig;
import com.deepknow.livebridge.domain.upstream.UpstreamConnector;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EchoUpstreamConnector implements UpstreamConnector {
    private static final Logger log = LoggerFactory.getLogger(EchoUpstreamConnector.class);

    private final int maxBufferedEvents;

    public EchoUpstreamConnector(int maxBufferedEvents) {
        this.maxBufferedEvents = maxBufferedEvents;
    }

    @Override
    public String getProvider() {
        return "echo";
    }

    @Override
    public UpstreamSession open(SessionConfig config) {
        log.info("Echo upstream session started: {}", config.getSessionId());
        return new EchoUpstreamSession(config.getSessionId(), maxBufferedEvents);
    }
}
