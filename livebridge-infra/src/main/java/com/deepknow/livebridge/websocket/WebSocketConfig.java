package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.config.BridgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.ServletContextInitializer;
import org.springframework.context.annotation.Configuration;

import javax.servlet.ServletContext;
import javax.servlet.ServletException;
import javax.websocket.DeploymentException;
import javax.websocket.server.ServerContainer;

@Configuration
public class WebSocketConfig implements ServletContextInitializer {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final BridgeProperties props;

    public WebSocketConfig(BridgeProperties props) {
        this.props = props;
    }

    @Override
    public void onStartup(ServletContext servletContext) throws ServletException {
        Object attr = servletContext.getAttribute(ServerContainer.class.getName());
        if (!(attr instanceof ServerContainer)) {
            log.warn("No javax.websocket ServerContainer available; /ws endpoint not registered");
            return;
        }
        ServerContainer container = (ServerContainer) attr;
        container.setDefaultMaxTextMessageBufferSize(props.getMaxClientFrameBytes());
        container.setDefaultMaxBinaryMessageBufferSize(props.getMaxClientFrameBytes());
        try {
            container.addEndpoint(LiveStreamWebSocketHandler.class);
            log.info("WebSocket endpoint registered: path=/ws, maxFrameBytes={}", props.getMaxClientFrameBytes());
        } catch (DeploymentException e) {
            throw new ServletException("Failed to register WebSocket endpoint", e);
        }
    }
}
