package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.domain.session.model.TerminationCause;
import com.deepknow.livebridge.domain.session.service.LiveStreamService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * 客户端实时流端点。端点实例由容器创建，依赖通过 {@link LiveStreamEndpointInjector} 静态注入。
 * <p>
 * 这里只做帧投递：文本/二进制帧进入连接的收件箱，关闭和错误作为终态帧，具体转发由会话桥接完成。
 */
@ServerEndpoint(value = "/ws")
public class LiveStreamWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(LiveStreamWebSocketHandler.class);
    static final String CONNECTION_KEY = "livebridge.connection";

    private static volatile LiveStreamService liveStreamService;
    private static volatile WebSocketConnectionFactory connectionFactory;

    public static void setup(LiveStreamService service, WebSocketConnectionFactory factory) {
        liveStreamService = service;
        connectionFactory = factory;
    }

    private static boolean ensureReady() {
        if (liveStreamService == null) {
            liveStreamService = SpringContextHolder.getBean(LiveStreamService.class);
        }
        if (connectionFactory == null) {
            connectionFactory = SpringContextHolder.getBean(WebSocketConnectionFactory.class);
        }
        return liveStreamService != null && connectionFactory != null;
    }

    @OnOpen
    public void onOpen(Session session) {
        log.info("WS connected: wsSessionId={}", session.getId());
        if (!ensureReady()) {
            log.warn("LiveStreamService not injected; refuse open for ws {}", session.getId());
            try {
                session.close(new CloseReason(CloseReason.CloseCodes.TRY_AGAIN_LATER, "SERVICE_NOT_READY"));
            } catch (IOException e) {
                log.debug("WS close failed: wsSessionId={}, error={}", session.getId(), e.toString());
            }
            return;
        }
        int maxFrame = connectionFactory.getMaxClientFrameBytes();
        session.setMaxTextMessageBufferSize(maxFrame);
        session.setMaxBinaryMessageBufferSize(maxFrame);

        WebSocketClientConnection connection = connectionFactory.create(session);
        session.getUserProperties().put(CONNECTION_KEY, connection);
        liveStreamService.open(connection);
    }

    @OnMessage
    public void onTextMessage(String text, Session session) {
        WebSocketClientConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        log.trace("Received text frame: wsSessionId={}, len={}", session.getId(), text.length());
        try {
            if (!connection.getInbox().offerText(text)) {
                log.debug("Drop text frame after close: wsSessionId={}", session.getId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.getInbox().offerError(e);
        }
    }

    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session session) {
        WebSocketClientConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        byte[] bytes = new byte[message.remaining()];
        message.get(bytes);
        log.trace("Received binary frame: wsSessionId={}, bytes={}", session.getId(), bytes.length);
        try {
            if (!connection.getInbox().offerBinary(bytes)) {
                log.debug("Drop binary frame after close: wsSessionId={}", session.getId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.getInbox().offerError(e);
        }
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        log.info("WS closed: wsSessionId={}, status={}", session.getId(), reason);
        WebSocketClientConnection connection = connectionOf(session);
        if (connection != null) {
            connection.getInbox().offerClosed();
        }
    }

    @OnError
    public void onError(Session session, Throwable throwable) {
        log.warn("WS error: wsSessionId={}, error={}", session.getId(), throwable == null ? "unknown" : throwable.toString());
        WebSocketClientConnection connection = connectionOf(session);
        if (connection != null) {
            connection.getInbox().offerError(throwable);
        } else if (session.isOpen()) {
            try {
                session.close(new CloseReason(CloseReason.CloseCodes.getCloseCode(
                        TerminationCause.READ_ERROR.getCloseCode()), TerminationCause.READ_ERROR.name()));
            } catch (IOException e) {
                log.debug("WS close failed: wsSessionId={}, error={}", session.getId(), e.toString());
            }
        }
    }

    private static WebSocketClientConnection connectionOf(Session session) {
        Object c = session.getUserProperties().get(CONNECTION_KEY);
        return c instanceof WebSocketClientConnection ? (WebSocketClientConnection) c : null;
    }
}
