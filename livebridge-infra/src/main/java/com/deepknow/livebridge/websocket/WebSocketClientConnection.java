package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.codec.EnvelopeJson;
import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import com.deepknow.livebridge.domain.session.service.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.websocket.CloseReason;
import javax.websocket.Session;
import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 javax.websocket 会话的客户端连接。容器回调把帧投递到 {@link ClientInbox}，桥接循环从中读取。
 */
public class WebSocketClientConnection implements ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    private final Session session;
    private final ClientInbox inbox;
    private final EnvelopeJson json;
    private final long writeTimeoutMs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebSocketClientConnection(Session session, ClientInbox inbox, EnvelopeJson json, long writeTimeoutMs) {
        this.session = session;
        this.inbox = inbox;
        this.json = json;
        this.writeTimeoutMs = writeTimeoutMs;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    public ClientInbox getInbox() {
        return inbox;
    }

    @Override
    public RawEnvelope readEnvelope() throws BridgeException, InterruptedException {
        return inbox.next();
    }

    @Override
    public void writeEnvelope(RawEnvelope envelope) throws BridgeException, InterruptedException {
        if (!isOpen()) {
            throw new BridgeException(ErrorCode.WRITE_ERROR, "client connection is closed");
        }
        String text = json.write(envelope);
        Future<Void> f;
        try {
            f = session.getAsyncRemote().sendText(text);
        } catch (IllegalStateException e) {
            throw new BridgeException(ErrorCode.WRITE_ERROR, "client send rejected: " + e.getMessage(), e);
        }
        try {
            f.get(writeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable c = e.getCause() == null ? e : e.getCause();
            throw new BridgeException(ErrorCode.WRITE_ERROR, "client send failed: " + c.getMessage(), c);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new BridgeException(ErrorCode.WRITE_ERROR, "client send timed out after " + writeTimeoutMs + "ms", e);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    @Override
    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        inbox.close();
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseReason(CloseReason.CloseCodes.getCloseCode(code), reason));
        } catch (IOException | IllegalStateException e) {
            log.debug("WS close failed: wsSessionId={}, code={}, error={}", session.getId(), code, e.toString());
        }
    }
}
