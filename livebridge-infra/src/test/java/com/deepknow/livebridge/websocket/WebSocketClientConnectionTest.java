package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.codec.EnvelopeJson;
import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.websocket.CloseReason;
import javax.websocket.RemoteEndpoint;
import javax.websocket.Session;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSocketClientConnectionTest {
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final List<CloseReason> closes = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile Future<Void> sendResult = CompletableFuture.completedFuture(null);
    private WebSocketClientConnection connection;

    @BeforeEach
    void setUp() {
        RemoteEndpoint.Async remote = (RemoteEndpoint.Async) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[]{RemoteEndpoint.Async.class}, (proxy, method, args) -> {
                    if (method.getName().equals("sendText") && args.length == 1) {
                        sent.add((String) args[0]);
                        return sendResult;
                    }
                    throw new UnsupportedOperationException(method.getName());
                });
        Session session = (Session) Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[]{Session.class}, (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "getId":
                            return "ws-7";
                        case "isOpen":
                            return open;
                        case "getAsyncRemote":
                            return remote;
                        case "close":
                            closes.add((CloseReason) args[0]);
                            open = false;
                            return null;
                        default:
                            throw new UnsupportedOperationException(method.getName());
                    }
                });
        EnvelopeJson json = new EnvelopeJson();
        connection = new WebSocketClientConnection(session, new ClientInbox(1, json, "audio/pcm"), json, 1000);
    }

    @Test
    void writesEnvelopeAsJsonText() throws Exception {
        connection.writeEnvelope(RawEnvelope.audio("AAEC"));

        assertEquals(List.of("{\"audio\":\"AAEC\"}"), sent);
    }

    @Test
    void failedSendIsWriteError() {
        CompletableFuture<Void> failed = new CompletableFuture<>();
        failed.completeExceptionally(new java.io.IOException("broken pipe"));
        sendResult = failed;

        BridgeException e = assertThrows(BridgeException.class, () -> connection.writeEnvelope(RawEnvelope.interrupted()));
        assertEquals(ErrorCode.WRITE_ERROR, e.getCode());
    }

    @Test
    void closeSendsCodeOnceAndEndsReads() throws Exception {
        connection.close(1013, "CAPACITY_EXCEEDED");
        connection.close(1000, "bye");

        assertEquals(1, closes.size());
        assertEquals(1013, closes.get(0).getCloseCode().getCode());
        assertEquals("CAPACITY_EXCEEDED", closes.get(0).getReasonPhrase());
        assertFalse(connection.isOpen());
        assertTrue(connection.getInbox().isClosed());
        assertThrows(BridgeException.class, () -> connection.writeEnvelope(RawEnvelope.interrupted()));
    }
}
