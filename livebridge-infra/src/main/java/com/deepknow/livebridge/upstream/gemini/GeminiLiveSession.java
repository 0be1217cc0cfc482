package com.deepknow.livebridge.upstream.gemini;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.ClientInput;
import com.deepknow.livebridge.domain.session.model.MediaChunk;
import com.deepknow.livebridge.domain.session.model.TextPart;
import com.deepknow.livebridge.domain.session.model.UpstreamClosed;
import com.deepknow.livebridge.domain.session.model.UpstreamEvent;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一条 Gemini Live WebSocket 连接。
 * <p>
 * 监听器每次只向服务端请求一帧；本地事件队列达到 maxBufferedEvents 时暂停请求，由 receive() 消费后恢复。
 */
public class GeminiLiveSession implements UpstreamSession {
    private static final Logger log = LoggerFactory.getLogger(GeminiLiveSession.class);
    private static final long CLOSE_GRACE_MS = 1000;
    private static final UpstreamEvent FAILED = new UpstreamEvent() {
        @Override
        public String toString() {
            return "UpstreamFailed";
        }
    };

    private final String id;
    private final GeminiMessages messages;
    private final int inputSampleRate;
    private final long sendTimeoutMs;
    private final int maxBufferedEvents;

    private final LinkedBlockingQueue<UpstreamEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> setupComplete = new CompletableFuture<>();
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final Listener listener = new Listener();
    private volatile WebSocket webSocket;
    private volatile Throwable failure;

    public GeminiLiveSession(String id, GeminiMessages messages, int inputSampleRate, long sendTimeoutMs, int maxBufferedEvents) {
        this.id = id;
        this.messages = messages;
        this.inputSampleRate = inputSampleRate;
        this.sendTimeoutMs = sendTimeoutMs;
        this.maxBufferedEvents = Math.max(1, maxBufferedEvents);
    }

    @Override
    public String getId() {
        return id;
    }

    WebSocket.Listener listener() {
        return listener;
    }

    void attach(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    void sendSetup(String setupJson, long timeoutMs) throws BridgeException, InterruptedException {
        sendRaw(setupJson, timeoutMs);
    }

    /**
     * 等待 setupComplete；期间连接被关闭或出错会以异常结束。
     */
    void awaitSetup(long timeoutMs) throws InterruptedException, ExecutionException, TimeoutException {
        setupComplete.get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void send(ClientInput input) throws BridgeException, InterruptedException {
        String json;
        try {
            if (input instanceof MediaChunk) {
                json = messages.realtimeInput((MediaChunk) input, inputSampleRate);
            } else if (input instanceof TextPart) {
                json = messages.clientText((TextPart) input);
            } else {
                throw new BridgeException(ErrorCode.SEND_ERROR, "unsupported input: " + input);
            }
        } catch (JsonProcessingException e) {
            throw new BridgeException(ErrorCode.SEND_ERROR, "serialise upstream message failed", e);
        }
        sendRaw(json, sendTimeoutMs);
        log.trace("Upstream send: sessionId={}, input={}", id, input);
    }

    private void sendRaw(String json, long timeoutMs) throws BridgeException, InterruptedException {
        WebSocket ws = this.webSocket;
        if (closed.get() || ws == null || ws.isOutputClosed()) {
            throw new BridgeException(ErrorCode.SEND_ERROR, "upstream connection is closed");
        }
        try {
            ws.sendText(json, true).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new BridgeException(ErrorCode.SEND_ERROR, "upstream write failed: " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            throw new BridgeException(ErrorCode.SEND_ERROR, "upstream write timed out after " + timeoutMs + "ms", e);
        } catch (IllegalStateException e) {
            throw new BridgeException(ErrorCode.SEND_ERROR, "upstream write rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public UpstreamEvent receive() throws BridgeException, InterruptedException {
        UpstreamEvent event = events.take();
        if (event == FAILED) {
            events.offer(FAILED);
            throw new BridgeException(ErrorCode.RECEIVE_ERROR, "upstream receive failed: " + failure, failure);
        }
        if (event instanceof UpstreamClosed) {
            // 终态事件放回队列，后续 receive() 继续返回关闭
            events.offer(event);
            return event;
        }
        resumeIfDrained();
        return event;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        setupComplete.cancel(false);
        terminate(UpstreamClosed.normal());
        WebSocket ws = this.webSocket;
        if (ws == null) {
            return;
        }
        try {
            if (!ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(CLOSE_GRACE_MS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | IllegalStateException e) {
            log.debug("Upstream close handshake incomplete: sessionId={}, reason={}", id, e.toString());
        } finally {
            ws.abort();
            log.info("Upstream closed: sessionId={}", id);
        }
    }

    private void dispatch(String json) {
        GeminiMessages.ServerMessage message;
        try {
            message = messages.parse(json);
        } catch (IOException e) {
            log.warn("Unparseable upstream message: sessionId={}, len={}", id, json.length(), e);
            fail(e);
            return;
        }
        if (message.isSetupComplete()) {
            log.info("Upstream setup complete: sessionId={}", id);
            setupComplete.complete(null);
        }
        if (message.getEvents().isEmpty()) {
            log.trace("Upstream message without relayable content: sessionId={}, len={}", id, json.length());
            return;
        }
        events.addAll(message.getEvents());
    }

    private void fail(Throwable error) {
        this.failure = error;
        setupComplete.completeExceptionally(error);
        terminate(FAILED);
    }

    private void terminate(UpstreamEvent terminal) {
        if (terminated.compareAndSet(false, true)) {
            events.offer(terminal);
        }
    }

    private void requestNext(WebSocket ws) {
        if (terminated.get()) {
            return;
        }
        if (events.size() < maxBufferedEvents) {
            ws.request(1);
            return;
        }
        paused.set(true);
        // 消费端可能已在 set 之前清空队列，复查一次避免双方都不再请求
        if (events.size() < maxBufferedEvents && paused.compareAndSet(true, false)) {
            ws.request(1);
        }
    }

    private void resumeIfDrained() {
        WebSocket ws = this.webSocket;
        if (ws != null && !terminated.get() && events.size() < maxBufferedEvents && paused.compareAndSet(true, false)) {
            ws.request(1);
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final StringBuilder text = new StringBuilder();
        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();

        @Override
        public void onOpen(WebSocket ws) {
            webSocket = ws;
            log.debug("Upstream socket open: sessionId={}", id);
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            text.append(data);
            if (!last) {
                ws.request(1);
                return null;
            }
            String json = text.toString();
            text.setLength(0);
            dispatch(json);
            requestNext(ws);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            binary.write(bytes, 0, bytes.length);
            if (!last) {
                ws.request(1);
                return null;
            }
            // Live API 以二进制帧承载 JSON
            String json = new String(binary.toByteArray(), StandardCharsets.UTF_8);
            binary.reset();
            dispatch(json);
            requestNext(ws);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            log.info("Upstream socket closed by server: sessionId={}, code={}, reason={}", id, statusCode, reason);
            setupComplete.completeExceptionally(
                    new IllegalStateException("upstream closed during setup: code=" + statusCode + " reason=" + reason));
            terminate(new UpstreamClosed(statusCode, reason));
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            if (closed.get()) {
                log.debug("Upstream socket error after close: sessionId={}, error={}", id, error.toString());
            } else {
                log.warn("Upstream socket error: sessionId={}", id, error);
            }
            fail(error);
        }
    }
}
