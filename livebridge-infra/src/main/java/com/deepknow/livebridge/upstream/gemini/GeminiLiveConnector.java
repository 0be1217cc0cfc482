package com.deepknow.livebridge.upstream.gemini;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.UpstreamConnectException;
import com.deepknow.livebridge.domain.session.model.SessionConfig;
import com.deepknow.livebridge.domain.upstream.UpstreamConnector;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gemini Live 上游连接器：建立 WebSocket，发送 setup 并等待 setupComplete。
 */
public class GeminiLiveConnector implements UpstreamConnector {
    private static final Logger log = LoggerFactory.getLogger(GeminiLiveConnector.class);

    private final GeminiLiveProperties props;
    private final GeminiMessages messages;
    private final int maxBufferedEvents;
    private final HttpClient httpClient;

    public GeminiLiveConnector(GeminiLiveProperties props, GeminiMessages messages, int maxBufferedEvents) {
        this.props = props;
        this.messages = messages;
        this.maxBufferedEvents = maxBufferedEvents;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getHandshakeTimeoutMs()))
                .build();
        log.info("Gemini Live connector init: endpoint={} model={} modalities={}",
                props.getEndpoint(), props.getModel(), props.getResponseModalities());
    }

    @Override
    public String getProvider() {
        return "gemini";
    }

    @Override
    public UpstreamSession open(SessionConfig config) throws UpstreamConnectException, InterruptedException {
        String apiKey = props.resolveApiKey();
        if (apiKey == null || apiKey.isEmpty()) {
            throw new UpstreamConnectException("Gemini API key is not configured (gemini.api-key or env " + props.getApiKeyEnv() + ")");
        }
        Duration timeout = config.getHandshakeTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        URI uri = URI.create(props.getEndpoint() + "?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));

        GeminiLiveSession session = new GeminiLiveSession(config.getSessionId(), messages,
                config.getInputSampleRate(), props.getSendTimeoutMs(), maxBufferedEvents);
        CompletableFuture<WebSocket> connecting = httpClient.newWebSocketBuilder()
                .connectTimeout(timeout)
                .buildAsync(uri, session.listener());
        WebSocket ws;
        try {
            ws = connecting.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new UpstreamConnectException("connect to Gemini Live failed: " + describe(e.getCause()), e.getCause());
        } catch (TimeoutException e) {
            // 晚到的连接也要释放
            connecting.whenComplete((late, err) -> {
                if (late != null) late.abort();
            });
            throw new UpstreamConnectException("connect to Gemini Live timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            connecting.whenComplete((late, err) -> {
                if (late != null) late.abort();
            });
            throw e;
        }
        session.attach(ws);
        log.debug("Upstream socket connected: sessionId={}", config.getSessionId());

        boolean ready = false;
        try {
            session.sendSetup(messages.setup(config), remainingMillis(deadline));
            session.awaitSetup(remainingMillis(deadline));
            ready = true;
        } catch (JsonProcessingException e) {
            throw new UpstreamConnectException("serialise setup message failed", e);
        } catch (BridgeException e) {
            throw new UpstreamConnectException("send setup failed: " + e.getMessage(), e);
        } catch (ExecutionException e) {
            throw new UpstreamConnectException("Gemini Live setup rejected: " + describe(e.getCause()), e.getCause());
        } catch (TimeoutException e) {
            throw new UpstreamConnectException("Gemini Live setup timed out after " + timeout.toMillis() + "ms", e);
        } finally {
            if (!ready) {
                session.close();
            }
        }
        log.info("Upstream session established: sessionId={}, model={}", config.getSessionId(), config.getModel());
        return session;
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    private static String describe(Throwable t) {
        if (t instanceof WebSocketHandshakeException) {
            int status = ((WebSocketHandshakeException) t).getResponse().statusCode();
            if (status == 401 || status == 403) {
                return "authentication failed (HTTP " + status + ")";
            }
            return "handshake refused (HTTP " + status + ")";
        }
        return t == null ? "unknown" : t.toString();
    }
}
