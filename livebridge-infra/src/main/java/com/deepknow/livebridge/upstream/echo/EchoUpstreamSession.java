package com.deepknow.livebridge.upstream.echo;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.ClientInput;
import com.deepknow.livebridge.domain.session.model.Direction;
import com.deepknow.livebridge.domain.session.model.MediaChunk;
import com.deepknow.livebridge.domain.session.model.SessionSignal;
import com.deepknow.livebridge.domain.session.model.TextPart;
import com.deepknow.livebridge.domain.session.model.UpstreamClosed;
import com.deepknow.livebridge.domain.session.model.UpstreamEvent;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 开发用回声上游：音频原样回送为 24kHz 出站音频，文本回送后附带一次 TURN_COMPLETE。
 * 回送队列有界，读取方跟不上时 send 阻塞，关闭后被唤醒并失败。
 */
public class EchoUpstreamSession implements UpstreamSession {
    private static final Logger log = LoggerFactory.getLogger(EchoUpstreamSession.class);
    static final String OUTPUT_MIME_TYPE = "audio/pcm;rate=24000";
    private static final long POLL_MS = 100;

    private final String id;
    private final LinkedBlockingQueue<UpstreamEvent> events;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EchoUpstreamSession(String id, int maxBufferedEvents) {
        this.id = id;
        this.events = new LinkedBlockingQueue<>(Math.max(1, maxBufferedEvents));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void send(ClientInput input) throws BridgeException, InterruptedException {
        if (input instanceof MediaChunk) {
            MediaChunk chunk = (MediaChunk) input;
            String mimeType = chunk.isAudio() ? OUTPUT_MIME_TYPE : chunk.getMediaType();
            enqueue(MediaChunk.outbound(chunk.getPayload(), mimeType));
        } else if (input instanceof TextPart) {
            enqueue(new TextPart(((TextPart) input).getText(), Direction.OUTBOUND));
            enqueue(SessionSignal.of(SessionSignal.Type.TURN_COMPLETE));
        } else {
            throw new BridgeException(ErrorCode.SEND_ERROR, "unsupported input: " + input);
        }
    }

    private void enqueue(UpstreamEvent event) throws BridgeException, InterruptedException {
        while (!closed.get()) {
            if (events.offer(event, POLL_MS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
        throw new BridgeException(ErrorCode.SEND_ERROR, "echo upstream is closed");
    }

    @Override
    public UpstreamEvent receive() throws InterruptedException {
        while (!closed.get()) {
            UpstreamEvent event = events.poll(POLL_MS, TimeUnit.MILLISECONDS);
            if (event != null) {
                return event;
            }
        }
        return UpstreamClosed.normal();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            events.clear();
            log.info("Echo upstream closed: sessionId={}", id);
        }
    }
}
