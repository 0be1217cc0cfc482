package com.deepknow.livebridge.upstream.echo;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.session.model.Direction;
import com.deepknow.livebridge.domain.session.model.MediaChunk;
import com.deepknow.livebridge.domain.session.model.SessionSignal;
import com.deepknow.livebridge.domain.session.model.TextPart;
import com.deepknow.livebridge.domain.session.model.UpstreamClosed;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoUpstreamSessionTest {

    @Test
    void echoesAudioAsOutputAudio() throws Exception {
        EchoUpstreamSession session = new EchoUpstreamSession("s1", 8);
        session.send(MediaChunk.inbound(new byte[]{0, 1, 2}, "audio/pcm"));

        MediaChunk out = (MediaChunk) session.receive();
        assertArrayEquals(new byte[]{0, 1, 2}, out.getPayload());
        assertEquals("audio/pcm;rate=24000", out.getMediaType());
        assertEquals(Direction.OUTBOUND, out.getDirection());
    }

    @Test
    void echoesTextFollowedByTurnComplete() throws Exception {
        EchoUpstreamSession session = new EchoUpstreamSession("s1", 8);
        session.send(new TextPart("hi", Direction.INBOUND));

        assertEquals("hi", ((TextPart) session.receive()).getText());
        assertEquals(SessionSignal.Type.TURN_COMPLETE, ((SessionSignal) session.receive()).getType());
    }

    @Test
    void closeEndsReceiveAndRejectsSends() throws Exception {
        EchoUpstreamSession session = new EchoUpstreamSession("s1", 8);
        session.close();
        session.close();

        assertTrue(((UpstreamClosed) session.receive()).isNormal());
        assertTrue(((UpstreamClosed) session.receive()).isNormal());
        assertThrows(BridgeException.class, () -> session.send(MediaChunk.inbound(new byte[1], "audio/pcm")));
    }

    @Test
    void fullBufferBlocksSenderUntilReaderTakes() throws Exception {
        EchoUpstreamSession session = new EchoUpstreamSession("s1", 1);
        session.send(MediaChunk.inbound(new byte[]{1}, "audio/pcm"));

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try {
                session.send(MediaChunk.inbound(new byte[]{2}, "audio/pcm"));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(200);
        assertFalse(second.isDone());

        assertArrayEquals(new byte[]{1}, ((MediaChunk) session.receive()).getPayload());
        second.get(2, TimeUnit.SECONDS);
        assertArrayEquals(new byte[]{2}, ((MediaChunk) session.receive()).getPayload());
    }

    @Test
    void closeReleasesBlockedSender() throws Exception {
        EchoUpstreamSession session = new EchoUpstreamSession("s1", 1);
        session.send(MediaChunk.inbound(new byte[]{1}, "audio/pcm"));

        CompletableFuture<Void> blocked = CompletableFuture.runAsync(() -> {
            try {
                session.send(MediaChunk.inbound(new byte[]{2}, "audio/pcm"));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(200);
        session.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> blocked.get(2, TimeUnit.SECONDS));
        assertTrue(e.getCause().getCause() instanceof BridgeException);
        assertTrue(((UpstreamClosed) session.receive()).isNormal());
    }
}
