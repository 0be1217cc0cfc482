package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.codec.EnvelopeJson;
import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientInboxTest {
    private static final String MIME = "audio/pcm;rate=16000";

    private ClientInbox inbox(int capacity) {
        return new ClientInbox(capacity, new EnvelopeJson(), MIME);
    }

    @Test
    void textFrameWithSeveralChunksIsReadOneEnvelopeAtATime() throws Exception {
        ClientInbox inbox = inbox(4);
        inbox.offerText("{\"realtime_input\":{\"media_chunks\":["
                + "{\"data\":\"AAEC\",\"mime_type\":\"audio/pcm\"},"
                + "{\"data\":\"AwQF\",\"mime_type\":\"audio/pcm\"}]}}");
        inbox.offerText("{\"text\":\"hi\"}");

        assertEquals(RawEnvelope.inboundMedia("AAEC", "audio/pcm"), inbox.next());
        assertEquals(RawEnvelope.inboundMedia("AwQF", "audio/pcm"), inbox.next());
        assertEquals(RawEnvelope.inboundText("hi"), inbox.next());
    }

    @Test
    void binaryFrameBecomesMediaWithConfiguredType() throws Exception {
        ClientInbox inbox = inbox(1);
        inbox.offerBinary(new byte[]{0, 1, 2});

        assertEquals(RawEnvelope.inboundMedia("AAEC", MIME), inbox.next());
    }

    @Test
    void invalidJsonIsReadError() throws Exception {
        ClientInbox inbox = inbox(1);
        inbox.offerText("{oops");

        BridgeException e = assertThrows(BridgeException.class, inbox::next);
        assertEquals(ErrorCode.READ_ERROR, e.getCode());
    }

    @Test
    void acceptedFramesAreReadBeforeClose() throws Exception {
        ClientInbox inbox = inbox(4);
        assertTrue(inbox.offerText("{\"data\":\"AAEC\",\"mime_type\":\"audio/pcm\"}"));
        assertTrue(inbox.offerText("{\"text\":\"last turn\"}"));
        inbox.offerClosed();

        assertEquals(RawEnvelope.inboundMedia("AAEC", "audio/pcm"), inbox.next());
        assertEquals(RawEnvelope.inboundText("last turn"), inbox.next());
        assertNull(inbox.next());
        assertNull(inbox.next());
        assertFalse(inbox.offerText("{\"text\":\"late\"}"));
    }

    @Test
    void closeArrivingMidFrameKeepsRemainingChunks() throws Exception {
        ClientInbox inbox = inbox(1);
        inbox.offerText("{\"realtime_input\":{\"media_chunks\":["
                + "{\"data\":\"AAEC\",\"mime_type\":\"audio/pcm\"},"
                + "{\"data\":\"AwQF\",\"mime_type\":\"audio/pcm\"}]}}");

        assertEquals(RawEnvelope.inboundMedia("AAEC", "audio/pcm"), inbox.next());
        inbox.offerClosed();
        assertEquals(RawEnvelope.inboundMedia("AwQF", "audio/pcm"), inbox.next());
        assertNull(inbox.next());
    }

    @Test
    void transportErrorDropsUntakenData() throws Exception {
        ClientInbox inbox = inbox(4);
        inbox.offerBinary(new byte[]{1});
        inbox.offerError(new IOException("reset"));

        assertEquals(ErrorCode.READ_ERROR, assertThrows(BridgeException.class, inbox::next).getCode());
    }

    @Test
    void bridgeSideCloseEndsReads() throws Exception {
        ClientInbox inbox = inbox(4);
        inbox.offerBinary(new byte[]{1});
        inbox.close();

        assertNull(inbox.next());
        assertFalse(inbox.offerBinary(new byte[]{2}));
    }

    @Test
    void transportErrorIsStickyReadError() throws Exception {
        ClientInbox inbox = inbox(1);
        inbox.offerError(new IOException("reset"));
        inbox.offerClosed();

        assertEquals(ErrorCode.READ_ERROR, assertThrows(BridgeException.class, inbox::next).getCode());
        assertEquals(ErrorCode.READ_ERROR, assertThrows(BridgeException.class, inbox::next).getCode());
    }

    @Test
    void producerBlocksUntilReaderTakesAFrame() throws Exception {
        ClientInbox inbox = inbox(1);
        assertTrue(inbox.offerText("{\"text\":\"one\"}"));

        CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(() -> {
            try {
                return inbox.offerText("{\"text\":\"two\"}");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        Thread.sleep(200);
        assertFalse(second.isDone());

        assertEquals(RawEnvelope.inboundText("one"), inbox.next());
        assertTrue(second.get(5, TimeUnit.SECONDS));
        assertEquals(RawEnvelope.inboundText("two"), inbox.next());
    }

    @Test
    void closingReleasesBlockedProducer() throws Exception {
        ClientInbox inbox = inbox(1);
        inbox.offerBinary(new byte[1]);
        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> {
            try {
                return inbox.offerBinary(new byte[1]);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        inbox.close();

        assertFalse(blocked.get(5, TimeUnit.SECONDS));
        assertTrue(inbox.isClosed());
    }
}
