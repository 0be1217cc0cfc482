package com.deepknow.livebridge.websocket;

import com.deepknow.livebridge.codec.EnvelopeJson;
import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;

import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 容器回调线程与桥接入站循环之间的有界交接区。
 * <p>
 * 数据帧按容量占位入队，满时阻塞（对容器读线程形成背压）。客户端关闭排在已接收的数据之后，读者取完数据才看到关闭；
 * 传输错误与桥接侧 {@link #close()} 会丢弃未取走的数据。终态在之后的 {@link #next()} 中保持不变，
 * {@link #next()} 只允许单个读者调用。
 */
public class ClientInbox {
    private static final long OFFER_POLL_MS = 100;

    private enum Type { TEXT, BINARY, CLOSED, ERROR }

    private static final class Frame {
        final Type type;
        final String text;
        final byte[] bytes;
        final Throwable error;

        Frame(Type type, String text, byte[] bytes, Throwable error) {
            this.type = type;
            this.text = text;
            this.bytes = bytes;
            this.error = error;
        }

        boolean isData() {
            return type == Type.TEXT || type == Type.BINARY;
        }
    }

    private final LinkedBlockingQueue<Frame> queue = new LinkedBlockingQueue<>();
    private final Semaphore slots;
    private final Deque<RawEnvelope> pending = new ArrayDeque<>();
    private final EnvelopeJson json;
    private final String binaryMimeType;
    private volatile Frame terminal;
    private volatile boolean closed = false;
    // 读者已交付的终态，仅读者线程访问
    private Frame delivered;

    public ClientInbox(int capacity, EnvelopeJson json, String binaryMimeType) {
        this.slots = new Semaphore(Math.max(1, capacity));
        this.json = json;
        this.binaryMimeType = binaryMimeType;
    }

    public boolean offerText(String text) throws InterruptedException {
        return offerData(new Frame(Type.TEXT, text, null, null));
    }

    public boolean offerBinary(byte[] bytes) throws InterruptedException {
        return offerData(new Frame(Type.BINARY, null, bytes, null));
    }

    private boolean offerData(Frame frame) throws InterruptedException {
        while (!isClosed()) {
            if (!slots.tryAcquire(OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
                continue;
            }
            synchronized (this) {
                if (isClosed()) {
                    slots.release();
                    return false;
                }
                queue.add(frame);
                return true;
            }
        }
        return false;
    }

    /**
     * 客户端正常关闭：排在已接收的数据之后。
     */
    public void offerClosed() {
        offerTerminal(new Frame(Type.CLOSED, null, null, null));
    }

    /**
     * 传输错误：读者下一次调用即失败，未取走的数据丢弃。
     */
    public void offerError(Throwable error) {
        offerTerminal(new Frame(Type.ERROR, null, null, error));
    }

    private synchronized void offerTerminal(Frame frame) {
        if (terminal != null || closed) {
            return;
        }
        terminal = frame;
        queue.add(frame);
    }

    /**
     * @return 下一条信封；客户端已关闭且数据已取完时返回 null
     * @throws BridgeException READ_ERROR：帧非法或传输错误
     */
    public RawEnvelope next() throws BridgeException, InterruptedException {
        while (true) {
            if (delivered != null) {
                return onTerminal(delivered);
            }
            Frame t = terminal;
            if (t != null && t.type == Type.ERROR) {
                pending.clear();
                delivered = t;
                return onTerminal(t);
            }
            RawEnvelope queued = pending.poll();
            if (queued != null) {
                return queued;
            }
            Frame frame = queue.take();
            if (frame.isData()) {
                slots.release();
                Frame now = terminal;
                if (now != null && now.type == Type.ERROR) {
                    continue;
                }
            }
            switch (frame.type) {
                case TEXT:
                    pending.addAll(json.parseInbound(frame.text));
                    break;
                case BINARY:
                    return RawEnvelope.inboundMedia(Base64.getEncoder().encodeToString(frame.bytes), binaryMimeType);
                default:
                    delivered = frame;
                    return onTerminal(frame);
            }
        }
    }

    private RawEnvelope onTerminal(Frame frame) throws BridgeException {
        if (frame.type == Type.ERROR) {
            String msg = frame.error == null ? "transport error" : String.valueOf(frame.error.getMessage());
            throw new BridgeException(ErrorCode.READ_ERROR, "client transport error: " + msg, frame.error);
        }
        return null;
    }

    /**
     * 桥接侧关闭：丢弃未取走的数据，放行阻塞的生产者，读者随后看到关闭。
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.clear();
        if (terminal == null) {
            terminal = new Frame(Type.CLOSED, null, null, null);
        }
        queue.add(terminal);
    }

    public boolean isClosed() {
        return closed || terminal != null;
    }
}
