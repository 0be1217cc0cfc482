package com.deepknow.livebridge.domain.session;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.ClientInput;
import com.deepknow.livebridge.domain.session.model.UpstreamClosed;
import com.deepknow.livebridge.domain.session.model.UpstreamEvent;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可编排的上游：receive() 阻塞直到测试投递事件，send 可在第 N 次失败。
 * ignoreInterrupts 模拟不响应中断的阻塞调用，只有 close() 能让 receive() 返回。
 */
class FakeUpstreamSession implements UpstreamSession {
    private final String id;
    private final LinkedBlockingQueue<UpstreamEvent> events = new LinkedBlockingQueue<>();
    final List<ClientInput> sent = new CopyOnWriteArrayList<>();
    final AtomicInteger sendAttempts = new AtomicInteger();
    final AtomicInteger closeCount = new AtomicInteger();
    final CountDownLatch closed = new CountDownLatch(1);
    volatile int failOnSend = -1;
    volatile boolean ignoreInterrupts = false;

    FakeUpstreamSession(String id) {
        this.id = id;
    }

    void emit(UpstreamEvent event) {
        events.add(event);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void send(ClientInput input) throws BridgeException {
        int attempt = sendAttempts.incrementAndGet();
        if (attempt == failOnSend) {
            throw new BridgeException(ErrorCode.SEND_ERROR, "upstream write failed");
        }
        sent.add(input);
    }

    @Override
    public UpstreamEvent receive() throws InterruptedException {
        if (!ignoreInterrupts) {
            return events.take();
        }
        boolean interrupted = false;
        while (true) {
            try {
                closed.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return UpstreamClosed.normal();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        closed.countDown();
    }
}
