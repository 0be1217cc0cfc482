package com.deepknow.livebridge.domain.session;

import com.deepknow.livebridge.codec.EnvelopeCodec;
import com.deepknow.livebridge.config.BridgeProperties;
import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.session.model.ClientInput;
import com.deepknow.livebridge.domain.session.model.LiveSession;
import com.deepknow.livebridge.domain.session.model.MediaChunk;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import com.deepknow.livebridge.domain.session.model.SessionSignal;
import com.deepknow.livebridge.domain.session.model.SessionState;
import com.deepknow.livebridge.domain.session.model.TerminationCause;
import com.deepknow.livebridge.domain.session.model.TextPart;
import com.deepknow.livebridge.domain.session.model.UpstreamClosed;
import com.deepknow.livebridge.domain.session.model.UpstreamEvent;
import com.deepknow.livebridge.domain.session.service.ClientConnection;
import com.deepknow.livebridge.domain.upstream.UpstreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 单个会话的双向桥接：入站循环（客户端 -> 上游）与出站循环（上游 -> 客户端）各占一个线程。
 * <p>
 * 任一循环发现终止条件即发起联合关闭：状态 ACTIVE -> CLOSING（仅一次成功），中断另一循环的阻塞调用；
 * 最后一个退出的循环负责收尾，两条腿各关闭一次，之后才进入 CLOSED。
 * 客户端写端只由出站循环（以及两循环退出后的收尾）使用，上游写端只由入站循环使用。
 */
public class SessionBridge {
    private static final Logger log = LoggerFactory.getLogger(SessionBridge.class);

    private final LiveSession session;
    private final EnvelopeCodec codec;
    private final BridgeProperties props;
    private final ScheduledExecutorService scheduler;
    private final Consumer<SessionBridge> onClosed;

    private final CompletableFuture<TerminationCause> termination = new CompletableFuture<>();
    private final AtomicInteger runningLoops = new AtomicInteger(2);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean legsClosed = new AtomicBoolean(false);
    private final AtomicLong inboundCount = new AtomicLong();
    private final AtomicLong outboundCount = new AtomicLong();

    private final AtomicReference<TerminationCause> cause = new AtomicReference<>();
    private volatile String causeDetail;
    private final Object loopLock = new Object();
    private Thread inboundThread;
    private Thread outboundThread;
    private volatile ScheduledFuture<?> idleWatchdog;
    private volatile ScheduledFuture<?> deadlineTask;

    public SessionBridge(LiveSession session, EnvelopeCodec codec, BridgeProperties props,
                         ScheduledExecutorService scheduler, Consumer<SessionBridge> onClosed) {
        this.session = session;
        this.codec = codec;
        this.props = props;
        this.scheduler = scheduler;
        this.onClosed = onClosed;
    }

    public String getId() {
        return session.getId();
    }

    public LiveSession getSession() {
        return session;
    }

    public SessionState getState() {
        return session.getState();
    }

    public TerminationCause getTerminationCause() {
        return cause.get();
    }

    public long getInboundCount() {
        return inboundCount.get();
    }

    public long getOutboundCount() {
        return outboundCount.get();
    }

    /**
     * 会话进入 CLOSED 时完成，值为终止原因。
     */
    public CompletableFuture<TerminationCause> terminationFuture() {
        return termination;
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            termination.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // termination 只会正常完成
            throw new IllegalStateException(e.getCause());
        }
    }

    public void start(ExecutorService executor) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("session already started: " + getId());
        }
        long idleTimeoutMs = props.getIdleTimeoutMs();
        if (idleTimeoutMs > 0) {
            long period = Math.max(50, idleTimeoutMs / 4);
            idleWatchdog = scheduler.scheduleAtFixedRate(this::checkIdle, period, period, TimeUnit.MILLISECONDS);
        }
        submit(executor, this::runInbound, "inbound");
        submit(executor, this::runOutbound, "outbound");
        log.debug("Session loops started: sessionId={}", getId());
    }

    /**
     * 发起联合关闭。只有第一次调用生效，返回是否由本次调用发起。
     */
    public boolean shutdown(TerminationCause reason, String detail) {
        // 原因先于状态发布：循环看到非 ACTIVE 时一定能读到原因
        if (!cause.compareAndSet(null, reason)) {
            return false;
        }
        this.causeDetail = detail;
        session.beginClosing();
        if (reason.isError()) {
            log.warn("Session closing: sessionId={}, cause={}, detail={}", getId(), reason, detail);
        } else {
            log.info("Session closing: sessionId={}, cause={}, detail={}", getId(), reason, detail);
        }
        ScheduledFuture<?> watchdog = idleWatchdog;
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        cancelLoops();
        long deadlineMs = props.getShutdownDeadlineMs();
        if (deadlineMs > 0 && runningLoops.get() > 0) {
            try {
                deadlineTask = scheduler.schedule(this::forceCloseLegs, deadlineMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Scheduler rejected shutdown deadline, closing legs now: sessionId={}", getId());
                forceCloseLegs();
            }
        }
        return true;
    }

    private void submit(ExecutorService executor, Runnable loop, String name) {
        try {
            executor.execute(loop);
        } catch (RejectedExecutionException e) {
            log.error("Executor rejected {} loop: sessionId={}", name, getId(), e);
            shutdown(TerminationCause.INTERNAL_ERROR, "executor rejected " + name + " loop");
            loopExited();
        }
    }

    private void runInbound() {
        synchronized (loopLock) {
            inboundThread = Thread.currentThread();
        }
        ClientConnection client = session.getClient();
        UpstreamSession upstream = session.getUpstream();
        try {
            while (session.isActive()) {
                RawEnvelope envelope = client.readEnvelope();
                if (envelope == null) {
                    shutdown(TerminationCause.CLIENT_CLOSED, "client disconnected");
                    break;
                }
                session.touch();
                ClientInput input = codec.decode(envelope);
                if (!session.isActive()) {
                    break;
                }
                upstream.send(input);
                inboundCount.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(TerminationCause.SERVER_SHUTDOWN, "inbound loop interrupted");
        } catch (BridgeException e) {
            onLoopFailure("inbound", e);
        } catch (RuntimeException e) {
            log.error("Inbound loop crashed: sessionId={}", getId(), e);
            shutdown(TerminationCause.INTERNAL_ERROR, e.toString());
        } finally {
            synchronized (loopLock) {
                inboundThread = null;
            }
            loopExited();
        }
    }

    private void runOutbound() {
        synchronized (loopLock) {
            outboundThread = Thread.currentThread();
        }
        UpstreamSession upstream = session.getUpstream();
        try {
            while (session.isActive()) {
                UpstreamEvent event = upstream.receive();
                session.touch();
                if (event instanceof MediaChunk) {
                    writeToClient(codec.encodeOutbound((MediaChunk) event));
                } else if (event instanceof TextPart) {
                    writeToClient(codec.encodeText((TextPart) event));
                } else if (event instanceof SessionSignal) {
                    handleSignal((SessionSignal) event);
                } else if (event instanceof UpstreamClosed) {
                    UpstreamClosed closed = (UpstreamClosed) event;
                    if (closed.isNormal()) {
                        shutdown(TerminationCause.UPSTREAM_CLOSED, "upstream closed: code=" + closed.getCode());
                    } else {
                        shutdown(TerminationCause.UPSTREAM_ERROR,
                                "upstream closed: code=" + closed.getCode() + " reason=" + closed.getReason());
                    }
                    break;
                } else {
                    log.debug("Dropped unknown upstream event: sessionId={}, event={}", getId(), event);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(TerminationCause.SERVER_SHUTDOWN, "outbound loop interrupted");
        } catch (BridgeException e) {
            onLoopFailure("outbound", e);
        } catch (RuntimeException e) {
            log.error("Outbound loop crashed: sessionId={}", getId(), e);
            shutdown(TerminationCause.INTERNAL_ERROR, e.toString());
        } finally {
            synchronized (loopLock) {
                outboundThread = null;
            }
            loopExited();
        }
    }

    /**
     * 信号映射表；未列出的信号直接丢弃。
     */
    private void handleSignal(SessionSignal signal) throws BridgeException, InterruptedException {
        switch (signal.getType()) {
            case INTERRUPTED:
                writeToClient(RawEnvelope.interrupted());
                break;
            case TURN_COMPLETE:
                if (props.isForwardTurnComplete()) {
                    writeToClient(RawEnvelope.turnComplete());
                } else {
                    log.debug("Turn complete: sessionId={}", getId());
                }
                break;
            case GENERATION_COMPLETE:
                log.debug("Generation complete: sessionId={}", getId());
                break;
            case GO_AWAY:
                log.warn("Upstream going away: sessionId={}, timeLeft={}", getId(), signal.getReason());
                break;
            case UPSTREAM_ERROR:
                shutdown(TerminationCause.UPSTREAM_ERROR, signal.getReason());
                break;
            default:
                log.debug("Dropped signal: sessionId={}, signal={}", getId(), signal);
        }
    }

    private void writeToClient(RawEnvelope envelope) throws BridgeException, InterruptedException {
        if (!session.isActive()) {
            return;
        }
        session.getClient().writeEnvelope(envelope);
        outboundCount.incrementAndGet();
        log.trace("Relayed to client: sessionId={}, envelope={}", getId(), envelope);
    }

    private void onLoopFailure(String loop, BridgeException e) {
        if (session.isActive()) {
            shutdown(TerminationCause.from(e.getCode()), e.getMessage());
        } else {
            // 关闭过程中阻塞调用被打断属预期
            log.debug("{} loop ended during shutdown: sessionId={}, error={}", loop, getId(), e.toString());
        }
    }

    private void checkIdle() {
        long idleMs = session.idleMillis(System.currentTimeMillis());
        if (session.isActive() && idleMs >= props.getIdleTimeoutMs()) {
            shutdown(TerminationCause.IDLE_TIMEOUT, "no activity for " + idleMs + "ms");
        }
    }

    /**
     * 中断仍在运行的循环线程（调用方自身除外）。尚未开始运行的循环会在进入时看到非 ACTIVE 状态后直接退出。
     */
    private void cancelLoops() {
        Thread current = Thread.currentThread();
        synchronized (loopLock) {
            if (inboundThread != null && inboundThread != current) {
                inboundThread.interrupt();
            }
            if (outboundThread != null && outboundThread != current) {
                outboundThread.interrupt();
            }
        }
    }

    private void loopExited() {
        if (runningLoops.decrementAndGet() == 0) {
            finish();
        }
    }

    private void forceCloseLegs() {
        if (runningLoops.get() > 0) {
            log.warn("Loops still running {}ms after shutdown, forcing legs closed: sessionId={}",
                    props.getShutdownDeadlineMs(), getId());
            closeLegs();
        }
    }

    private void closeLegs() {
        if (!legsClosed.compareAndSet(false, true)) {
            return;
        }
        TerminationCause reason = cause.get() == null ? TerminationCause.INTERNAL_ERROR : cause.get();
        try {
            session.getUpstream().close();
        } catch (RuntimeException e) {
            log.warn("Upstream close error: sessionId={}", getId(), e);
        }
        try {
            session.getClient().close(reason.getCloseCode(), reason.name());
        } catch (RuntimeException e) {
            log.warn("Client close error: sessionId={}", getId(), e);
        }
    }

    /**
     * 两个循环均已退出后执行，恰好一次。
     */
    private void finish() {
        // 收尾线程可能带着取消时的中断标记，先清除以免影响关闭握手
        boolean interrupted = Thread.interrupted();
        if (cause.get() == null) {
            shutdown(TerminationCause.INTERNAL_ERROR, "loops exited without a cause");
        }
        TerminationCause reason = cause.get();
        try {
            ScheduledFuture<?> deadline = deadlineTask;
            if (deadline != null) {
                deadline.cancel(false);
            }
            ClientConnection client = session.getClient();
            if (reason.isError() && props.isSendErrorFrame() && reason != TerminationCause.WRITE_ERROR
                    && !legsClosed.get() && client.isOpen()) {
                try {
                    client.writeEnvelope(RawEnvelope.error(reason.name(), causeDetail));
                } catch (BridgeException e) {
                    log.debug("Final error frame not delivered: sessionId={}, error={}", getId(), e.toString());
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            closeLegs();
            session.markClosed();
            log.info("Session closed: sessionId={}, cause={}, inbound={}, outbound={}, durationMs={}",
                    getId(), reason, inboundCount.get(), outboundCount.get(),
                    Duration.between(session.getCreatedAt(), Instant.now()).toMillis());
            try {
                onClosed.accept(this);
            } catch (RuntimeException e) {
                log.warn("Session close callback failed: sessionId={}", getId(), e);
            }
        } finally {
            termination.complete(reason);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
