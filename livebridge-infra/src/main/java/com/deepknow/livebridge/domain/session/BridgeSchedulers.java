package com.deepknow.livebridge.domain.session;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 统一的会话调度器提供者，用于空闲检测与关闭期限等定时任务。
 */
public final class BridgeSchedulers {
    private static final AtomicInteger SEQ = new AtomicInteger();
    private static final ScheduledExecutorService SCHEDULER = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "bridge-scheduler-" + SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private BridgeSchedulers() {}

    public static ScheduledExecutorService get() {
        return SCHEDULER;
    }
}
