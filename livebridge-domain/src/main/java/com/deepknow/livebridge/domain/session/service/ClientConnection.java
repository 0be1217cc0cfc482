package com.deepknow.livebridge.domain.session.service;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;

/**
 * 面向客户端的双工连接句柄。写端单写者：同一时刻只有桥接的出站循环调用 writeEnvelope。
 */
public interface ClientConnection {

    String getId();

    /**
     * 阻塞直到下一条客户端信封到达。
     *
     * @return 信封；客户端已断开时返回 null
     * @throws BridgeException READ_ERROR：JSON/结构非法或传输错误
     * @throws InterruptedException 读取被取消
     */
    RawEnvelope readEnvelope() throws BridgeException, InterruptedException;

    /**
     * @throws BridgeException WRITE_ERROR：连接已关闭、写入失败或超时
     */
    void writeEnvelope(RawEnvelope envelope) throws BridgeException, InterruptedException;

    boolean isOpen();

    /**
     * 幂等关闭。
     */
    void close(int code, String reason);

    default void close() {
        close(1000, "bye");
    }
}
