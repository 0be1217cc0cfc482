package com.deepknow.livebridge.domain.upstream;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.session.model.ClientInput;
import com.deepknow.livebridge.domain.session.model.UpstreamEvent;

/**
 * 一条上游连接，隐藏上游自身的帧格式与握手。
 */
public interface UpstreamSession extends AutoCloseable {

    String getId();

    /**
     * 以上游原生帧格式发送一个单元；失败不在内部重试，由调用方决定是否终止会话。
     *
     * @throws BridgeException SEND_ERROR
     */
    void send(ClientInput input) throws BridgeException, InterruptedException;

    /**
     * 阻塞直到上游产出媒体、信号或关闭事件。关闭后再次调用仍返回关闭事件。
     *
     * @throws BridgeException RECEIVE_ERROR
     */
    UpstreamEvent receive() throws BridgeException, InterruptedException;

    /**
     * 幂等，任何退出路径上都会释放底层连接。
     */
    @Override
    void close();
}
