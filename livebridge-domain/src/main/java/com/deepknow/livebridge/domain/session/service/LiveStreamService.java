package com.deepknow.livebridge.domain.session.service;

/**
 * 会话级编排接口：为每个客户端连接建立一个上游会话并双向转发。
 * 端点层应仅依赖此接口，具体实现放在 infra 层。
 */
public interface LiveStreamService {

    /**
     * 异步受理客户端连接；容量不足或上游连接失败时向客户端发送错误帧并关闭连接。
     */
    void open(ClientConnection connection);

    int activeSessions();
}
