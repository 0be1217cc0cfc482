package com.deepknow.livebridge.domain.session.model;

/**
 * 数据流向：INBOUND 为客户端发往上游，OUTBOUND 为上游发往客户端。
 */
public enum Direction {
    INBOUND,
    OUTBOUND
}
