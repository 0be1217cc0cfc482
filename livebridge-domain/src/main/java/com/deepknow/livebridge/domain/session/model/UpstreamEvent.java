package com.deepknow.livebridge.domain.session.model;

/**
 * 上游 receive() 的产出：MediaChunk、TextPart、SessionSignal 或 UpstreamClosed。
 */
public interface UpstreamEvent {
}
