package com.deepknow.livebridge.domain.session.model;

/**
 * 入站循环可发往上游的数据单元（MediaChunk 或 TextPart）。
 */
public interface ClientInput {
}
