package com.deepknow.livebridge.domain.session.model;

import java.util.Objects;

/**
 * 文本片段：客户端的文本输入（作为完整用户轮次发送），或模型返回的文本部分。
 */
public final class TextPart implements ClientInput, UpstreamEvent {
    private final String text;
    private final Direction direction;

    public TextPart(String text, Direction direction) {
        this.text = Objects.requireNonNull(text, "text");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public String getText() {
        return text;
    }

    public Direction getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return "TextPart{" + direction + ", chars=" + text.length() + "}";
    }
}
