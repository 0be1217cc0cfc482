package com.deepknow.livebridge.domain.session.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * 不可变的媒体分片，负载视为不透明字节，仅携带 mediaType 标签（如 audio/pcm;rate=16000）。
 */
public final class MediaChunk implements ClientInput, UpstreamEvent {
    private final byte[] payload;
    private final String mediaType;
    private final Direction direction;

    public MediaChunk(byte[] payload, String mediaType, Direction direction) {
        Objects.requireNonNull(payload, "payload");
        this.payload = Arrays.copyOf(payload, payload.length);
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public static MediaChunk inbound(byte[] payload, String mediaType) {
        return new MediaChunk(payload, mediaType, Direction.INBOUND);
    }

    public static MediaChunk outbound(byte[] payload, String mediaType) {
        return new MediaChunk(payload, mediaType, Direction.OUTBOUND);
    }

    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int size() {
        return payload.length;
    }

    public String getMediaType() {
        return mediaType;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isAudio() {
        return mediaType.regionMatches(true, 0, "audio/", 0, 6);
    }

    @Override
    public String toString() {
        return "MediaChunk{" + direction + ", " + mediaType + ", bytes=" + payload.length + "}";
    }
}
