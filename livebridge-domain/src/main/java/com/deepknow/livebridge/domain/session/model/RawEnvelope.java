package com.deepknow.livebridge.domain.session.model;

import java.util.Objects;

/**
 * 与客户端交换的线上信封（仅存在于编解码边界）。
 * <p>
 * 入站：{@code {"data": <base64>, "mime_type": <string>}} 或 {@code {"text": <string>}}；
 * 出站：{@code {"audio": <base64>}}、{@code {"text": ...}}、{@code {"interrupted": true}}、
 * {@code {"turn_complete": true}}、{@code {"error": {"code": ..., "message": ...}}}。
 */
public final class RawEnvelope {

    public enum Kind {
        INBOUND_MEDIA(Direction.INBOUND),
        INBOUND_TEXT(Direction.INBOUND),
        OUTBOUND_AUDIO(Direction.OUTBOUND),
        OUTBOUND_TEXT(Direction.OUTBOUND),
        OUTBOUND_INTERRUPTED(Direction.OUTBOUND),
        OUTBOUND_TURN_COMPLETE(Direction.OUTBOUND),
        OUTBOUND_ERROR(Direction.OUTBOUND);

        private final Direction direction;

        Kind(Direction direction) {
            this.direction = direction;
        }

        public Direction getDirection() {
            return direction;
        }
    }

    private final Kind kind;
    // base64 文本（INBOUND_MEDIA 的 data / OUTBOUND_AUDIO 的 audio）
    private final String data;
    private final String mimeType;
    private final String text;
    private final String errorCode;

    private RawEnvelope(Kind kind, String data, String mimeType, String text, String errorCode) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.data = data;
        this.mimeType = mimeType;
        this.text = text;
        this.errorCode = errorCode;
    }

    public static RawEnvelope inboundMedia(String data, String mimeType) {
        return new RawEnvelope(Kind.INBOUND_MEDIA, data, mimeType, null, null);
    }

    public static RawEnvelope inboundText(String text) {
        return new RawEnvelope(Kind.INBOUND_TEXT, null, null, text, null);
    }

    public static RawEnvelope audio(String base64) {
        return new RawEnvelope(Kind.OUTBOUND_AUDIO, Objects.requireNonNull(base64, "audio"), null, null, null);
    }

    public static RawEnvelope outboundText(String text) {
        return new RawEnvelope(Kind.OUTBOUND_TEXT, null, null, Objects.requireNonNull(text, "text"), null);
    }

    public static RawEnvelope interrupted() {
        return new RawEnvelope(Kind.OUTBOUND_INTERRUPTED, null, null, null, null);
    }

    public static RawEnvelope turnComplete() {
        return new RawEnvelope(Kind.OUTBOUND_TURN_COMPLETE, null, null, null, null);
    }

    public static RawEnvelope error(String code, String message) {
        return new RawEnvelope(Kind.OUTBOUND_ERROR, null, null, message, Objects.requireNonNull(code, "code"));
    }

    public Kind getKind() {
        return kind;
    }

    public Direction getDirection() {
        return kind.getDirection();
    }

    public String getData() {
        return data;
    }

    public String getMimeType() {
        return mimeType;
    }

    /** 文本内容；OUTBOUND_ERROR 时为错误描述。 */
    public String getText() {
        return text;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawEnvelope)) return false;
        RawEnvelope that = (RawEnvelope) o;
        return kind == that.kind
                && Objects.equals(data, that.data)
                && Objects.equals(mimeType, that.mimeType)
                && Objects.equals(text, that.text)
                && Objects.equals(errorCode, that.errorCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, data, mimeType, text, errorCode);
    }

    @Override
    public String toString() {
        return "RawEnvelope{" + kind
                + (mimeType != null ? ", mime=" + mimeType : "")
                + (data != null ? ", b64chars=" + data.length() : "")
                + (errorCode != null ? ", code=" + errorCode : "")
                + "}";
    }
}
