package com.deepknow.livebridge.codec;

import com.deepknow.livebridge.domain.error.MalformedEnvelopeException;
import com.deepknow.livebridge.domain.error.UnencodableChunkException;
import com.deepknow.livebridge.domain.session.model.ClientInput;
import com.deepknow.livebridge.domain.session.model.Direction;
import com.deepknow.livebridge.domain.session.model.MediaChunk;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import com.deepknow.livebridge.domain.session.model.TextPart;

import java.util.Base64;

/**
 * 信封编解码：纯函数，无状态、无 I/O。
 */
public class EnvelopeCodec {
    private final int maxChunkBytes;

    public EnvelopeCodec(int maxChunkBytes) {
        if (maxChunkBytes <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must be positive: " + maxChunkBytes);
        }
        this.maxChunkBytes = maxChunkBytes;
    }

    public int getMaxChunkBytes() {
        return maxChunkBytes;
    }

    public ClientInput decode(RawEnvelope envelope) throws MalformedEnvelopeException {
        if (envelope == null) {
            throw new MalformedEnvelopeException("envelope is null");
        }
        switch (envelope.getKind()) {
            case INBOUND_MEDIA:
                return decodeInbound(envelope);
            case INBOUND_TEXT:
                return decodeText(envelope);
            default:
                throw new MalformedEnvelopeException("unexpected envelope kind from client: " + envelope.getKind());
        }
    }

    public MediaChunk decodeInbound(RawEnvelope envelope) throws MalformedEnvelopeException {
        if (envelope.getKind() != RawEnvelope.Kind.INBOUND_MEDIA) {
            throw new MalformedEnvelopeException("not a media envelope: " + envelope.getKind());
        }
        String mimeType = envelope.getMimeType();
        if (mimeType == null || mimeType.trim().isEmpty()) {
            throw new MalformedEnvelopeException("mime_type is empty");
        }
        if (envelope.getData() == null) {
            throw new MalformedEnvelopeException("data is missing");
        }
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(envelope.getData());
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("data is not valid base64", e);
        }
        return MediaChunk.inbound(payload, mimeType.trim());
    }

    public TextPart decodeText(RawEnvelope envelope) throws MalformedEnvelopeException {
        if (envelope.getKind() != RawEnvelope.Kind.INBOUND_TEXT) {
            throw new MalformedEnvelopeException("not a text envelope: " + envelope.getKind());
        }
        String text = envelope.getText();
        if (text == null || text.isEmpty()) {
            throw new MalformedEnvelopeException("text is empty");
        }
        return new TextPart(text, Direction.INBOUND);
    }

    public RawEnvelope encodeOutbound(MediaChunk chunk) throws UnencodableChunkException {
        if (chunk.size() > maxChunkBytes) {
            throw new UnencodableChunkException("chunk of " + chunk.size() + " bytes exceeds limit " + maxChunkBytes);
        }
        return RawEnvelope.audio(Base64.getEncoder().encodeToString(chunk.getPayload()));
    }

    public RawEnvelope encodeText(TextPart part) throws UnencodableChunkException {
        // 按 UTF-16 长度粗略限制，避免一次性构造超大帧
        if (part.getText().length() > maxChunkBytes) {
            throw new UnencodableChunkException("text of " + part.getText().length() + " chars exceeds limit " + maxChunkBytes);
        }
        return RawEnvelope.outboundText(part.getText());
    }
}
