package com.deepknow.livebridge.codec;

import com.deepknow.livebridge.domain.error.BridgeException;
import com.deepknow.livebridge.domain.error.ErrorCode;
import com.deepknow.livebridge.domain.session.model.RawEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 客户端 JSON 帧与 {@link RawEnvelope} 的互转。解析时校验结构，未知形状在边界处拒绝。
 * <p>
 * 支持的入站形状：
 * <pre>
 * {"data": "...", "mime_type": "audio/pcm"}
 * {"realtime_input": {"media_chunks": [{"data": "...", "mime_type": "image/jpeg"}]}}
 * {"text": "..."}
 * </pre>
 */
public class EnvelopeJson {
    private final ObjectMapper objectMapper;

    public EnvelopeJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EnvelopeJson() {
        this(new ObjectMapper());
    }

    public List<RawEnvelope> parseInbound(String json) throws BridgeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BridgeException(ErrorCode.READ_ERROR, "client frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new BridgeException(ErrorCode.READ_ERROR, "client frame is not a JSON object");
        }

        List<RawEnvelope> out = new ArrayList<>(1);
        if (root.has("data") || root.has("mime_type")) {
            out.add(mediaEnvelope(root));
        }
        JsonNode realtime = root.get("realtime_input");
        if (realtime != null) {
            JsonNode chunks = realtime.get("media_chunks");
            if (!realtime.isObject() || chunks == null || !chunks.isArray()) {
                throw new BridgeException(ErrorCode.READ_ERROR, "realtime_input.media_chunks must be an array");
            }
            for (JsonNode chunk : chunks) {
                if (!chunk.isObject()) {
                    throw new BridgeException(ErrorCode.READ_ERROR, "media_chunks entries must be objects");
                }
                out.add(mediaEnvelope(chunk));
            }
        }
        if (root.has("text")) {
            out.add(RawEnvelope.inboundText(textField(root, "text")));
        }
        if (out.isEmpty() && realtime == null) {
            throw new BridgeException(ErrorCode.READ_ERROR, "unrecognised client frame, fields=" + fieldNames(root));
        }
        return out;
    }

    public String write(RawEnvelope envelope) throws BridgeException {
        ObjectNode node = objectMapper.createObjectNode();
        switch (envelope.getKind()) {
            case OUTBOUND_AUDIO:
                node.put("audio", envelope.getData());
                break;
            case OUTBOUND_TEXT:
                node.put("text", envelope.getText());
                break;
            case OUTBOUND_INTERRUPTED:
                node.put("interrupted", true);
                break;
            case OUTBOUND_TURN_COMPLETE:
                node.put("turn_complete", true);
                break;
            case OUTBOUND_ERROR:
                ObjectNode error = node.putObject("error");
                error.put("code", envelope.getErrorCode());
                error.put("message", envelope.getText() == null ? "" : envelope.getText());
                break;
            default:
                throw new BridgeException(ErrorCode.WRITE_ERROR, "cannot write inbound envelope to client: " + envelope.getKind());
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new BridgeException(ErrorCode.WRITE_ERROR, "serialise envelope failed", e);
        }
    }

    private RawEnvelope mediaEnvelope(JsonNode node) throws BridgeException {
        return RawEnvelope.inboundMedia(textField(node, "data"), textField(node, "mime_type"));
    }

    private String textField(JsonNode node, String field) throws BridgeException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new BridgeException(ErrorCode.READ_ERROR, "field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static String fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names.toString();
    }
}
