package com.deepknow.livebridge.upstream.gemini;

import com.deepknow.livebridge.domain.session.model.Direction;
import com.deepknow.livebridge.domain.session.model.MediaChunk;
import com.deepknow.livebridge.domain.session.model.SessionConfig;
import com.deepknow.livebridge.domain.session.model.SessionSignal;
import com.deepknow.livebridge.domain.session.model.TextPart;
import com.deepknow.livebridge.domain.session.model.UpstreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Gemini Live（BidiGenerateContent）消息的构造与解析。
 */
public class GeminiMessages {
    private final ObjectMapper mapper;

    public GeminiMessages(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public GeminiMessages() {
        this(new ObjectMapper());
    }

    public String setup(SessionConfig config) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode setup = root.putObject("setup");
        String model = config.getModel();
        setup.put("model", model.startsWith("models/") ? model : "models/" + model);

        ObjectNode generation = setup.putObject("generationConfig");
        ArrayNode modalities = generation.putArray("responseModalities");
        List<String> requested = config.getResponseModalities();
        if (requested == null || requested.isEmpty()) {
            modalities.add("AUDIO");
        } else {
            requested.forEach(modalities::add);
        }
        if (config.getVoiceName() != null && !config.getVoiceName().isEmpty()) {
            generation.putObject("speechConfig")
                    .putObject("voiceConfig")
                    .putObject("prebuiltVoiceConfig")
                    .put("voiceName", config.getVoiceName());
        }

        if (config.getSystemInstruction() != null && !config.getSystemInstruction().isEmpty()) {
            setup.putObject("systemInstruction")
                    .putArray("parts")
                    .addObject()
                    .put("text", config.getSystemInstruction());
        }
        return mapper.writeValueAsString(root);
    }

    /**
     * 音频走 realtimeInput.audio，图像/视频帧走 realtimeInput.video，其余类型走 mediaChunks。
     * 裸的 audio/pcm 会补上采样率。
     */
    public String realtimeInput(MediaChunk chunk, int inputSampleRate) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode input = root.putObject("realtimeInput");
        String mimeType = chunk.getMediaType();
        ObjectNode blob;
        if (chunk.isAudio()) {
            if ("audio/pcm".equalsIgnoreCase(mimeType)) {
                mimeType = "audio/pcm;rate=" + inputSampleRate;
            }
            blob = input.putObject("audio");
        } else if (mimeType.regionMatches(true, 0, "image/", 0, 6) || mimeType.regionMatches(true, 0, "video/", 0, 6)) {
            blob = input.putObject("video");
        } else {
            blob = input.putArray("mediaChunks").addObject();
        }
        blob.put("data", Base64.getEncoder().encodeToString(chunk.getPayload()));
        blob.put("mimeType", mimeType);
        return mapper.writeValueAsString(root);
    }

    public String clientText(TextPart part) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode content = root.putObject("clientContent");
        ObjectNode turn = content.putArray("turns").addObject();
        turn.put("role", "user");
        turn.putArray("parts").addObject().put("text", part.getText());
        content.put("turnComplete", true);
        return mapper.writeValueAsString(root);
    }

    public ServerMessage parse(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("server message is not a JSON object");
        }
        boolean setupComplete = root.has("setupComplete");
        List<UpstreamEvent> events = new ArrayList<>(2);

        JsonNode content = root.get("serverContent");
        if (content != null && content.isObject()) {
            for (JsonNode part : content.path("modelTurn").path("parts")) {
                JsonNode inline = part.get("inlineData");
                if (inline != null && inline.hasNonNull("data")) {
                    byte[] payload;
                    try {
                        payload = Base64.getDecoder().decode(inline.get("data").asText());
                    } catch (IllegalArgumentException e) {
                        throw new IOException("inlineData is not valid base64", e);
                    }
                    if (payload.length > 0) {
                        events.add(MediaChunk.outbound(payload, inline.path("mimeType").asText("audio/pcm;rate=24000")));
                    }
                }
                // 原生音频模型会返回 thought 文本，不转发
                if (part.hasNonNull("text") && !part.path("thought").asBoolean(false)) {
                    String text = part.get("text").asText();
                    if (!text.isEmpty()) {
                        events.add(new TextPart(text, Direction.OUTBOUND));
                    }
                }
            }
            if (content.path("interrupted").asBoolean(false)) {
                events.add(SessionSignal.of(SessionSignal.Type.INTERRUPTED));
            }
            if (content.path("generationComplete").asBoolean(false)) {
                events.add(SessionSignal.of(SessionSignal.Type.GENERATION_COMPLETE));
            }
            if (content.path("turnComplete").asBoolean(false)) {
                events.add(SessionSignal.of(SessionSignal.Type.TURN_COMPLETE));
            }
        }
        JsonNode goAway = root.get("goAway");
        if (goAway != null) {
            events.add(SessionSignal.of(SessionSignal.Type.GO_AWAY, goAway.path("timeLeft").asText(null)));
        }
        JsonNode error = root.get("error");
        if (error != null) {
            events.add(SessionSignal.upstreamError(error.path("message").asText(error.toString())));
        }
        return new ServerMessage(setupComplete, events);
    }

    public static final class ServerMessage {
        private final boolean setupComplete;
        private final List<UpstreamEvent> events;

        ServerMessage(boolean setupComplete, List<UpstreamEvent> events) {
            this.setupComplete = setupComplete;
            this.events = Collections.unmodifiableList(events);
        }

        public boolean isSetupComplete() { return setupComplete; }
        public List<UpstreamEvent> getEvents() { return events; }
    }
}
