package com.deepknow.livebridge.upstream.gemini;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "gemini")
public class GeminiLiveProperties {
    public static final String DEFAULT_ENDPOINT =
            "wss://generativelanguage.googleapis.com/ws/google.ai.generativelanguage.v1beta.GenerativeService.BidiGenerateContent";

    private String apiKeyEnv = "GEMINI_API_KEY";
    private String apiKey; // 直接配置的密钥（优先级高于 apiKeyEnv）
    private String endpoint = DEFAULT_ENDPOINT;
    private String model = "gemini-2.5-flash-native-audio-preview-12-2025";
    private String systemInstruction = "You are a helpful and friendly AI assistant.";
    private List<String> responseModalities = new ArrayList<>(List.of("AUDIO"));
    private String voiceName;
    private int inputSampleRate = 16000;
    private long handshakeTimeoutMs = 10000;
    private long sendTimeoutMs = 10000;

    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getSystemInstruction() { return systemInstruction; }
    public void setSystemInstruction(String systemInstruction) { this.systemInstruction = systemInstruction; }
    public List<String> getResponseModalities() { return responseModalities; }
    public void setResponseModalities(List<String> responseModalities) { this.responseModalities = responseModalities; }
    public String getVoiceName() { return voiceName; }
    public void setVoiceName(String voiceName) { this.voiceName = voiceName; }
    public int getInputSampleRate() { return inputSampleRate; }
    public void setInputSampleRate(int inputSampleRate) { this.inputSampleRate = inputSampleRate; }
    public long getHandshakeTimeoutMs() { return handshakeTimeoutMs; }
    public void setHandshakeTimeoutMs(long handshakeTimeoutMs) { this.handshakeTimeoutMs = handshakeTimeoutMs; }
    public long getSendTimeoutMs() { return sendTimeoutMs; }
    public void setSendTimeoutMs(long sendTimeoutMs) { this.sendTimeoutMs = sendTimeoutMs; }

    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isEmpty()) {
            return apiKey;
        }
        return apiKeyEnv == null ? null : System.getenv(apiKeyEnv);
    }
}
