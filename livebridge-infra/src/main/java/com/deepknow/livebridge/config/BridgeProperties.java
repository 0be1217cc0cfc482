package com.deepknow.livebridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {
    private String upstreamProvider = "gemini"; // gemini | echo
    private int maxSessions = 100;
    private int maxChunkBytes = 1024 * 1024;
    private long idleTimeoutMs = 120000; // 0 表示关闭空闲超时
    private long shutdownDeadlineMs = 5000;
    private long writeTimeoutMs = 10000;
    private int inboundQueueCapacity = 1;
    private int upstreamBufferFrames = 16;
    private boolean forwardTurnComplete = false;
    private boolean sendErrorFrame = true;
    private String binaryMimeType = "audio/pcm;rate=16000";
    private int maxClientFrameBytes = 2 * 1024 * 1024; // 单个客户端 WebSocket 帧上限，需容纳 base64 后的分片

    public String getUpstreamProvider() { return upstreamProvider; }
    public void setUpstreamProvider(String upstreamProvider) { this.upstreamProvider = upstreamProvider; }
    public int getMaxSessions() { return maxSessions; }
    public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
    public int getMaxChunkBytes() { return maxChunkBytes; }
    public void setMaxChunkBytes(int maxChunkBytes) { this.maxChunkBytes = maxChunkBytes; }
    public long getIdleTimeoutMs() { return idleTimeoutMs; }
    public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
    public long getShutdownDeadlineMs() { return shutdownDeadlineMs; }
    public void setShutdownDeadlineMs(long shutdownDeadlineMs) { this.shutdownDeadlineMs = shutdownDeadlineMs; }
    public long getWriteTimeoutMs() { return writeTimeoutMs; }
    public void setWriteTimeoutMs(long writeTimeoutMs) { this.writeTimeoutMs = writeTimeoutMs; }
    public int getInboundQueueCapacity() { return inboundQueueCapacity; }
    public void setInboundQueueCapacity(int inboundQueueCapacity) { this.inboundQueueCapacity = inboundQueueCapacity; }
    public int getUpstreamBufferFrames() { return upstreamBufferFrames; }
    public void setUpstreamBufferFrames(int upstreamBufferFrames) { this.upstreamBufferFrames = upstreamBufferFrames; }
    public boolean isForwardTurnComplete() { return forwardTurnComplete; }
    public void setForwardTurnComplete(boolean forwardTurnComplete) { this.forwardTurnComplete = forwardTurnComplete; }
    public boolean isSendErrorFrame() { return sendErrorFrame; }
    public void setSendErrorFrame(boolean sendErrorFrame) { this.sendErrorFrame = sendErrorFrame; }
    public String getBinaryMimeType() { return binaryMimeType; }
    public void setBinaryMimeType(String binaryMimeType) { this.binaryMimeType = binaryMimeType; }
    public int getMaxClientFrameBytes() { return maxClientFrameBytes; }
    public void setMaxClientFrameBytes(int maxClientFrameBytes) { this.maxClientFrameBytes = maxClientFrameBytes; }
}
