package com.deepknow.livebridge.domain.session.model;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 建立上游会话所需的参数，由配置与客户端连接信息组装。
 */
@Data
public class SessionConfig {
    private String sessionId;
    private String model;
    private String systemInstruction;
    private List<String> responseModalities = new ArrayList<>();
    private String voiceName;
    private int inputSampleRate = 16000;
    private Duration handshakeTimeout = Duration.ofSeconds(10);
}
