package com.deepknow.livebridge.config;

import com.deepknow.livebridge.codec.EnvelopeCodec;
import com.deepknow.livebridge.codec.EnvelopeJson;
import com.deepknow.livebridge.domain.upstream.UpstreamConnector;
import com.deepknow.livebridge.upstream.UpstreamConnectorFactory;
import com.deepknow.livebridge.upstream.gemini.GeminiLiveProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;

@Configuration
@EnableConfigurationProperties({BridgeProperties.class, GeminiLiveProperties.class})
public class BridgeConfig {
    private static final Logger log = LoggerFactory.getLogger(BridgeConfig.class);

    private final BridgeProperties bridge;
    private final GeminiLiveProperties gemini;

    public BridgeConfig(BridgeProperties bridge, GeminiLiveProperties gemini) {
        this.bridge = bridge;
        this.gemini = gemini;
    }

    @PostConstruct
    public void init() {
        log.info("Bridge config: provider={}, maxSessions={}, maxChunkBytes={}, idleTimeoutMs={}, model={}",
                bridge.getUpstreamProvider(), bridge.getMaxSessions(), bridge.getMaxChunkBytes(),
                bridge.getIdleTimeoutMs(), gemini.getModel());
    }

    @Bean
    public EnvelopeCodec envelopeCodec() {
        return new EnvelopeCodec(bridge.getMaxChunkBytes());
    }

    @Bean
    public EnvelopeJson envelopeJson(ObjectMapper objectMapper) {
        return new EnvelopeJson(objectMapper);
    }

    @Bean
    public UpstreamConnector upstreamConnector(ObjectMapper objectMapper) {
        return new UpstreamConnectorFactory().create(bridge, gemini, objectMapper);
    }
}
