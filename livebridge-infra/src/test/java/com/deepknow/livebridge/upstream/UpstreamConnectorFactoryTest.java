package com.deepknow.livebridge.upstream;

import com.deepknow.livebridge.config.BridgeProperties;
import com.deepknow.livebridge.upstream.gemini.GeminiLiveProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UpstreamConnectorFactoryTest {
    private final UpstreamConnectorFactory factory = new UpstreamConnectorFactory();
    private final GeminiLiveProperties gemini = new GeminiLiveProperties();
    private final ObjectMapper mapper = new ObjectMapper();

    private BridgeProperties provider(String name) {
        BridgeProperties props = new BridgeProperties();
        props.setUpstreamProvider(name);
        return props;
    }

    @Test
    void selectsProviderByName() {
        assertEquals("gemini", factory.create(provider("gemini"), gemini, mapper).getProvider());
        assertEquals("echo", factory.create(provider(" Echo "), gemini, mapper).getProvider());
        assertEquals("echo", factory.create(provider("mock"), gemini, mapper).getProvider());
    }

    @Test
    void unknownProviderIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(provider("openai"), gemini, mapper));
    }
}
