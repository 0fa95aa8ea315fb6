package com.voxagent.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesFirstEmbedding() throws Exception {
        var vec = EmbeddingService.parseEmbedding(mapper.readTree(
                "{\"data\":[{\"embedding\":[0.5,-1.25,2]}]}"));
        assertArrayEquals(new float[]{0.5f, -1.25f, 2f}, vec);
    }

    @Test
    void missingEmbeddingIsNull() throws Exception {
        assertNull(EmbeddingService.parseEmbedding(mapper.readTree("{\"data\":[]}")));
        assertNull(EmbeddingService.parseEmbedding(mapper.readTree("{\"error\":{\"message\":\"bad\"}}")));
    }

    @Test
    void unconfiguredServiceSkipsTheCall() {
        var service = new EmbeddingService("https://api.openai.com/v1/", "", "text-embedding-3-small");
        assertFalse(service.isConfigured());
        assertNull(service.embed("hello"));
    }
}
