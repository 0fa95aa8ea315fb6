package com.voxagent.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleProviderTest {

    private final OpenAiCompatibleProvider provider = new GroqProvider("key");

    @Test
    void parsesJsonCompletion() throws Exception {
        var root = new ObjectMapper().readTree("""
                {"model":"llama","choices":[{"message":{"content":"It is sunny."}}],
                 "usage":{"prompt_tokens":12,"completion_tokens":4}}
                """);
        var resp = provider.parseResponse(root);
        assertEquals("llama", resp.model());
        assertEquals("It is sunny.", resp.content());
        assertEquals(12, resp.usage().get("promptTokens"));
        assertEquals(4, resp.usage().get("completionTokens"));
    }

    @Test
    void parsesSseStream() throws Exception {
        var sse = """
                data: {"model":"gpt-4o-mini","choices":[{"delta":{"content":"Hel"}}]}
                data: {"choices":[{"delta":{"content":"lo"}}]}
                data: {"choices":[{"delta":{}}],"usage":{"prompt_tokens":3,"completion_tokens":2}}
                data: [DONE]
                """;
        var resp = provider.parseSSE(sse);
        assertEquals("gpt-4o-mini", resp.model());
        assertEquals("Hello", resp.content());
        assertEquals(2, resp.usage().get("completionTokens"));
    }

    @Test
    void missingKeyFailsWithoutRetry() {
        var noKey = new OpenAiProvider("");
        var ex = assertThrows(ProviderException.class,
                () -> noKey.chat(new ChatRequest(null, List.of(Map.of("role", "user", "content", "hi")), 0.7)));
        assertFalse(ex.isRetryable());
    }

    @Test
    void providerIdsAndDefaults() {
        assertEquals("openai", new OpenAiProvider("k").id());
        assertEquals("groq", provider.id());
        assertEquals("openrouter", new OpenRouterProvider("k").id());
        assertEquals(OpenAiProvider.DEFAULT_MODEL, new OpenAiProvider("k").defaultModel());
    }
}
