package com.voxagent.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain-completion client for any {@code /chat/completions} endpoint. Accepts both a
 * JSON body and an SSE stream in the response.
 */
public abstract class OpenAiCompatibleProvider implements ModelProvider {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    protected OpenAiCompatibleProvider(String apiKey, String baseUrl, String defaultModel) {
        this(apiKey, baseUrl, defaultModel, DEFAULT_TIMEOUT);
    }

    protected OpenAiCompatibleProvider(String apiKey, String baseUrl, String defaultModel, Duration timeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.defaultModel = defaultModel;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public String defaultModel() { return defaultModel; }

    @Override
    public ChatResponse chat(ChatRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(401, id() + " API key not configured");
        }
        try {
            return doChat(request);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted calling " + id(), e);
        } catch (Exception e) {
            throw new RuntimeException(id() + " request failed: " + e.getMessage(), e);
        }
    }

    private ChatResponse doChat(ChatRequest request) throws Exception {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model() != null ? request.model() : defaultModel);
        body.put("messages", request.messages());
        body.put("temperature", request.temperature());
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }

        var httpReq = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();

        var resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            long retryAfter = resp.headers().firstValue("retry-after")
                    .map(OpenAiCompatibleProvider::retryAfterMs).orElse(0L);
            throw new ProviderException(resp.statusCode(),
                    "LLM API error " + resp.statusCode() + ": " + resp.body(), retryAfter);
        }

        var respBody = resp.body().trim();
        if (respBody.startsWith("{")) {
            return parseResponse(mapper.readTree(respBody));
        }
        return parseSSE(respBody);
    }

    ChatResponse parseResponse(JsonNode root) {
        var content = root.path("choices").path(0).path("message").path("content").asText(null);
        return new ChatResponse(root.path("model").asText(null), content != null ? content : "", usage(root.path("usage")));
    }

    ChatResponse parseSSE(String sse) throws Exception {
        var contentBuf = new StringBuilder();
        String model = null;
        Map<String, Integer> usage = usage(null);

        for (var line : sse.split("\n")) {
            line = line.trim();
            if (!line.startsWith("data:")) continue;
            var data = line.substring(5).trim();
            if ("[DONE]".equals(data)) break;

            var node = mapper.readTree(data);
            if (model == null) model = node.path("model").asText(null);
            if (node.path("usage").has("prompt_tokens")) usage = usage(node.path("usage"));

            var c = node.path("choices").path(0).path("delta").path("content").asText(null);
            if (c != null) contentBuf.append(c);
        }
        return new ChatResponse(model, contentBuf.toString(), usage);
    }

    private static Map<String, Integer> usage(JsonNode u) {
        if (u == null) return Map.of("promptTokens", 0, "completionTokens", 0);
        return Map.of(
                "promptTokens", u.path("prompt_tokens").asInt(0),
                "completionTokens", u.path("completion_tokens").asInt(0));
    }

    private static long retryAfterMs(String header) {
        try {
            return (long) (Double.parseDouble(header.trim()) * 1000);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
