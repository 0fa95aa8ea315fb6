package com.voxagent.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link Embedder} backed by an OpenAI-compatible {@code /embeddings} endpoint.
 * Any failure yields a null vector, so retrieval falls back to keyword search.
 */
public class EmbeddingService implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final HttpClient httpClient;

    public EmbeddingService(String baseUrl, String apiKey, String model) {
        this(baseUrl, apiKey, model, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    public EmbeddingService(String baseUrl, String apiKey, String model, HttpClient httpClient) {
        this.endpoint = URI.create(baseUrl.replaceAll("/+$", "") + "/embeddings");
        this.apiKey = apiKey;
        this.model = model;
        this.httpClient = httpClient;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public float[] embed(String text) {
        if (!isConfigured() || text == null || text.isBlank()) return null;
        try {
            var resp = httpClient.send(request(text), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                log.warn("Embedding endpoint returned {}: {}", resp.statusCode(), abbreviate(resp.body()));
                return null;
            }
            return parseEmbedding(MAPPER.readTree(resp.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            log.warn("Embedding request failed: {}", e.toString());
            return null;
        }
    }

    private HttpRequest request(String text) throws Exception {
        return HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(
                        MAPPER.writeValueAsString(Map.of("model", model, "input", text))))
                .build();
    }

    static float[] parseEmbedding(JsonNode root) {
        var values = root.path("data").path(0).path("embedding");
        if (!values.isArray() || values.isEmpty()) return null;
        var vec = new float[values.size()];
        for (int i = 0; i < vec.length; i++) {
            vec[i] = values.get(i).floatValue();
        }
        return vec;
    }

    private static String abbreviate(String body) {
        return body == null || body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
