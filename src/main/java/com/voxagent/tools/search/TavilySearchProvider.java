package com.voxagent.tools.search;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class TavilySearchProvider implements SearchProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ENDPOINT = "https://api.tavily.com/search";

    private final HttpClient httpClient;
    private final String apiKey;
    private final Duration timeout;

    public TavilySearchProvider(HttpClient httpClient, String apiKey, Duration timeout) {
        this.httpClient = httpClient;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override public String name() { return "tavily"; }

    @Override
    public List<SearchHit> search(String query, int maxResults) throws Exception {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("TAVILY_API_KEY not configured");
        }
        var body = MAPPER.writeValueAsString(Map.of(
                "api_key", apiKey,
                "query", query,
                "max_results", maxResults,
                "include_answer", true));
        var req = HttpRequest.newBuilder()
                .uri(URI.create(ENDPOINT))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new IllegalStateException("Tavily search HTTP " + resp.statusCode());
        }
        var hits = new ArrayList<SearchHit>();
        for (var r : MAPPER.readTree(resp.body()).path("results")) {
            hits.add(new SearchHit(
                    r.path("title").asText(""),
                    r.path("url").asText(""),
                    r.path("content").asText("")));
        }
        return hits;
    }
}
