package com.voxagent.tools.search;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class BraveSearchProvider implements SearchProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ENDPOINT = "https://api.search.brave.com/res/v1/web/search";

    private final HttpClient httpClient;
    private final String apiKey;
    private final Duration timeout;

    public BraveSearchProvider(HttpClient httpClient, String apiKey, Duration timeout) {
        this.httpClient = httpClient;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override public String name() { return "brave"; }

    @Override
    public List<SearchHit> search(String query, int maxResults) throws Exception {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("BRAVE_API_KEY not configured");
        }
        var url = ENDPOINT + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&count=" + maxResults;
        var req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("X-Subscription-Token", apiKey)
                .GET().build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new IllegalStateException("Brave search HTTP " + resp.statusCode());
        }
        var hits = new ArrayList<SearchHit>();
        for (var r : MAPPER.readTree(resp.body()).path("web").path("results")) {
            hits.add(new SearchHit(
                    r.path("title").asText(""),
                    r.path("url").asText(""),
                    r.path("description").asText("")));
        }
        return hits;
    }
}
