package com.voxagent.tools.search;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scrapes the DuckDuckGo HTML endpoint. Needs no API key.
 */
public class DuckDuckGoSearchProvider implements SearchProvider {

    private static final String ENDPOINT = "https://html.duckduckgo.com/html/?q=";
    private static final Pattern RESULT_PATTERN = Pattern.compile(
            "<a[^>]+class=\"result__a\"[^>]*href=\"([^\"]+)\"[^>]*>(.+?)</a>");
    private static final Pattern SNIPPET_PATTERN = Pattern.compile(
            "<a[^>]+class=\"result__snippet\"[^>]*>(.+?)</a>");
    private static final Pattern TAG_STRIP = Pattern.compile("<[^>]+>");

    private final HttpClient httpClient;
    private final Duration timeout;

    public DuckDuckGoSearchProvider(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override public String name() { return "duckduckgo"; }

    @Override
    public List<SearchHit> search(String query, int maxResults) throws Exception {
        var req = HttpRequest.newBuilder()
                .uri(URI.create(ENDPOINT + URLEncoder.encode(query, StandardCharsets.UTF_8)))
                .timeout(timeout)
                .header("User-Agent", "VoxAgent/1.0")
                .GET().build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new IllegalStateException("DuckDuckGo HTTP " + resp.statusCode());
        }
        return parseResults(resp.body(), maxResults);
    }

    static List<SearchHit> parseResults(String html, int maxResults) {
        var results = new ArrayList<SearchHit>();
        var linkMatcher = RESULT_PATTERN.matcher(html);
        var snippetMatcher = SNIPPET_PATTERN.matcher(html);

        while (linkMatcher.find() && results.size() < maxResults) {
            var href = linkMatcher.group(1);
            var title = stripTags(linkMatcher.group(2));
            var snippet = snippetMatcher.find() ? stripTags(snippetMatcher.group(1)) : "";
            results.add(new SearchHit(title, href, snippet));
        }
        return results;
    }

    private static String stripTags(String s) {
        return TAG_STRIP.matcher(s).replaceAll("").strip();
    }
}
