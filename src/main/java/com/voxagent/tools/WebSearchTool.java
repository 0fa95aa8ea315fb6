package com.voxagent.tools;

import com.voxagent.tools.search.SearchProvider;

public class WebSearchTool implements Tool {

    private static final int SNIPPET_CHARS = 200;

    private final SearchProvider provider;
    private final int maxResults;

    public WebSearchTool(SearchProvider provider, int maxResults) {
        this.provider = provider;
        this.maxResults = maxResults;
    }

    public String providerName() { return provider.name(); }

    @Override
    public ToolResult search(String query) {
        if (query == null || query.isBlank()) {
            return ToolResult.error("Search query is required");
        }
        try {
            var hits = provider.search(query, maxResults);
            if (hits.isEmpty()) {
                return ToolResult.empty("No search results found for: " + query);
            }
            var sb = new StringBuilder("Search results for '").append(query).append("':\n\n");
            int idx = 1;
            for (var hit : hits) {
                if (idx > maxResults) break;
                var content = hit.content() == null ? "" : hit.content();
                if (content.length() > SNIPPET_CHARS) content = content.substring(0, SNIPPET_CHARS);
                sb.append(idx++).append(". ").append(hit.title()).append("\n")
                  .append("   URL: ").append(hit.url()).append("\n")
                  .append("   ").append(content).append("...\n\n");
            }
            return ToolResult.ok(sb.toString().strip());
        } catch (Exception e) {
            return ToolResult.error("Search error: " + e.getMessage());
        }
    }
}
