package com.voxagent.tools;

import com.voxagent.memory.DocumentStore;
import com.voxagent.memory.Embedder;

public class RetrievalTool implements Tool {

    private final DocumentStore store;
    private final Embedder embedder;
    private final String collection;
    private final int topK;

    public RetrievalTool(DocumentStore store, Embedder embedder, String collection, int topK) {
        this.store = store;
        this.embedder = embedder;
        this.collection = collection;
        this.topK = topK;
    }

    /** Collection used when an agent enables retrieval without naming one. */
    public static String defaultCollection(String agentId) {
        return "agent_" + agentId.replace('-', '_') + "_docs";
    }

    public String collection() { return collection; }

    @Override
    public ToolResult search(String query) {
        try {
            if (!store.hasCollection(collection)) {
                return ToolResult.empty("No documents found in collection: " + collection);
            }
            var passages = store.search(collection, query, embedder.embed(query), topK);
            if (passages.isEmpty()) {
                return ToolResult.empty("No relevant information found in the documents.");
            }
            var sb = new StringBuilder("Relevant information from documents:\n\n");
            int idx = 1;
            for (var p : passages) {
                sb.append(idx++).append(". (Source: ").append(p.source()).append(")\n")
                  .append(p.content().strip()).append("\n\n");
            }
            return ToolResult.ok(sb.toString().strip());
        } catch (Exception e) {
            return ToolResult.error("Retrieval error: " + e.getMessage());
        }
    }
}
