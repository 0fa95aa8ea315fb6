package com.voxagent.shared.config;

public record RetrievalConfig(
    String indexPath,
    String embeddingBaseUrl,
    String embeddingModel,
    int embeddingCacheSize
) {
    public static RetrievalConfig defaults() {
        return new RetrievalConfig(
            ConfigLoader.HOME.resolve("index").toString(),
            "https://api.openai.com/v1",
            "text-embedding-3-small",
            100
        );
    }
}
