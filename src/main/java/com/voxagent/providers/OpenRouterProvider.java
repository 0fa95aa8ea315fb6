package com.voxagent.providers;

public class OpenRouterProvider extends OpenAiCompatibleProvider {

    public static final String BASE_URL = "https://openrouter.ai/api/v1";
    public static final String DEFAULT_MODEL = "openai/gpt-4o-mini";

    public OpenRouterProvider(String apiKey) {
        this(apiKey, BASE_URL, DEFAULT_MODEL);
    }

    public OpenRouterProvider(String apiKey, String baseUrl, String model) {
        super(apiKey, baseUrl, model);
    }

    @Override
    public String id() {
        return "openrouter";
    }
}
