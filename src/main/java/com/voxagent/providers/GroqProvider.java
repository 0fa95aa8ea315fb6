package com.voxagent.providers;

public class GroqProvider extends OpenAiCompatibleProvider {

    public static final String BASE_URL = "https://api.groq.com/openai/v1";
    public static final String DEFAULT_MODEL = "llama-3.1-70b-versatile";

    public GroqProvider(String apiKey) {
        this(apiKey, BASE_URL, DEFAULT_MODEL);
    }

    public GroqProvider(String apiKey, String baseUrl, String model) {
        super(apiKey, baseUrl, model);
    }

    @Override
    public String id() {
        return "groq";
    }
}
