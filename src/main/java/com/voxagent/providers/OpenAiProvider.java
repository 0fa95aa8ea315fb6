package com.voxagent.providers;

public class OpenAiProvider extends OpenAiCompatibleProvider {

    public static final String BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public OpenAiProvider(String apiKey) {
        this(apiKey, BASE_URL, DEFAULT_MODEL);
    }

    public OpenAiProvider(String apiKey, String baseUrl, String model) {
        super(apiKey, baseUrl, model);
    }

    @Override
    public String id() {
        return "openai";
    }
}
