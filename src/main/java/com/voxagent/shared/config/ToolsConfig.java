package com.voxagent.shared.config;

public record ToolsConfig(
    int timeoutSeconds,
    WebSearchConfig webSearch,
    WeatherConfig weather
) {
    /** {@code maxContextChars} bounds how much search output reaches the prompt. */
    public record WebSearchConfig(String defaultProvider, int maxContextChars, int timeoutSeconds) {
        public static WebSearchConfig defaults() {
            return new WebSearchConfig("duckduckgo", 800, 10);
        }
    }

    public record WeatherConfig(String baseUrl, int timeoutSeconds) {
        public static WeatherConfig defaults() {
            return new WeatherConfig("https://api.openweathermap.org/data/2.5", 10);
        }
    }

    public static ToolsConfig defaults() {
        return new ToolsConfig(10, WebSearchConfig.defaults(), WeatherConfig.defaults());
    }
}
