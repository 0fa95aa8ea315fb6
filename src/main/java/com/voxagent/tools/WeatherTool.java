package com.voxagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Current conditions and short forecasts from OpenWeatherMap. The city is pulled out
 * of the spoken query.
 */
public class WeatherTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<String> CITY_PREFIXES = List.of(
            "how's the weather in ", "what's the weather in ", "what is the weather in ",
            "weather in ", "weather for ", "weather of ",
            "temperature in ", "temperature at ",
            "forecast for ", "forecast in ");
    // longest first so " right now" wins over " now"
    private static final List<String> TRAILING = List.of(" right now", " today", " like", " now");
    private static final List<String> FALLBACK_MARKERS = List.of(" in ", " at ", " for ");

    private final String apiKey;
    private final String baseUrl;
    private final String units;
    private final Duration timeout;
    private final HttpClient httpClient;

    public WeatherTool(String apiKey, String baseUrl, String units, Duration timeout, HttpClient httpClient) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.units = "imperial".equalsIgnoreCase(units) ? "imperial" : "metric";
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    @Override
    public ToolResult search(String query) {
        if (apiKey == null || apiKey.isBlank()) {
            return ToolResult.error("OpenWeatherMap API key not configured");
        }
        var city = extractCity(query);
        if (city.isEmpty()) {
            return ToolResult.error("Could not determine the city. Please specify a city name.");
        }
        var lower = query.toLowerCase(Locale.ROOT);
        try {
            if (lower.contains("forecast") || lower.contains("tomorrow")) {
                return forecast(city.get());
            }
            return current(city.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.error("Weather request interrupted");
        } catch (Exception e) {
            return ToolResult.error("Weather error: " + e.getMessage());
        }
    }

    private ToolResult current(String city) throws Exception {
        var resp = get("/weather", city, "");
        if (resp.statusCode() == 404) return ToolResult.error("City '" + city + "' not found");
        if (resp.statusCode() != 200) return ToolResult.error("Weather API error: HTTP " + resp.statusCode());
        return ToolResult.ok(formatCurrent(MAPPER.readTree(resp.body()), units));
    }

    private ToolResult forecast(String city) throws Exception {
        var resp = get("/forecast", city, "&cnt=8");
        if (resp.statusCode() == 404) return ToolResult.error("City '" + city + "' not found");
        if (resp.statusCode() != 200) return ToolResult.error("Weather API error: HTTP " + resp.statusCode());
        return ToolResult.ok(formatForecast(MAPPER.readTree(resp.body()), units));
    }

    private HttpResponse<String> get(String path, String city, String extra) throws Exception {
        var url = baseUrl + path
                + "?q=" + URLEncoder.encode(city, StandardCharsets.UTF_8)
                + "&appid=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)
                + "&units=" + units + extra;
        var req = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();
        return httpClient.send(req, HttpResponse.BodyHandlers.ofString());
    }

    static String formatCurrent(JsonNode data, String units) {
        var tempUnit = "imperial".equals(units) ? "°F" : "°C";
        var speedUnit = "imperial".equals(units) ? "mph" : "m/s";
        var main = data.path("main");
        return "Current weather in " + data.path("name").asText() + ", " + data.path("sys").path("country").asText() + ":\n"
                + "- Temperature: " + main.path("temp").asText() + tempUnit
                + " (feels like " + main.path("feels_like").asText() + tempUnit + ")\n"
                + "- Conditions: " + data.path("weather").path(0).path("description").asText() + "\n"
                + "- Humidity: " + main.path("humidity").asText() + "%\n"
                + "- Wind: " + data.path("wind").path("speed").asText() + " " + speedUnit;
    }

    static String formatForecast(JsonNode data, String units) {
        var tempUnit = "imperial".equals(units) ? "°F" : "°C";
        var city = data.path("city");
        var sb = new StringBuilder("Weather forecast for ")
                .append(city.path("name").asText()).append(", ")
                .append(city.path("country").asText()).append(":\n");
        int n = 0;
        for (var item : data.path("list")) {
            if (n++ >= 5) break;
            sb.append("- ").append(item.path("dt_txt").asText()).append(": ")
              .append(item.path("main").path("temp").asText()).append(tempUnit).append(", ")
              .append(item.path("weather").path(0).path("description").asText()).append("\n");
        }
        return sb.toString().strip();
    }

    static Optional<String> extractCity(String query) {
        if (query == null || query.isBlank()) return Optional.empty();
        var lower = query.toLowerCase(Locale.ROOT).strip();

        for (var prefix : CITY_PREFIXES) {
            int idx = lower.indexOf(prefix);
            if (idx >= 0) {
                var city = clean(lower.substring(idx + prefix.length()));
                if (!city.isEmpty()) return Optional.of(capitalize(city));
            }
        }
        for (var marker : FALLBACK_MARKERS) {
            int idx = lower.lastIndexOf(marker);
            if (idx >= 0) {
                var city = clean(lower.substring(idx + marker.length()));
                if (!city.isEmpty()) return Optional.of(capitalize(city));
            }
        }
        var words = clean(lower).split("\\s+");
        if (words.length <= 3 && !lower.contains("weather") && !words[0].isEmpty()) {
            return Optional.of(capitalize(String.join(" ", words)));
        }
        return Optional.empty();
    }

    private static String clean(String s) {
        var city = s.replace("?", "").replace(".", "").replace("!", "").strip();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var suffix : TRAILING) {
                if (city.endsWith(suffix)) {
                    city = city.substring(0, city.length() - suffix.length()).strip();
                    changed = true;
                }
            }
        }
        return city;
    }

    private static String capitalize(String city) {
        return String.join(" ", Arrays.stream(city.split("\\s+"))
                .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1))
                .toList());
    }
}
