package com.voxagent.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WeatherToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void extractsCityAfterCommonPhrases() {
        assertEquals(Optional.of("Paris"), WeatherTool.extractCity("What's the weather in Paris?"));
        assertEquals(Optional.of("New York"), WeatherTool.extractCity("how's the weather in new york right now"));
        assertEquals(Optional.of("Oslo"), WeatherTool.extractCity("temperature at Oslo today."));
        assertEquals(Optional.of("Berlin"), WeatherTool.extractCity("forecast for Berlin"));
    }

    @Test
    void fallsBackToWordsAfterPreposition() {
        assertEquals(Optional.of("Lisbon"), WeatherTool.extractCity("is it going to rain in Lisbon"));
    }

    @Test
    void shortQueryIsTakenAsCity() {
        assertEquals(Optional.of("San Francisco"), WeatherTool.extractCity("san francisco"));
    }

    @Test
    void noCityInQuery() {
        assertTrue(WeatherTool.extractCity("what's the weather like").isEmpty());
        assertTrue(WeatherTool.extractCity("").isEmpty());
    }

    @Test
    void missingApiKeyIsAnError() {
        var tool = new WeatherTool("", "https://api.openweathermap.org/data/2.5", "metric",
                Duration.ofSeconds(1), HttpClient.newHttpClient());
        var result = tool.search("weather in Paris");
        assertTrue(result.isError());
        assertEquals("OpenWeatherMap API key not configured", result.output());
    }

    @Test
    void unknownCityIsAnError() {
        var tool = new WeatherTool("key", "https://api.openweathermap.org/data/2.5", "metric",
                Duration.ofSeconds(1), HttpClient.newHttpClient());
        var result = tool.search("what's the weather like");
        assertTrue(result.isError());
        assertEquals("Could not determine the city. Please specify a city name.", result.output());
    }

    @Test
    void formatsCurrentConditions() throws Exception {
        var json = MAPPER.readTree("""
                {"name":"Paris","sys":{"country":"FR"},
                 "main":{"temp":21.5,"feels_like":20.9,"humidity":40},
                 "weather":[{"description":"clear sky"}],
                 "wind":{"speed":3.1}}
                """);
        assertEquals("""
                Current weather in Paris, FR:
                - Temperature: 21.5°C (feels like 20.9°C)
                - Conditions: clear sky
                - Humidity: 40%
                - Wind: 3.1 m/s""", WeatherTool.formatCurrent(json, "metric"));
        assertTrue(WeatherTool.formatCurrent(json, "imperial").contains("°F"));
        assertTrue(WeatherTool.formatCurrent(json, "imperial").endsWith("mph"));
    }

    @Test
    void forecastShowsAtMostFiveEntries() throws Exception {
        var sb = new StringBuilder("{\"city\":{\"name\":\"Rome\",\"country\":\"IT\"},\"list\":[");
        for (int i = 0; i < 8; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"dt_txt\":\"slot").append(i).append("\",\"main\":{\"temp\":").append(10 + i)
              .append("},\"weather\":[{\"description\":\"clouds\"}]}");
        }
        sb.append("]}");
        var text = WeatherTool.formatForecast(MAPPER.readTree(sb.toString()), "metric");
        assertTrue(text.startsWith("Weather forecast for Rome, IT:"));
        assertTrue(text.contains("slot4"));
        assertFalse(text.contains("slot5"));
    }
}
