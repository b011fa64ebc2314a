package com.airledger.service.env;

import com.airledger.collectors.weather.WeatherContext;
import com.airledger.collectors.weather.WeatherProvider;
import com.airledger.core.model.StationConfig;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Current conditions from OpenWeatherMap in metric units.
 */
public final class OpenWeatherClient implements WeatherProvider {
    private static final Logger LOGGER = Logger.getLogger(OpenWeatherClient.class.getName());

    public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org/data/2.5/weather";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String apiKey;
    private final String baseUrl;

    public OpenWeatherClient(HttpClient httpClient, Duration timeout, String apiKey) {
        this(httpClient, timeout, apiKey, DEFAULT_BASE_URL);
    }

    OpenWeatherClient(HttpClient httpClient, Duration timeout, String apiKey, String baseUrl) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<WeatherContext> current(StationConfig station) {
        if (apiKey.isBlank() || !station.hasCoordinates()) {
            return Optional.empty();
        }
        String query = "lat=" + station.latitude()
                + "&lon=" + station.longitude()
                + "&units=metric"
                + "&appid=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "?" + query))
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOGGER.warning("OpenWeatherMap HTTP error " + response.statusCode() + " for station " + station.stationId());
                return Optional.empty();
            }
            return Optional.of(parse(JsonUtils.objectMapper().readTree(response.body())));
        } catch (IOException e) {
            LOGGER.warning("OpenWeatherMap request failed for station " + station.stationId() + ": " + e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    static WeatherContext parse(JsonNode root) {
        JsonNode main = root.path("main");
        JsonNode wind = root.path("wind");
        JsonNode weather = root.path("weather");
        String description = weather.isArray() && !weather.isEmpty()
                ? weather.get(0).path("description").asText(null)
                : null;
        return new WeatherContext(
                number(main, "temp"),
                number(main, "feels_like"),
                number(main, "humidity"),
                number(main, "pressure"),
                number(wind, "speed"),
                number(wind, "deg"),
                number(wind, "gust"),
                number(root, "visibility"),
                number(root.path("clouds"), "all"),
                description
        );
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }
}
