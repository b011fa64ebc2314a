package com.airledger.service.env;

import com.airledger.collectors.ingestion.ReadingProvider;
import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.SourceMetadata;
import com.airledger.core.model.StationConfig;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Ingestion connector for the World Air Quality Index feed API. Every failure is logged and reported as
 * no reading for this cycle.
 */
public final class WaqiClient implements ReadingProvider {
    private static final Logger LOGGER = Logger.getLogger(WaqiClient.class.getName());

    public static final String DEFAULT_BASE_URL = "https://api.waqi.info/feed";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Clock clock;
    private final String token;
    private final String baseUrl;

    public WaqiClient(HttpClient httpClient, Duration timeout, Clock clock, String token) {
        this(httpClient, timeout, clock, token, DEFAULT_BASE_URL);
    }

    WaqiClient(HttpClient httpClient, Duration timeout, Clock clock, String token, String baseUrl) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.clock = clock;
        this.token = token == null ? "" : token.trim();
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<Reading> fetch(StationConfig station) {
        if (token.isBlank()) {
            LOGGER.severe("WAQI_TOKEN not set; no reading for station " + station.stationId());
            return Optional.empty();
        }
        String feedId = station.waqiId() == null || station.waqiId().isBlank() ? station.stationId() : station.waqiId();
        String path = baseUrl + "/@" + URLEncoder.encode(feedId, StandardCharsets.UTF_8) + "/";
        URI uri = URI.create(path + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOGGER.warning("WAQI request timed out for station " + station.stationId());
            return Optional.empty();
        } catch (IOException e) {
            LOGGER.warning("WAQI network error for station " + station.stationId() + ": " + e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (response.statusCode() / 100 != 2) {
            LOGGER.warning("WAQI HTTP error " + response.statusCode() + " for station " + station.stationId());
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(response.body());
        } catch (IOException e) {
            LOGGER.warning("WAQI returned malformed JSON for station " + station.stationId());
            return Optional.empty();
        }
        if (root == null || !"ok".equals(root.path("status").asText())) {
            LOGGER.warning("WAQI status not ok for station " + station.stationId() + ": "
                    + (root == null ? "empty body" : root.path("status").asText()));
            return Optional.empty();
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            LOGGER.warning("WAQI response missing 'data' for station " + station.stationId());
            return Optional.empty();
        }
        return Optional.of(toReading(station, data, path + "?token=REDACTED"));
    }

    private Reading toReading(StationConfig station, JsonNode data, String sourceUrl) {
        JsonNode iaqi = data.path("iaqi");
        Map<Pollutant, Double> pollutants = new EnumMap<>(Pollutant.class);
        for (Pollutant pollutant : Pollutant.values()) {
            Double value = iaqiValue(iaqi, pollutant.code());
            if (value != null) {
                pollutants.put(pollutant, value);
            }
        }
        MetContext met = new MetContext(
                iaqiValue(iaqi, "t"),
                iaqiValue(iaqi, "h"),
                iaqiValue(iaqi, "w"),
                iaqiValue(iaqi, "wd"),
                iaqiValue(iaqi, "p"),
                iaqiValue(iaqi, "dew"),
                null
        );
        String stationName = data.path("city").path("name").asText(station.name());
        Reading reading = new Reading(
                station.stationId(),
                parseTimestamp(data.path("time").path("iso").asText("")),
                pollutants,
                met,
                new SourceMetadata("waqi", stationName, parseAqi(data.path("aqi")), sourceUrl)
        );
        LOGGER.info("WAQI reading fetched for station " + station.stationId() + ": " + pollutants.size() + " pollutants");
        return reading;
    }

    static Double iaqiValue(JsonNode iaqi, String key) {
        JsonNode value = iaqi.path(key).path("v");
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty() || "-".equals(text)) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private Instant parseTimestamp(String iso) {
        if (!iso.isBlank()) {
            try {
                return OffsetDateTime.parse(iso).toInstant();
            } catch (DateTimeParseException e) {
                LOGGER.fine("Unparseable WAQI timestamp '" + iso + "', using current time");
            }
        }
        return clock.instant();
    }

    private static Integer parseAqi(JsonNode aqi) {
        if (aqi.isInt()) {
            return aqi.asInt();
        }
        if (aqi.isTextual()) {
            try {
                return Integer.parseInt(aqi.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
