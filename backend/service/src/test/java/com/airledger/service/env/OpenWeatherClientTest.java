package com.airledger.service.env;

import com.airledger.collectors.weather.WeatherContext;
import com.airledger.core.model.StationConfig;
import com.airledger.service.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenWeatherClientTest {
    private static final StationConfig ANAND_VIHAR = new StationConfig(
            "DL001", "Anand Vihar", "2553", "roadside", 28.6469, 77.3164, List.of());

    private final HttpClient httpClient = HttpClient.newHttpClient();
    private StubHttpServer server;

    @BeforeEach
    void startServer() throws Exception {
        server = new StubHttpServer("/weather");
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void mapsCurrentConditions() {
        server.respond(200, """
                {
                  "weather": [{"main": "Mist", "description": "mist"}],
                  "main": {"temp": 12.0, "feels_like": 10.5, "humidity": 88, "pressure": 1016},
                  "wind": {"speed": 1.1, "deg": 300},
                  "visibility": 1500,
                  "clouds": {"all": 75}
                }
                """);

        WeatherContext weather = client("key").current(ANAND_VIHAR).orElseThrow();

        assertEquals(12.0, weather.temperature());
        assertEquals(10.5, weather.feelsLike());
        assertEquals(88.0, weather.humidity());
        assertEquals(1.1, weather.windSpeed());
        assertEquals(300.0, weather.windDirection());
        assertNull(weather.windGust());
        assertEquals(1500.0, weather.visibility());
        assertEquals(75.0, weather.cloudCover());
        assertEquals("mist", weather.description());
        assertTrue(weather.inversionLikely());

        String uri = server.requestUris().get(0);
        assertTrue(uri.contains("lat=28.6469"));
        assertTrue(uri.contains("lon=77.3164"));
        assertTrue(uri.contains("units=metric"));
        assertTrue(uri.contains("appid=key"));
    }

    @Test
    void noKeyOrNoCoordinatesMeansNoRequest() {
        StationConfig unplaced = new StationConfig("DL009", "Unplaced", null, null, null, null, List.of());

        assertTrue(client("").current(ANAND_VIHAR).isEmpty());
        assertTrue(client("key").current(unplaced).isEmpty());
        assertTrue(server.requestUris().isEmpty());
    }

    @Test
    void upstreamErrorsYieldNoWeather() {
        server.respond(401, "{\"cod\":401,\"message\":\"Invalid API key\"}");
        assertTrue(client("key").current(ANAND_VIHAR).isEmpty());

        server.respond(200, "not json");
        assertTrue(client("key").current(ANAND_VIHAR).isEmpty());
    }

    private OpenWeatherClient client(String key) {
        return new OpenWeatherClient(httpClient, Duration.ofSeconds(2), key, server.baseUrl("/weather"));
    }
}
