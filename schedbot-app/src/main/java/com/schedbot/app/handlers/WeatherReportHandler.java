package com.schedbot.app.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.schedbot.common.config.ConfigService;
import com.schedbot.scheduler.fetch.RemoteDataFetcher;
import com.schedbot.scheduler.job.ApiCallSpec;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.outbound.DispatchResult;
import com.schedbot.scheduler.outbound.MessageContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code weatherReport}: sends a formatted weather summary.
 * <p>
 * Uses the firing's remote data when it is an OpenWeatherMap current-weather
 * response. Otherwise, if the job has a {@code weatherLocation} and an API key
 * is configured, fetches the weather for that location itself.
 */
@Slf4j
@Component
public class WeatherReportHandler implements NamedJobHandler {

    public static final String NAME = "weatherReport";
    static final String LOCATION_KEY = "weatherLocation";
    static final long CACHE_TTL_MS = 30 * 60 * 1000L;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final RemoteDataFetcher fetcher;
    private final ZoneId zone;
    private final Clock clock;
    private final String apiKey;
    private final String apiUrl;

    @Autowired
    public WeatherReportHandler(RemoteDataFetcher fetcher, ConfigService configService, Clock clock,
            @Value("${schedbot.weather.api-key:}") String apiKey,
            @Value("${schedbot.weather.url:https://api.openweathermap.org/data/2.5/weather}") String apiUrl) {
        this(fetcher, configService.resolveZone(), clock, apiKey, apiUrl);
    }

    WeatherReportHandler(RemoteDataFetcher fetcher, ZoneId zone, Clock clock, String apiKey, String apiUrl) {
        this.fetcher = fetcher;
        this.zone = zone;
        this.clock = clock;
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(Invocation invocation) {
        ScheduledJob job = invocation.job();
        JsonNode data = invocation.remoteData();
        if (!isWeatherResponse(data)) {
            data = fetchForLocation(job);
        }
        String message = format(data);
        DispatchResult result = invocation.dispatcher().dispatch(new MessageContent.PlainText(message),
                invocation.destination());
        if (result == null || !result.isSuccess()) {
            throw new IllegalStateException("Weather report not delivered: "
                    + (result != null ? result.getError() : "no result"));
        }
        log.info("Weather report sent for job \"{}\" ({})", job.getName(), data.path("name").asText());
    }

    private JsonNode fetchForLocation(ScheduledJob job) {
        Object location = job.getExtra().get(LOCATION_KEY);
        if (location == null || location.toString().isBlank()) {
            throw new IllegalStateException("No weather data: configure the job's API or set "
                    + LOCATION_KEY + " on the job");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("No weather data: schedbot.weather.api-key is not set");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", location.toString());
        params.put("appid", apiKey);
        params.put("units", "metric");
        ApiCallSpec spec = ApiCallSpec.builder()
                .url(apiUrl)
                .method("GET")
                .params(params)
                .required(true)
                .cacheTtl(CACHE_TTL_MS)
                .build();
        JsonNode data = fetcher.fetch(spec, job.getName());
        if (!isWeatherResponse(data)) {
            throw new IllegalStateException("Unexpected weather response for " + location);
        }
        return data;
    }

    static boolean isWeatherResponse(JsonNode data) {
        return data != null && data.has("main") && data.has("weather");
    }

    String format(JsonNode data) {
        JsonNode main = data.path("main");
        return "🌤️ Weather - " + data.path("name").asText() + " - " + DATE.format(clock.instant().atZone(zone))
                + "\n\n"
                + "- Temperature: " + Math.round(main.path("temp").asDouble()) + "°C\n"
                + "- Feels like: " + Math.round(main.path("feels_like").asDouble()) + "°C\n"
                + "- Conditions: " + data.path("weather").path(0).path("description").asText() + "\n"
                + "- Humidity: " + main.path("humidity").asInt() + "%\n"
                + "- Wind: " + Math.round(data.path("wind").path("speed").asDouble() * 3.6) + " km/h\n"
                + "- Pressure: " + main.path("pressure").asInt() + " hPa";
    }
}
