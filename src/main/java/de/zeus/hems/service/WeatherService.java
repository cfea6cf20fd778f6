package de.zeus.hems.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeus.hems.config.LogFilter;
import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.config.WeatherProperties;
import de.zeus.hems.model.DwellingLocation;
import de.zeus.hems.model.Location;
import de.zeus.hems.model.WeatherSample;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Copyright 2025 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Open-Meteo client delivering current irradiance, temperature and cloud cover per dwelling.
 * Any failure is answered with a deterministic time-of-day estimate instead of an error.
 */
@Service
public class WeatherService {

    private static final String CURRENT_PARAMS = "temperature_2m,cloud_cover,shortwave_radiation";
    private static final int DAY_START_HOUR = 6;
    private static final int DAY_END_HOUR = 18;
    private static final double DEFAULT_TEMPERATURE_C = 20.0;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final WeatherProperties weatherProperties;
    private final SimulationProperties simulationProperties;
    private final TaskExecutor weatherExecutor;
    private final Clock clock;

    public WeatherService(@Qualifier("weatherRestTemplate") RestTemplate restTemplate,
                          ObjectMapper objectMapper,
                          WeatherProperties weatherProperties,
                          SimulationProperties simulationProperties,
                          @Qualifier("weatherExecutor") TaskExecutor weatherExecutor,
                          Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.weatherProperties = weatherProperties;
        this.simulationProperties = simulationProperties;
        this.weatherExecutor = weatherExecutor;
        this.clock = clock;
    }

    /**
     * Fetches the current weather for a location.
     *
     * @param location The dwelling location.
     * @return Live data, or the fallback estimate if the API is disabled or the call fails.
     */
    public WeatherSample getCurrent(Location location) {
        if (!weatherProperties.isEnabled()) {
            LogFilter.logDebug(WeatherService.class, "Weather API is disabled. Using fallback estimate.");
            return fallbackSample();
        }

        String url = buildWeatherApiUrl(location);
        LogFilter.logDebug(WeatherService.class, "Fetching current weather from URL: {}", url);

        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                LogFilter.logWarn(WeatherService.class, "Weather API call for {} failed with status: {}. Using fallback estimate.",
                        location, response.getStatusCode());
                return fallbackSample();
            }

            JsonNode current = objectMapper.readTree(response.getBody()).path("current");
            if (current.isMissingNode() || !current.isObject()) {
                LogFilter.logWarn(WeatherService.class, "No current weather in API response for {}. Using fallback estimate.", location);
                return fallbackSample();
            }

            return new WeatherSample(
                    Math.max(0, current.path("shortwave_radiation").asDouble(0)),
                    current.path("temperature_2m").asDouble(DEFAULT_TEMPERATURE_C),
                    clampCloudCover(current.path("cloud_cover").asDouble(0)),
                    clock.instant(),
                    false);
        } catch (Exception e) {
            LogFilter.logWarn(WeatherService.class, "Failed to fetch weather for {}: {}. Using fallback estimate.",
                    location, e.getMessage());
            return fallbackSample();
        }
    }

    /**
     * Fetches the weather for many dwellings, at most {@code simulation.weather-batch-size}
     * requests at a time. A dwelling whose request task fails outright is left out of the
     * result.
     *
     * @param locations Dwellings and their locations.
     * @return Weather by dwelling id, in request order.
     */
    public Map<String, WeatherSample> getManyCurrent(List<DwellingLocation> locations) {
        Map<String, WeatherSample> results = new LinkedHashMap<>();
        int batchSize = Math.max(1, simulationProperties.getWeatherBatchSize());

        for (int i = 0; i < locations.size(); i += batchSize) {
            List<DwellingLocation> batch = locations.subList(i, Math.min(i + batchSize, locations.size()));
            List<CompletableFuture<WeatherSample>> futures = new ArrayList<>(batch.size());
            for (DwellingLocation entry : batch) {
                futures.add(submit(entry));
            }

            for (int j = 0; j < batch.size(); j++) {
                String dwellingId = batch.get(j).dwellingId();
                try {
                    results.put(dwellingId, futures.get(j).join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    LogFilter.logError(WeatherService.class, "Weather fetch failed for dwelling {}: {}", dwellingId, cause.getMessage());
                }
            }
        }
        return results;
    }

    /**
     * Time-of-day estimate: a half sine between 06:00 and 18:00 of the clock's zone,
     * zero at night, with fixed temperature and cloud cover.
     */
    public WeatherSample fallbackSample() {
        int hour = LocalTime.now(clock).getHour();
        double irradiance = 0;
        if (hour >= DAY_START_HOUR && hour <= DAY_END_HOUR) {
            double dayProgress = (hour - DAY_START_HOUR) / (double) (DAY_END_HOUR - DAY_START_HOUR);
            irradiance = weatherProperties.getFallbackPeakIrradiance() * Math.sin(dayProgress * Math.PI);
        }
        return new WeatherSample(
                Math.max(0, irradiance),
                weatherProperties.getFallbackTemperatureC(),
                weatherProperties.getFallbackCloudCover(),
                clock.instant(),
                true);
    }

    private CompletableFuture<WeatherSample> submit(DwellingLocation entry) {
        try {
            return CompletableFuture.supplyAsync(() -> getCurrent(entry.location()), weatherExecutor);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String buildWeatherApiUrl(Location location) {
        return UriComponentsBuilder.fromHttpUrl(weatherProperties.getBaseUrl())
                .queryParam("latitude", location.lat())
                .queryParam("longitude", location.lng())
                .queryParam("current", CURRENT_PARAMS)
                .queryParam("timezone", "auto")
                .queryParam("forecast_days", 1)
                .toUriString();
    }

    private static double clampCloudCover(double cloudCover) {
        return Math.max(0, Math.min(100, cloudCover));
    }
}
