package de.zeus.hems.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.config.WeatherProperties;
import de.zeus.hems.model.DwellingLocation;
import de.zeus.hems.model.Location;
import de.zeus.hems.model.WeatherSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

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

class WeatherServiceTest {

    private static final Location BERLIN = new Location(52.52, 13.405);

    private RestTemplate restTemplate;
    private WeatherProperties weatherProperties;
    private SimulationProperties simulationProperties;

    @BeforeEach
    void setUp() {
        restTemplate = mock(RestTemplate.class);
        weatherProperties = new WeatherProperties();
        simulationProperties = new SimulationProperties();
    }

    @Test
    void getCurrent_parsesOpenMeteoCurrentBlock() {
        String body = "{\"current\":{\"time\":\"2026-06-21T12:00\",\"temperature_2m\":18.5,"
                + "\"cloud_cover\":40,\"shortwave_radiation\":650.0}}";
        when(restTemplate.getForEntity(contains("current=temperature_2m,cloud_cover,shortwave_radiation"), eq(String.class)))
                .thenReturn(new ResponseEntity<>(body, HttpStatus.OK));

        WeatherSample sample = service(at("2026-06-21T12:00:00Z"), Runnable::run).getCurrent(BERLIN);

        assertEquals(650, sample.solarIrradianceWm2());
        assertEquals(18.5, sample.temperatureC());
        assertEquals(40, sample.cloudCover());
        assertFalse(sample.fallback());
    }

    @Test
    void getCurrent_missingFields_useDefaults() {
        when(restTemplate.getForEntity(anyString(), eq(String.class)))
                .thenReturn(new ResponseEntity<>("{\"current\":{}}", HttpStatus.OK));

        WeatherSample sample = service(at("2026-06-21T12:00:00Z"), Runnable::run).getCurrent(BERLIN);

        assertEquals(0, sample.solarIrradianceWm2());
        assertEquals(20, sample.temperatureC());
        assertEquals(0, sample.cloudCover());
        assertFalse(sample.fallback());
    }

    @Test
    void getCurrent_apiFailure_returnsMiddayFallback() {
        when(restTemplate.getForEntity(anyString(), eq(String.class)))
                .thenThrow(new ResourceAccessException("Read timed out"));

        WeatherSample sample = service(at("2026-06-21T12:00:00Z"), Runnable::run).getCurrent(BERLIN);

        assertTrue(sample.fallback());
        assertEquals(600, sample.solarIrradianceWm2(), 1e-9, "Half sine peaks at noon");
        assertEquals(22, sample.temperatureC());
        assertEquals(30, sample.cloudCover());
    }

    @Test
    void getCurrent_emptyBodyOrServerError_returnsFallback() {
        when(restTemplate.getForEntity(anyString(), eq(String.class)))
                .thenReturn(new ResponseEntity<>(HttpStatus.OK))
                .thenReturn(new ResponseEntity<>("oops", HttpStatus.INTERNAL_SERVER_ERROR))
                .thenReturn(new ResponseEntity<>("not json", HttpStatus.OK));
        WeatherService service = service(at("2026-06-21T09:00:00Z"), Runnable::run);

        assertTrue(service.getCurrent(BERLIN).fallback());
        assertTrue(service.getCurrent(BERLIN).fallback());
        assertTrue(service.getCurrent(BERLIN).fallback());
    }

    @Test
    void fallbackSample_followsTimeOfDay() {
        assertEquals(0, service(at("2026-06-21T03:00:00Z"), Runnable::run).fallbackSample().solarIrradianceWm2(), 1e-9);
        assertEquals(0, service(at("2026-06-21T06:00:00Z"), Runnable::run).fallbackSample().solarIrradianceWm2(), 1e-9);
        assertEquals(600 * Math.sin(0.25 * Math.PI),
                service(at("2026-06-21T09:00:00Z"), Runnable::run).fallbackSample().solarIrradianceWm2(), 1e-9);
        assertEquals(0, service(at("2026-06-21T18:30:00Z"), Runnable::run).fallbackSample().solarIrradianceWm2(), 1e-9);
        assertEquals(0, service(at("2026-06-21T22:00:00Z"), Runnable::run).fallbackSample().solarIrradianceWm2(), 1e-9);
    }

    @Test
    void getCurrent_apiDisabled_neverCallsRemote() {
        weatherProperties.setEnabled(false);

        WeatherSample sample = service(at("2026-06-21T12:00:00Z"), Runnable::run).getCurrent(BERLIN);

        assertTrue(sample.fallback());
        verifyNoInteractions(restTemplate);
    }

    @Test
    void getManyCurrent_returnsSampleForEveryDwelling() {
        when(restTemplate.getForEntity(anyString(), eq(String.class)))
                .thenThrow(new ResourceAccessException("offline"));
        List<DwellingLocation> locations = List.of(
                new DwellingLocation("d1", BERLIN),
                new DwellingLocation("d2", BERLIN),
                new DwellingLocation("d3", BERLIN),
                new DwellingLocation("d4", BERLIN));

        Map<String, WeatherSample> result = service(at("2026-06-21T12:00:00Z"), Runnable::run).getManyCurrent(locations);

        assertEquals(List.of("d1", "d2", "d3", "d4"), List.copyOf(result.keySet()));
        assertTrue(result.values().stream().allMatch(WeatherSample::fallback));
    }

    @Test
    void getManyCurrent_failedTask_leavesDwellingOut() {
        weatherProperties.setEnabled(false);
        AtomicInteger submissions = new AtomicInteger();
        TaskExecutor rejectingSecond = task -> {
            if (submissions.incrementAndGet() == 2) {
                throw new RejectedExecutionException("pool saturated");
            }
            task.run();
        };
        List<DwellingLocation> locations = List.of(
                new DwellingLocation("d1", BERLIN),
                new DwellingLocation("d2", BERLIN),
                new DwellingLocation("d3", BERLIN));

        Map<String, WeatherSample> result = service(at("2026-06-21T12:00:00Z"), rejectingSecond).getManyCurrent(locations);

        assertEquals(2, result.size());
        assertFalse(result.containsKey("d2"));
    }

    private WeatherService service(Clock clock, TaskExecutor executor) {
        return new WeatherService(restTemplate, new ObjectMapper(), weatherProperties, simulationProperties, executor, clock);
    }

    private static Clock at(String instant) {
        return Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
    }
}
