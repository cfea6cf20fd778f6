package de.zeus.hems.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

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
 * Open-Meteo access and the time-of-day fallback used whenever it is unavailable.
 */
@Component
@ConfigurationProperties(prefix = "weather.api")
public class WeatherProperties {

    private boolean enabled = true;

    private String baseUrl = "https://api.open-meteo.com/v1/forecast";

    /** Connect and read timeout (ms). */
    private int timeoutMs = 5000;

    /** Irradiance at solar noon of the fallback curve (W/m²). */
    private double fallbackPeakIrradiance = 600;

    private double fallbackTemperatureC = 22;

    private double fallbackCloudCover = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public double getFallbackPeakIrradiance() {
        return fallbackPeakIrradiance;
    }

    public void setFallbackPeakIrradiance(double fallbackPeakIrradiance) {
        this.fallbackPeakIrradiance = fallbackPeakIrradiance;
    }

    public double getFallbackTemperatureC() {
        return fallbackTemperatureC;
    }

    public void setFallbackTemperatureC(double fallbackTemperatureC) {
        this.fallbackTemperatureC = fallbackTemperatureC;
    }

    public double getFallbackCloudCover() {
        return fallbackCloudCover;
    }

    public void setFallbackCloudCover(double fallbackCloudCover) {
        this.fallbackCloudCover = fallbackCloudCover;
    }
}
