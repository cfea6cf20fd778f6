package de.zeus.hems.model;

import java.time.Instant;

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
 * Lightweight broadcast for dashboard subscribers.
 */
public record DwellingSummary(String dwellingId,
                              int deviceCount,
                              Instant timestamp,
                              WeatherSample weatherData) {

    public static DwellingSummary of(DwellingUpdate update) {
        return new DwellingSummary(update.dwellingId(), update.devices().size(), update.timestamp(), update.weatherData());
    }
}
