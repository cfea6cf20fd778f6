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
 * Current weather at a dwelling.
 *
 * @param solarIrradianceWm2 Global horizontal irradiance in W/m², never negative.
 * @param temperatureC       Ambient temperature in °C.
 * @param cloudCover         Cloud cover in percent (0..100).
 * @param timestamp          When the sample was taken.
 * @param fallback           True if the sample is the time-of-day estimate instead of live data.
 */
public record WeatherSample(double solarIrradianceWm2,
                            double temperatureC,
                            double cloudCover,
                            Instant timestamp,
                            boolean fallback) {
}
