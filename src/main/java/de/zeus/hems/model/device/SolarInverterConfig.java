package de.zeus.hems.model.device;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

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
 * PV array behind an inverter. Azimuth and tilt are informational only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SolarInverterConfig(double kwPeak,
                                  Double efficiency,
                                  Double azimuth,
                                  Double tilt) implements DeviceConfig {

    public SolarInverterConfig {
        efficiency = efficiency == null ? 0.85 : efficiency;
        azimuth = azimuth == null ? 180.0 : azimuth;
        tilt = tilt == null ? 30.0 : tilt;
    }
}
