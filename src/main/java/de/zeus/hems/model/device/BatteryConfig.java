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
 * Stationary battery. SoC limits are fractions of {@code capacityKwh}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatteryConfig(double capacityKwh,
                            double maxChargePowerW,
                            double maxDischargePowerW,
                            Double efficiency,
                            Double minSoc,
                            Double maxSoc) implements DeviceConfig {

    public BatteryConfig {
        efficiency = efficiency == null ? 0.95 : efficiency;
        minSoc = minSoc == null ? 0.1 : minSoc;
        maxSoc = maxSoc == null ? 1.0 : maxSoc;
    }
}
