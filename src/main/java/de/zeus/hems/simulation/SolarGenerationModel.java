package de.zeus.hems.simulation;

import de.zeus.hems.model.WeatherSample;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.SolarInverterConfig;

import java.util.List;

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
 * Instantaneous PV output from weather and panel parameters.
 */
public final class SolarGenerationModel {

    // Standard Test Conditions irradiance (W/m²)
    private static final double STANDARD_IRRADIANCE_WM2 = 1000.0;
    // Power temperature coefficient of crystalline silicon (1/°C) and its reference temperature
    private static final double TEMPERATURE_COEFFICIENT = -0.004;
    private static final double REFERENCE_TEMPERATURE_C = 25.0;
    // Share of irradiance lost at 100 % cloud cover
    private static final double MAX_CLOUD_DERATE = 0.8;

    private SolarGenerationModel() {
    }

    /**
     * @param irradianceWm2 Global irradiance (W/m²); zero or less yields zero output.
     * @param kwPeak        Installed peak capacity (kW).
     * @param efficiency    System efficiency (0..1).
     * @param temperatureC  Ambient temperature (°C).
     * @param cloudCover    Cloud cover (0..100 %).
     * @return Output power in watts, never negative.
     */
    public static double powerWatts(double irradianceWm2, double kwPeak, double efficiency,
                                    double temperatureC, double cloudCover) {
        if (irradianceWm2 <= 0) {
            return 0;
        }
        double effectiveIrradiance = irradianceWm2 * (1 - cloudCover / 100.0 * MAX_CLOUD_DERATE);
        double temperatureFactor = 1 + TEMPERATURE_COEFFICIENT * (temperatureC - REFERENCE_TEMPERATURE_C);
        double powerKw = kwPeak * (effectiveIrradiance / STANDARD_IRRADIANCE_WM2) * efficiency * temperatureFactor;
        return Math.max(0, powerKw * 1000);
    }

    public static double powerWatts(SolarInverterConfig config, WeatherSample weather) {
        return powerWatts(weather.solarIrradianceWm2(), config.kwPeak(), config.efficiency(),
                weather.temperatureC(), weather.cloudCover());
    }

    /**
     * Sum over all online inverters.
     */
    public static double totalPowerWatts(List<DeviceSnapshot> inverters, WeatherSample weather) {
        double total = 0;
        for (DeviceSnapshot inverter : inverters) {
            if (inverter.isOnline()) {
                total += powerWatts(inverter.configAs(SolarInverterConfig.class), weather);
            }
        }
        return total;
    }
}
