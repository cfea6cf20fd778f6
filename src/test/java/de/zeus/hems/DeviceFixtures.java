package de.zeus.hems;

import de.zeus.hems.entity.Dwelling;
import de.zeus.hems.model.WeatherSample;
import de.zeus.hems.model.device.BatteryConfig;
import de.zeus.hems.model.device.BatteryControlMode;
import de.zeus.hems.model.device.BatteryState;
import de.zeus.hems.model.device.DeviceConfig;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.DeviceState;
import de.zeus.hems.model.device.DeviceType;

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
 * Builders for devices and dwellings shared by the unit tests.
 */
public final class DeviceFixtures {

    public static final String DWELLING_ID = "dwelling-1";
    public static final Instant NOW = Instant.parse("2026-06-21T12:00:00Z");

    private DeviceFixtures() {
    }

    public static DeviceSnapshot device(String deviceId, DeviceType type, DeviceConfig config, DeviceState state) {
        return new DeviceSnapshot(deviceId, DWELLING_ID, type, deviceId, config, state, NOW, NOW);
    }

    /**
     * 13.5 kWh, 5 kW both ways, 95 % efficiency, SoC window 0.1..1.0.
     */
    public static BatteryConfig batteryConfig() {
        return new BatteryConfig(13.5, 5000, 5000, 0.95, 0.1, 1.0);
    }

    public static BatteryState batteryState(double soc, BatteryControlMode mode, Double forcePowerW) {
        return new BatteryState(soc, 0, false, true, 20.0, mode, forcePowerW);
    }

    public static DeviceSnapshot battery(String deviceId, double soc, BatteryControlMode mode, Double forcePowerW) {
        return device(deviceId, DeviceType.BATTERY, batteryConfig(), batteryState(soc, mode, forcePowerW));
    }

    public static WeatherSample weather(double irradiance, double temperatureC, double cloudCover) {
        return new WeatherSample(irradiance, temperatureC, cloudCover, NOW, false);
    }

    public static Dwelling dwelling(String dwellingId, String timeZone) {
        Dwelling dwelling = new Dwelling();
        dwelling.setDwellingId(dwellingId);
        dwelling.setUserId("user-1");
        dwelling.setTimeZone(timeZone);
        dwelling.setLatitude(52.52);
        dwelling.setLongitude(13.405);
        return dwelling;
    }
}
