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
 * Simulation tunables. All values are read once at startup.
 */
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {

    /**
     * Cycle interval (ms). Also the time step used for all energy and thermal integration.
     */
    private long intervalMs = 30_000;

    /**
     * Baseline household consumption not attributed to any modelled appliance (W).
     */
    private double phantomLoadWatts = 200;

    /**
     * Max number of concurrent weather requests per batch.
     */
    private int weatherBatchSize = 3;

    /**
     * Chance per cycle that a non-controllable appliance flips its on/off state.
     */
    private double applianceToggleProbability = 0.05;

    /**
     * Battery temperature is reported as ambient +/- this value (°C).
     */
    private double batteryTemperatureJitterC = 2.0;

    /**
     * Seed for the simulation random source. Unset = different sequence on every start.
     */
    private Long randomSeed;

    /**
     * Restart "today" counters when the dwelling's local date changes.
     */
    private boolean dailyResetEnabled = true;

    /**
     * Start the scheduler once the application is ready.
     */
    private boolean autoStart = true;

    /**
     * Fail the whole dwelling on an unknown device type instead of skipping the device.
     */
    private boolean strictDeviceTypes = false;

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public double getIntervalSeconds() {
        return intervalMs / 1000.0;
    }

    public double getPhantomLoadWatts() {
        return phantomLoadWatts;
    }

    public void setPhantomLoadWatts(double phantomLoadWatts) {
        this.phantomLoadWatts = phantomLoadWatts;
    }

    public int getWeatherBatchSize() {
        return weatherBatchSize;
    }

    public void setWeatherBatchSize(int weatherBatchSize) {
        this.weatherBatchSize = weatherBatchSize;
    }

    public double getApplianceToggleProbability() {
        return applianceToggleProbability;
    }

    public void setApplianceToggleProbability(double applianceToggleProbability) {
        this.applianceToggleProbability = applianceToggleProbability;
    }

    public double getBatteryTemperatureJitterC() {
        return batteryTemperatureJitterC;
    }

    public void setBatteryTemperatureJitterC(double batteryTemperatureJitterC) {
        this.batteryTemperatureJitterC = batteryTemperatureJitterC;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public boolean isDailyResetEnabled() {
        return dailyResetEnabled;
    }

    public void setDailyResetEnabled(boolean dailyResetEnabled) {
        this.dailyResetEnabled = dailyResetEnabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isStrictDeviceTypes() {
        return strictDeviceTypes;
    }

    public void setStrictDeviceTypes(boolean strictDeviceTypes) {
        this.strictDeviceTypes = strictDeviceTypes;
    }
}
