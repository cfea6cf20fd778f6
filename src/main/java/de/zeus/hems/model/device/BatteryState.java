package de.zeus.hems.model.device;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

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
 * Battery state. {@code batteryLevel} is the state of charge (0..1), {@code powerW} is positive
 * while charging. {@code forcePowerW} is only meaningful in the force modes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatteryState(double batteryLevel,
                           double powerW,
                           @JsonProperty("isCharging") boolean charging,
                           @JsonProperty("isOnline") boolean online,
                           Double temperatureC,
                           BatteryControlMode controlMode,
                           Double forcePowerW) implements DeviceState {

    public BatteryState {
        controlMode = controlMode == null ? BatteryControlMode.AUTO : controlMode;
    }

    public BatteryState withControl(BatteryControlMode mode, Double forcePower) {
        return new BatteryState(batteryLevel, powerW, charging, online, temperatureC, mode, forcePower);
    }
}
