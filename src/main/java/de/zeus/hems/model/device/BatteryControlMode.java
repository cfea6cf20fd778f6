package de.zeus.hems.model.device;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

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
 * Battery operating mode, set by external control commands and consumed by the allocator.
 */
public enum BatteryControlMode {

    AUTO("auto"),
    FORCE_CHARGE("force_charge"),
    FORCE_DISCHARGE("force_discharge"),
    IDLE("idle");

    private final String value;

    BatteryControlMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BatteryControlMode fromValue(String value) {
        if (value == null) {
            return AUTO;
        }
        for (BatteryControlMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown battery control mode: " + value);
    }
}
