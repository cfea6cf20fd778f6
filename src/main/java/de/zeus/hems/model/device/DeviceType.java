package de.zeus.hems.model.device;

import de.zeus.hems.exception.UnknownDeviceTypeException;

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
 * Device kinds known to the simulation. Each kind carries its persisted type tag and
 * the config/state record types its JSON columns decode to.
 */
public enum DeviceType {

    SOLAR_INVERTER("solarInverter", SolarInverterConfig.class, SolarInverterState.class),
    BATTERY("battery", BatteryConfig.class, BatteryState.class),
    APPLIANCE("appliance", ApplianceConfig.class, ApplianceState.class),
    METER("meter", MeterConfig.class, MeterState.class),
    HOT_WATER_STORAGE("hotWaterStorage", HotWaterStorageConfig.class, HotWaterStorageState.class),
    EV("ev", EvConfig.class, EvState.class),
    EV_CHARGER("evCharger", EvChargerConfig.class, EvChargerState.class);

    private final String tag;
    private final Class<? extends DeviceConfig> configClass;
    private final Class<? extends DeviceState> stateClass;

    DeviceType(String tag, Class<? extends DeviceConfig> configClass, Class<? extends DeviceState> stateClass) {
        this.tag = tag;
        this.configClass = configClass;
        this.stateClass = stateClass;
    }

    public String getTag() {
        return tag;
    }

    public Class<? extends DeviceConfig> getConfigClass() {
        return configClass;
    }

    public Class<? extends DeviceState> getStateClass() {
        return stateClass;
    }

    /**
     * Resolves a persisted type tag.
     *
     * @param tag The tag stored with the device, e.g. "solarInverter".
     * @return The matching device type.
     * @throws UnknownDeviceTypeException if the tag is null or not known.
     */
    public static DeviceType fromTag(String tag) {
        for (DeviceType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new UnknownDeviceTypeException(tag);
    }

    /**
     * State a freshly created device of this kind starts with.
     */
    public DeviceState initialState() {
        switch (this) {
            case SOLAR_INVERTER:
                return new SolarInverterState(0, 0, 0, true, null);
            case BATTERY:
                return new BatteryState(0.5, 0, false, true, null, BatteryControlMode.AUTO, null);
            case APPLIANCE:
                return new ApplianceState(false, 0, 0, true, null);
            case METER:
                return new MeterState(0, 0, 0, 0, 0, true, null);
            case HOT_WATER_STORAGE:
                return new HotWaterStorageState(0, 45, 55, false, true);
            case EV:
                return new EvState(0.5, false, false, 0, 0, true, null);
            case EV_CHARGER:
                return new EvChargerState(false, 0, null, 0, true, null);
            default:
                throw new UnknownDeviceTypeException(tag);
        }
    }
}
