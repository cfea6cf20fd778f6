package de.zeus.hems.simulation;

import de.zeus.hems.model.device.DeviceSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

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
 * A dwelling's devices split by kind, each list in store order.
 */
public class DevicesByType {

    private final List<DeviceSnapshot> solarInverters = new ArrayList<>();
    private final List<DeviceSnapshot> batteries = new ArrayList<>();
    private final List<DeviceSnapshot> appliances = new ArrayList<>();
    private final List<DeviceSnapshot> meters = new ArrayList<>();
    private final List<DeviceSnapshot> hotWaterStorages = new ArrayList<>();
    private final List<DeviceSnapshot> evs = new ArrayList<>();
    private final List<DeviceSnapshot> evChargers = new ArrayList<>();

    public static DevicesByType group(List<DeviceSnapshot> devices) {
        DevicesByType grouped = new DevicesByType();
        for (DeviceSnapshot device : devices) {
            switch (device.deviceType()) {
                case SOLAR_INVERTER:
                    grouped.solarInverters.add(device);
                    break;
                case BATTERY:
                    grouped.batteries.add(device);
                    break;
                case APPLIANCE:
                    grouped.appliances.add(device);
                    break;
                case METER:
                    grouped.meters.add(device);
                    break;
                case HOT_WATER_STORAGE:
                    grouped.hotWaterStorages.add(device);
                    break;
                case EV:
                    grouped.evs.add(device);
                    break;
                case EV_CHARGER:
                    grouped.evChargers.add(device);
                    break;
                default:
                    throw new IllegalStateException("Unhandled device type " + device.deviceType());
            }
        }
        return grouped;
    }

    /**
     * The battery the allocator works with: the first one found. Others are left untouched.
     */
    public Optional<DeviceSnapshot> primaryBattery() {
        return batteries.isEmpty() ? Optional.empty() : Optional.of(batteries.get(0));
    }

    /**
     * The meter that records grid exchange: the first one found.
     */
    public Optional<DeviceSnapshot> primaryMeter() {
        return meters.isEmpty() ? Optional.empty() : Optional.of(meters.get(0));
    }

    public List<DeviceSnapshot> getSolarInverters() {
        return Collections.unmodifiableList(solarInverters);
    }

    public List<DeviceSnapshot> getBatteries() {
        return Collections.unmodifiableList(batteries);
    }

    public List<DeviceSnapshot> getAppliances() {
        return Collections.unmodifiableList(appliances);
    }

    public List<DeviceSnapshot> getMeters() {
        return Collections.unmodifiableList(meters);
    }

    public List<DeviceSnapshot> getHotWaterStorages() {
        return Collections.unmodifiableList(hotWaterStorages);
    }

    public List<DeviceSnapshot> getEvs() {
        return Collections.unmodifiableList(evs);
    }

    public List<DeviceSnapshot> getEvChargers() {
        return Collections.unmodifiableList(evChargers);
    }
}
