package de.zeus.hems.service;

import de.zeus.hems.exception.DeviceNotFoundException;
import de.zeus.hems.exception.InvalidControlCommandException;
import de.zeus.hems.model.ApiResponse;
import de.zeus.hems.model.ApplianceControlCommand;
import de.zeus.hems.model.BatteryControlCommand;
import de.zeus.hems.model.EvChargerControlCommand;
import de.zeus.hems.model.HotWaterControlCommand;
import de.zeus.hems.model.device.ApplianceConfig;
import de.zeus.hems.model.device.ApplianceState;
import de.zeus.hems.model.device.BatteryControlMode;
import de.zeus.hems.model.device.BatteryState;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.DeviceType;
import de.zeus.hems.model.device.EvChargerConfig;
import de.zeus.hems.model.device.EvChargerState;
import de.zeus.hems.model.device.HotWaterStorageConfig;
import de.zeus.hems.model.device.HotWaterStorageState;
import de.zeus.hems.util.EnergyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

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
 * Applies external control commands to device states. The simulation picks up the new
 * control fields on its next cycle; a command and a cycle writing the same device concurrently
 * resolve as last writer wins.
 */
@Service
public class DeviceControlService {

    private static final Logger logger = LoggerFactory.getLogger(DeviceControlService.class);

    private final DeviceService deviceService;

    public DeviceControlService(DeviceService deviceService) {
        this.deviceService = deviceService;
    }

    /**
     * Sets the battery control mode.
     *
     * @param deviceId The battery id.
     * @param command  Mode and, for forced modes, the power in watts.
     * @return An ApiResponse containing the updated device.
     */
    public ApiResponse<DeviceSnapshot> controlBattery(String deviceId, BatteryControlCommand command) {
        DeviceSnapshot device = requireDevice(deviceId, DeviceType.BATTERY);
        if (command == null || command.mode() == null) {
            throw new InvalidControlCommandException("Battery control requires a mode");
        }
        BatteryControlMode mode = command.mode();
        Double forcePower = null;
        if (mode == BatteryControlMode.FORCE_CHARGE) {
            if (command.powerW() == null || command.powerW() <= 0) {
                throw new InvalidControlCommandException("force_charge requires a positive powerW");
            }
            forcePower = command.powerW();
        } else if (mode == BatteryControlMode.FORCE_DISCHARGE) {
            if (command.powerW() == null || command.powerW() == 0) {
                throw new InvalidControlCommandException("force_discharge requires a non-zero powerW");
            }
            forcePower = command.powerW();
        }
        BatteryState state = device.stateAs(BatteryState.class).withControl(mode, forcePower);
        logger.info("Battery {} set to mode {} (power: {} W)", deviceId, mode.getValue(), forcePower);
        return ApiResponse.ok("Battery control updated", deviceService.updateState(deviceId, state));
    }

    /**
     * Switches a controllable appliance on or off.
     */
    public ApiResponse<DeviceSnapshot> controlAppliance(String deviceId, ApplianceControlCommand command) {
        DeviceSnapshot device = requireDevice(deviceId, DeviceType.APPLIANCE);
        if (command == null || command.on() == null) {
            throw new InvalidControlCommandException("Appliance control requires isOn");
        }
        ApplianceConfig config = device.configAs(ApplianceConfig.class);
        if (!config.controllable()) {
            throw new InvalidControlCommandException("Appliance " + deviceId + " is not controllable");
        }
        boolean on = command.on();
        ApplianceState current = device.stateAs(ApplianceState.class);
        ApplianceState state = new ApplianceState(on, on ? config.powerW() : 0, current.energyTodayKwh(),
                current.online(), current.countersDate());
        logger.info("Appliance {} switched {}", deviceId, on ? "on" : "off");
        return ApiResponse.ok("Appliance control updated", deviceService.updateState(deviceId, state));
    }

    /**
     * Sets hot water boost and, optionally, the target temperature clamped to the tank limits.
     */
    public ApiResponse<DeviceSnapshot> controlHotWater(String deviceId, HotWaterControlCommand command) {
        DeviceSnapshot device = requireDevice(deviceId, DeviceType.HOT_WATER_STORAGE);
        if (command == null || command.boostOn() == null) {
            throw new InvalidControlCommandException("Hot water control requires boostOn");
        }
        HotWaterStorageConfig config = device.configAs(HotWaterStorageConfig.class);
        HotWaterStorageState current = device.stateAs(HotWaterStorageState.class);
        double target = command.targetTemperatureC() != null ? command.targetTemperatureC() : current.targetTemperatureC();
        target = EnergyUtils.clamp(target, config.minTemperatureC(), config.maxTemperatureC());
        HotWaterStorageState state = current.withBoost(command.boostOn(), target);
        logger.info("Hot water storage {}: boost {} target {} °C", deviceId, command.boostOn(), target);
        return ApiResponse.ok("Hot water control updated", deviceService.updateState(deviceId, state));
    }

    /**
     * Starts or stops EV charging, optionally with a target power clamped to the charger limits.
     */
    public ApiResponse<DeviceSnapshot> controlEvCharger(String deviceId, EvChargerControlCommand command) {
        DeviceSnapshot device = requireDevice(deviceId, DeviceType.EV_CHARGER);
        if (command == null || command.charging() == null) {
            throw new InvalidControlCommandException("EV charger control requires isCharging");
        }
        EvChargerConfig config = device.configAs(EvChargerConfig.class);
        EvChargerState current = device.stateAs(EvChargerState.class);
        Double target = current.targetPowerW();
        if (command.targetPowerW() != null) {
            target = EnergyUtils.clamp(command.targetPowerW(), config.minPowerW(), config.maxPowerW());
        }
        EvChargerState state = current.withCharging(command.charging(), target);
        logger.info("EV charger {}: charging {} target {} W", deviceId, command.charging(), target);
        return ApiResponse.ok("EV charger control updated", deviceService.updateState(deviceId, state));
    }

    private DeviceSnapshot requireDevice(String deviceId, DeviceType expectedType) {
        DeviceSnapshot device = deviceService.getDevice(deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));
        if (device.deviceType() != expectedType) {
            throw new InvalidControlCommandException("Device " + deviceId + " is a " + device.deviceType().getTag()
                    + ", not a " + expectedType.getTag());
        }
        return device;
    }
}
