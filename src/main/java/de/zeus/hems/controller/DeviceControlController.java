package de.zeus.hems.controller;

import de.zeus.hems.model.ApiResponse;
import de.zeus.hems.model.ApplianceControlCommand;
import de.zeus.hems.model.BatteryControlCommand;
import de.zeus.hems.model.EvChargerControlCommand;
import de.zeus.hems.model.HotWaterControlCommand;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.service.DeviceControlService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

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

@RestController
@RequestMapping("/api/devices/{deviceId}/control")
public class DeviceControlController {

    private final DeviceControlService deviceControlService;

    public DeviceControlController(DeviceControlService deviceControlService) {
        this.deviceControlService = deviceControlService;
    }

    @PostMapping("/battery")
    public ApiResponse<DeviceSnapshot> controlBattery(@PathVariable String deviceId,
                                                      @RequestBody BatteryControlCommand command) {
        return deviceControlService.controlBattery(deviceId, command);
    }

    @PostMapping("/appliance")
    public ApiResponse<DeviceSnapshot> controlAppliance(@PathVariable String deviceId,
                                                        @RequestBody ApplianceControlCommand command) {
        return deviceControlService.controlAppliance(deviceId, command);
    }

    @PostMapping("/hot-water")
    public ApiResponse<DeviceSnapshot> controlHotWater(@PathVariable String deviceId,
                                                       @RequestBody HotWaterControlCommand command) {
        return deviceControlService.controlHotWater(deviceId, command);
    }

    @PostMapping("/ev-charger")
    public ApiResponse<DeviceSnapshot> controlEvCharger(@PathVariable String deviceId,
                                                        @RequestBody EvChargerControlCommand command) {
        return deviceControlService.controlEvCharger(deviceId, command);
    }
}
