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
import de.zeus.hems.model.device.DeviceState;
import de.zeus.hems.model.device.DeviceType;
import de.zeus.hems.model.device.EvChargerConfig;
import de.zeus.hems.model.device.EvChargerState;
import de.zeus.hems.model.device.HotWaterStorageConfig;
import de.zeus.hems.model.device.HotWaterStorageState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;

import java.util.Optional;

import static de.zeus.hems.DeviceFixtures.battery;
import static de.zeus.hems.DeviceFixtures.device;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

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

class DeviceControlServiceTest {

    private DeviceService deviceService;
    private DeviceControlService service;

    @BeforeEach
    void setUp() {
        deviceService = mock(DeviceService.class);
        service = new DeviceControlService(deviceService);
        when(deviceService.updateState(anyString(), any(DeviceState.class))).thenAnswer(invocation ->
                device(invocation.getArgument(0), DeviceType.BATTERY, null, invocation.getArgument(1)));
    }

    @Test
    void controlBattery_forceCharge_storesModeAndPower() {
        givenDevice(battery("bat-1", 0.4, BatteryControlMode.AUTO, null));

        ApiResponse<DeviceSnapshot> response = service.controlBattery("bat-1",
                new BatteryControlCommand(BatteryControlMode.FORCE_CHARGE, 3000.0));

        assertTrue(response.success());
        assertEquals(HttpStatus.OK, response.statusCode());
        BatteryState stored = (BatteryState) capturedState("bat-1");
        assertEquals(BatteryControlMode.FORCE_CHARGE, stored.controlMode());
        assertEquals(3000.0, stored.forcePowerW());
        assertEquals(0.4, stored.batteryLevel(), "Simulated fields are left alone");
    }

    @Test
    void controlBattery_backToAuto_clearsForcePower() {
        givenDevice(battery("bat-1", 0.4, BatteryControlMode.FORCE_DISCHARGE, -2000.0));

        service.controlBattery("bat-1", new BatteryControlCommand(BatteryControlMode.AUTO, 1500.0));

        BatteryState stored = (BatteryState) capturedState("bat-1");
        assertEquals(BatteryControlMode.AUTO, stored.controlMode());
        assertNull(stored.forcePowerW());
    }

    @Test
    void controlBattery_forceModeWithoutPower_isRejected() {
        givenDevice(battery("bat-1", 0.4, BatteryControlMode.AUTO, null));

        assertThrows(InvalidControlCommandException.class, () -> service.controlBattery("bat-1",
                new BatteryControlCommand(BatteryControlMode.FORCE_CHARGE, null)));
        assertThrows(InvalidControlCommandException.class, () -> service.controlBattery("bat-1",
                new BatteryControlCommand(BatteryControlMode.FORCE_CHARGE, -100.0)));
        assertThrows(InvalidControlCommandException.class, () -> service.controlBattery("bat-1",
                new BatteryControlCommand(BatteryControlMode.FORCE_DISCHARGE, 0.0)));
        verify(deviceService, never()).updateState(anyString(), any());
    }

    @Test
    void controlAppliance_controllable_switchesPower() {
        givenDevice(device("washer", DeviceType.APPLIANCE, new ApplianceConfig("Washer", 2000, true),
                new ApplianceState(false, 0, 1.5, true, "2026-06-21")));

        service.controlAppliance("washer", new ApplianceControlCommand(true));

        ApplianceState stored = (ApplianceState) capturedState("washer");
        assertTrue(stored.on());
        assertEquals(2000, stored.powerW());
        assertEquals(1.5, stored.energyTodayKwh());
    }

    @Test
    void controlAppliance_notControllable_isRejected() {
        givenDevice(device("fridge", DeviceType.APPLIANCE, new ApplianceConfig("Fridge", 150, false),
                new ApplianceState(true, 150, 0, true, null)));

        assertThrows(InvalidControlCommandException.class,
                () -> service.controlAppliance("fridge", new ApplianceControlCommand(false)));
    }

    @Test
    void controlHotWater_clampsTargetTemperature() {
        givenDevice(device("hws-1", DeviceType.HOT_WATER_STORAGE, new HotWaterStorageConfig(200, 2000, 35, 65, 1.2),
                new HotWaterStorageState(0, 45, 55, false, true)));

        service.controlHotWater("hws-1", new HotWaterControlCommand(true, 80.0));

        HotWaterStorageState stored = (HotWaterStorageState) capturedState("hws-1");
        assertTrue(stored.boostOn());
        assertEquals(65, stored.targetTemperatureC());
        assertEquals(45, stored.waterTemperatureC());
    }

    @Test
    void controlEvCharger_clampsTargetPower() {
        givenDevice(device("wb-1", DeviceType.EV_CHARGER, new EvChargerConfig(11000, 1400, null),
                new EvChargerState(false, 0, null, 0, true, null)));

        service.controlEvCharger("wb-1", new EvChargerControlCommand(true, 500.0));

        EvChargerState stored = (EvChargerState) capturedState("wb-1");
        assertTrue(stored.charging());
        assertEquals(1400.0, stored.targetPowerW());
    }

    @Test
    void control_wrongDeviceType_isRejected() {
        givenDevice(battery("bat-1", 0.5, BatteryControlMode.AUTO, null));

        assertThrows(InvalidControlCommandException.class,
                () -> service.controlEvCharger("bat-1", new EvChargerControlCommand(true, null)));
    }

    @Test
    void control_unknownDevice_throwsNotFound() {
        when(deviceService.getDevice("nope")).thenReturn(Optional.empty());

        assertThrows(DeviceNotFoundException.class,
                () -> service.controlAppliance("nope", new ApplianceControlCommand(true)));
    }

    private void givenDevice(DeviceSnapshot device) {
        when(deviceService.getDevice(device.deviceId())).thenReturn(Optional.of(device));
    }

    private DeviceState capturedState(String deviceId) {
        ArgumentCaptor<DeviceState> captor = ArgumentCaptor.forClass(DeviceState.class);
        verify(deviceService).updateState(eq(deviceId), captor.capture());
        return captor.getValue();
    }
}
