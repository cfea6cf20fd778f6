package de.zeus.hems.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeus.hems.entity.Device;
import de.zeus.hems.exception.DeviceStoreException;
import de.zeus.hems.exception.UnknownDeviceTypeException;
import de.zeus.hems.model.device.BatteryConfig;
import de.zeus.hems.model.device.BatteryControlMode;
import de.zeus.hems.model.device.BatteryState;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.DeviceType;
import de.zeus.hems.model.device.HotWaterStorageState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

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

class DeviceCodecTest {

    private final DeviceCodec codec = new DeviceCodec(new ObjectMapper());

    @Test
    void toSnapshot_decodesTypedConfigAndStateWithDefaults() {
        Device device = device("battery",
                "{\"capacityKwh\":10,\"maxChargePowerW\":3000,\"maxDischargePowerW\":4000,\"vendor\":\"acme\"}",
                "{\"batteryLevel\":0.8,\"powerW\":-250,\"isCharging\":false,\"isOnline\":true,"
                        + "\"controlMode\":\"force_discharge\",\"forcePowerW\":-2000}");

        DeviceSnapshot snapshot = codec.toSnapshot(device);

        assertEquals(DeviceType.BATTERY, snapshot.deviceType());
        BatteryConfig config = snapshot.configAs(BatteryConfig.class);
        assertEquals(10, config.capacityKwh());
        assertEquals(0.95, config.efficiency(), "Missing efficiency falls back to the default");
        assertEquals(0.1, config.minSoc());
        assertEquals(1.0, config.maxSoc());
        BatteryState state = snapshot.stateAs(BatteryState.class);
        assertEquals(0.8, state.batteryLevel());
        assertEquals(BatteryControlMode.FORCE_DISCHARGE, state.controlMode());
        assertEquals(-2000.0, state.forcePowerW());
        assertTrue(snapshot.isOnline());
    }

    @Test
    void toSnapshot_withoutState_usesInitialStateOfType() {
        Device device = device("hotWaterStorage",
                "{\"tankCapacityL\":200,\"heatingPowerW\":2000,\"minTemperatureC\":35,\"maxTemperatureC\":65,"
                        + "\"standbyLossPerHourC\":1.2}",
                null);

        HotWaterStorageState state = codec.toSnapshot(device).stateAs(HotWaterStorageState.class);

        assertEquals(45, state.waterTemperatureC());
        assertEquals(55, state.targetTemperatureC());
        assertFalse(state.boostOn());
        assertTrue(state.online());
    }

    @Test
    void toSnapshot_unknownType_isRejected() {
        UnknownDeviceTypeException ex = assertThrows(UnknownDeviceTypeException.class,
                () -> codec.toSnapshot(device("heatPump", "{}", "{}")));

        assertEquals("heatPump", ex.getDeviceType());
    }

    @Test
    void toSnapshot_brokenJson_isReportedAsStoreFailure() {
        assertThrows(DeviceStoreException.class, () -> codec.toSnapshot(device("battery", "{}", "{not json")));
    }

    @Test
    void writeState_usesPersistedFieldNames() {
        String json = codec.writeState(new BatteryState(0.5, 1200, true, true, null, BatteryControlMode.AUTO, null));

        assertTrue(json.contains("\"isCharging\":true"), json);
        assertTrue(json.contains("\"isOnline\":true"), json);
        assertTrue(json.contains("\"controlMode\":\"auto\""), json);
        assertFalse(json.contains("forcePowerW"), "Unset optional fields are omitted");
    }

    private static Device device(String type, String config, String state) {
        Device device = new Device();
        device.setDeviceId("dev-1");
        device.setDwellingId("dwelling-1");
        device.setDeviceType(type);
        device.setName("Device");
        device.setConfigJson(config);
        device.setStateJson(state);
        device.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        device.setUpdatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        return device;
    }
}
