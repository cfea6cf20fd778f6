package de.zeus.hems.simulation;

import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.exception.DeviceStoreException;
import de.zeus.hems.model.DeviceStateUpdate;
import de.zeus.hems.model.DwellingUpdate;
import de.zeus.hems.model.WeatherSample;
import de.zeus.hems.model.device.ApplianceConfig;
import de.zeus.hems.model.device.ApplianceState;
import de.zeus.hems.model.device.BatteryControlMode;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.DeviceType;
import de.zeus.hems.model.device.MeterConfig;
import de.zeus.hems.model.device.MeterState;
import de.zeus.hems.model.device.SolarInverterConfig;
import de.zeus.hems.model.device.SolarInverterState;
import de.zeus.hems.service.DeviceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static de.zeus.hems.DeviceFixtures.DWELLING_ID;
import static de.zeus.hems.DeviceFixtures.battery;
import static de.zeus.hems.DeviceFixtures.device;
import static de.zeus.hems.DeviceFixtures.dwelling;
import static de.zeus.hems.DeviceFixtures.weather;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
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

class DwellingSimulatorTest {

    private static final Instant NOW = Instant.parse("2026-06-21T22:30:00Z");

    private DeviceService deviceService;
    private DwellingSimulator simulator;

    @BeforeEach
    void setUp() {
        deviceService = mock(DeviceService.class);
        SimulationProperties properties = new SimulationProperties();
        properties.setApplianceToggleProbability(0);

        simulator = new DwellingSimulator(
                deviceService,
                new EnergyFlowAllocator(),
                new HouseholdLoadCalculator(properties),
                new DeviceStateUpdater(properties, new Random(7)),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void simulate_noDevices_producesNoUpdate() {
        when(deviceService.getDevicesForDwelling(DWELLING_ID)).thenReturn(Collections.emptyList());

        Optional<DwellingUpdate> update = simulator.simulate(dwelling(DWELLING_ID, "UTC"), weather(800, 20, 0));

        assertTrue(update.isEmpty());
        verify(deviceService, never()).batchUpdateState(anyList());
    }

    @Test
    void simulate_writesAllStatesInOneBatchAndPublishesReloadedDevices() {
        List<DeviceSnapshot> devices = householdDevices();
        List<DeviceSnapshot> reloaded = List.of(devices.get(0));
        when(deviceService.getDevicesForDwelling(DWELLING_ID)).thenReturn(devices, reloaded);
        WeatherSample weather = weather(1000, 25, 0);

        DwellingUpdate update = simulator.simulate(dwelling(DWELLING_ID, "UTC"), weather).orElseThrow();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeviceStateUpdate>> captor = ArgumentCaptor.forClass(List.class);
        verify(deviceService, times(1)).batchUpdateState(captor.capture());
        assertEquals(4, captor.getValue().size(), "Inverter, battery, meter and appliance are advanced");

        // 5 kW solar, 150 W appliance + 200 W phantom load, the rest charges the battery
        assertEquals(350, update.energyFlows().solarToLoad(), 1e-6);
        assertEquals(4650, update.energyFlows().solarToBattery(), 1e-6);
        assertEquals(0, update.energyFlows().netGridPower(), 1e-6);
        assertSame(reloaded, update.devices());
        assertSame(weather, update.weatherData());
        assertEquals(NOW, update.timestamp());
        assertEquals(DWELLING_ID, update.dwellingId());
    }

    @Test
    void simulate_usesDwellingLocalDateForCounters() {
        when(deviceService.getDevicesForDwelling(DWELLING_ID)).thenReturn(householdDevices());

        simulator.simulate(dwelling(DWELLING_ID, "Europe/Berlin"), weather(0, 15, 0));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeviceStateUpdate>> captor = ArgumentCaptor.forClass(List.class);
        verify(deviceService).batchUpdateState(captor.capture());
        ApplianceState appliance = (ApplianceState) captor.getValue().stream()
                .filter(u -> u.deviceId().equals("washer"))
                .findFirst().orElseThrow().state();
        assertEquals("2026-06-22", appliance.countersDate(), "22:30 UTC is already the next day in Berlin");
    }

    @Test
    void simulate_batchWriteFails_propagatesAndSkipsReload() {
        when(deviceService.getDevicesForDwelling(DWELLING_ID)).thenReturn(householdDevices());
        doThrow(new DeviceStoreException("disk full")).when(deviceService).batchUpdateState(anyList());

        assertThrows(DeviceStoreException.class,
                () -> simulator.simulate(dwelling(DWELLING_ID, "UTC"), weather(500, 20, 0)));
        verify(deviceService, times(1)).getDevicesForDwelling(DWELLING_ID);
    }

    private static List<DeviceSnapshot> householdDevices() {
        return List.of(
                device("pv-1", DeviceType.SOLAR_INVERTER, new SolarInverterConfig(5, 1.0, null, null),
                        new SolarInverterState(0, 0, 0, true, null)),
                battery("bat-1", 0.5, BatteryControlMode.AUTO, null),
                device("meter-1", DeviceType.METER, new MeterConfig(null), new MeterState(0, 0, 0, 0, 0, true, null)),
                device("washer", DeviceType.APPLIANCE, new ApplianceConfig("Washer", 150, true),
                        new ApplianceState(true, 150, 0, true, null)));
    }
}
