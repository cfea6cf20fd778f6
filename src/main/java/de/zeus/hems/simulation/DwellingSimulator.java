package de.zeus.hems.simulation;

import de.zeus.hems.config.LogFilter;
import de.zeus.hems.entity.Dwelling;
import de.zeus.hems.model.DeviceStateUpdate;
import de.zeus.hems.model.DwellingUpdate;
import de.zeus.hems.model.EnergyFlows;
import de.zeus.hems.model.WeatherSample;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.service.DeviceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
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
 * Runs one simulation step for a single dwelling: read devices, allocate flows,
 * write the new states in one batch and read them back for publishing.
 */
@Component
public class DwellingSimulator {

    private static final Logger logger = LoggerFactory.getLogger(DwellingSimulator.class);

    private final DeviceService deviceService;
    private final EnergyFlowAllocator energyFlowAllocator;
    private final HouseholdLoadCalculator householdLoadCalculator;
    private final DeviceStateUpdater deviceStateUpdater;
    private final Clock clock;

    public DwellingSimulator(DeviceService deviceService,
                             EnergyFlowAllocator energyFlowAllocator,
                             HouseholdLoadCalculator householdLoadCalculator,
                             DeviceStateUpdater deviceStateUpdater,
                             Clock clock) {
        this.deviceService = deviceService;
        this.energyFlowAllocator = energyFlowAllocator;
        this.householdLoadCalculator = householdLoadCalculator;
        this.deviceStateUpdater = deviceStateUpdater;
        this.clock = clock;
    }

    /**
     * Simulates one cycle for the dwelling.
     *
     * @param dwelling The dwelling to simulate.
     * @param weather  Current weather at the dwelling.
     * @return The update to publish, or empty if the dwelling has no usable devices.
     * @throws de.zeus.hems.exception.DeviceStoreException if the state batch could not be written.
     */
    public Optional<DwellingUpdate> simulate(Dwelling dwelling, WeatherSample weather) {
        String dwellingId = dwelling.getDwellingId();
        List<DeviceSnapshot> devices = deviceService.getDevicesForDwelling(dwellingId);
        if (devices.isEmpty()) {
            logger.debug("Dwelling {} has no devices, nothing to simulate.", dwellingId);
            return Optional.empty();
        }

        DevicesByType grouped = DevicesByType.group(devices);
        warnAboutIgnoredDevices(dwellingId, grouped);

        double solarPowerW = SolarGenerationModel.totalPowerWatts(grouped.getSolarInverters(), weather);
        double loadW = householdLoadCalculator.calculateLoadWatts(grouped);
        EnergyFlows flows = energyFlowAllocator.allocate(solarPowerW, loadW, grouped.primaryBattery().orElse(null));

        LocalDate localDate = LocalDate.now(clock.withZone(dwelling.getZoneId()));
        List<DeviceStateUpdate> updates = deviceStateUpdater.update(grouped, flows, weather, localDate);
        deviceService.batchUpdateState(updates);

        logger.debug("Dwelling {}: solar={} W, load={} W, grid={} W, battery={} W",
                dwellingId, Math.round(solarPowerW), Math.round(loadW),
                Math.round(flows.netGridPower()), Math.round(flows.batteryPower()));

        return Optional.of(new DwellingUpdate(dwellingId, deviceService.getDevicesForDwelling(dwellingId),
                flows, clock.instant(), weather));
    }

    private void warnAboutIgnoredDevices(String dwellingId, DevicesByType grouped) {
        if (grouped.getBatteries().size() > 1) {
            LogFilter.logWarn(DwellingSimulator.class,
                    "Dwelling {} has {} batteries. Only {} takes part in the simulation.",
                    dwellingId, grouped.getBatteries().size(), grouped.getBatteries().get(0).deviceId());
        }
        if (grouped.getMeters().size() > 1) {
            LogFilter.logWarn(DwellingSimulator.class,
                    "Dwelling {} has {} meters. Only {} records grid exchange.",
                    dwellingId, grouped.getMeters().size(), grouped.getMeters().get(0).deviceId());
        }
    }
}
