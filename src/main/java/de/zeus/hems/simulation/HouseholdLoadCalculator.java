package de.zeus.hems.simulation;

import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.model.device.ApplianceState;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.HotWaterStorageConfig;
import de.zeus.hems.model.device.HotWaterStorageState;
import org.springframework.stereotype.Component;

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
 * Household demand seen by the allocator: running appliances, boosting hot water tanks
 * and a fixed phantom load for everything not modelled.
 */
@Component
public class HouseholdLoadCalculator {

    private final SimulationProperties simulationProperties;

    public HouseholdLoadCalculator(SimulationProperties simulationProperties) {
        this.simulationProperties = simulationProperties;
    }

    public double calculateLoadWatts(DevicesByType devices) {
        double totalLoadW = 0;

        for (DeviceSnapshot appliance : devices.getAppliances()) {
            ApplianceState state = appliance.stateAs(ApplianceState.class);
            if (state.online() && state.on()) {
                totalLoadW += state.powerW();
            }
        }

        for (DeviceSnapshot storage : devices.getHotWaterStorages()) {
            HotWaterStorageState state = storage.stateAs(HotWaterStorageState.class);
            if (state.online() && state.boostOn()) {
                totalLoadW += storage.configAs(HotWaterStorageConfig.class).heatingPowerW();
            }
        }

        return totalLoadW + simulationProperties.getPhantomLoadWatts();
    }
}
