package de.zeus.hems.simulation;

import de.zeus.hems.model.EnergyFlows;
import de.zeus.hems.model.device.BatteryConfig;
import de.zeus.hems.model.device.BatteryControlMode;
import de.zeus.hems.model.device.BatteryState;
import de.zeus.hems.model.device.DeviceSnapshot;
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
 * Splits solar production and household demand into the flows between solar, battery,
 * load and grid for one cycle.
 *
 * Order of use: solar covers the load first, the battery acts according to its control mode,
 * leftover solar is exported and leftover load is covered by the battery (auto mode only)
 * and then the grid. The calculation is pure: identical inputs give identical flows.
 */
@Component
public class EnergyFlowAllocator {

    /**
     * Converts a state-of-charge headroom in kWh into a power limit in watts.
     * kWh to Wh (1000) over a quarter hour (4).
     */
    static final double HEADROOM_TO_POWER_FACTOR = 1000 * 4;

    public EnergyFlows allocate(double solarPowerW, double householdLoadW, DeviceSnapshot battery) {
        if (battery == null) {
            return allocate(solarPowerW, householdLoadW, null, null);
        }
        return allocate(solarPowerW, householdLoadW,
                battery.configAs(BatteryConfig.class), battery.stateAs(BatteryState.class));
    }

    /**
     * @param solarPowerW    Total solar production (W).
     * @param householdLoadW Total household demand (W).
     * @param config         Battery configuration, or null if the dwelling has no battery.
     * @param state          Battery state, or null if the dwelling has no battery.
     * @return The flows of this cycle; netGridPower is positive for import.
     */
    public EnergyFlows allocate(double solarPowerW, double householdLoadW, BatteryConfig config, BatteryState state) {
        double remainingSolar = Math.max(0, solarPowerW);
        double remainingLoad = Math.max(0, householdLoadW);

        double solarToBattery = 0;
        double solarToGrid = 0;
        double batteryToLoad = 0;
        double gridToLoad = 0;
        double gridToBattery = 0;
        double netGridPower = 0;
        double batteryPower = 0;

        double solarToLoad = Math.min(remainingSolar, remainingLoad);
        remainingSolar -= solarToLoad;
        remainingLoad -= solarToLoad;

        boolean batteryAvailable = config != null && state != null && state.online();

        if (batteryAvailable) {
            double soc = state.batteryLevel();
            switch (state.controlMode()) {
                case FORCE_CHARGE:
                    if (state.forcePowerW() != null && soc < config.maxSoc()) {
                        double target = Math.min(Math.min(state.forcePowerW(), config.maxChargePowerW()),
                                chargeHeadroomW(config, soc));
                        if (target > 0) {
                            if (remainingSolar >= target) {
                                solarToBattery = target;
                                remainingSolar -= target;
                            } else {
                                solarToBattery = remainingSolar;
                                gridToBattery = target - remainingSolar;
                                netGridPower += gridToBattery;
                                remainingSolar = 0;
                            }
                            batteryPower = target;
                        }
                    }
                    break;
                case FORCE_DISCHARGE:
                    if (state.forcePowerW() != null && soc > config.minSoc()) {
                        double target = Math.min(Math.min(Math.abs(state.forcePowerW()), config.maxDischargePowerW()),
                                dischargeAvailableW(config, soc));
                        if (target > 0) {
                            // Forced discharge goes to the grid, the load is still served by solar and grid
                            batteryPower = -target;
                            netGridPower -= target;
                        }
                    }
                    break;
                case IDLE:
                    batteryPower = 0;
                    break;
                case AUTO:
                default:
                    if (remainingSolar > 0 && soc < config.maxSoc()) {
                        double charge = Math.min(Math.min(remainingSolar, config.maxChargePowerW()),
                                chargeHeadroomW(config, soc));
                        if (charge > 0) {
                            solarToBattery = charge;
                            batteryPower = charge;
                            remainingSolar -= charge;
                        }
                    }
                    break;
            }
        }

        if (remainingSolar > 0) {
            solarToGrid = remainingSolar;
            netGridPower -= remainingSolar;
        }

        if (remainingLoad > 0) {
            if (batteryAvailable && state.controlMode() == BatteryControlMode.AUTO
                    && state.batteryLevel() > config.minSoc()) {
                double discharge = Math.min(Math.min(remainingLoad, config.maxDischargePowerW()),
                        dischargeAvailableW(config, state.batteryLevel()));
                if (discharge > 0) {
                    batteryToLoad = discharge;
                    batteryPower = -discharge;
                    remainingLoad -= discharge;
                }
            }
            if (remainingLoad > 0) {
                gridToLoad = remainingLoad;
                netGridPower += remainingLoad;
            }
        }

        return new EnergyFlows(solarToLoad, solarToBattery, solarToGrid, batteryToLoad,
                gridToLoad, gridToBattery, netGridPower, batteryPower);
    }

    private static double chargeHeadroomW(BatteryConfig config, double soc) {
        return config.capacityKwh() * (config.maxSoc() - soc) * HEADROOM_TO_POWER_FACTOR;
    }

    private static double dischargeAvailableW(BatteryConfig config, double soc) {
        return config.capacityKwh() * (soc - config.minSoc()) * HEADROOM_TO_POWER_FACTOR;
    }
}
