package de.zeus.hems.simulation;

import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.model.DeviceStateUpdate;
import de.zeus.hems.model.EnergyFlows;
import de.zeus.hems.model.WeatherSample;
import de.zeus.hems.model.device.ApplianceConfig;
import de.zeus.hems.model.device.ApplianceState;
import de.zeus.hems.model.device.BatteryConfig;
import de.zeus.hems.model.device.BatteryState;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.EvChargerConfig;
import de.zeus.hems.model.device.EvChargerState;
import de.zeus.hems.model.device.EvConfig;
import de.zeus.hems.model.device.EvState;
import de.zeus.hems.model.device.HotWaterStorageConfig;
import de.zeus.hems.model.device.HotWaterStorageState;
import de.zeus.hems.model.device.MeterState;
import de.zeus.hems.model.device.SolarInverterConfig;
import de.zeus.hems.model.device.SolarInverterState;
import de.zeus.hems.util.EnergyUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static de.zeus.hems.util.EnergyUtils.energyIncrementKwh;

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
 * Advances every device of a dwelling by one cycle given the allocated energy flows.
 * Produces the new states only; persisting them is up to the caller.
 */
@Component
public class DeviceStateUpdater {

    // Specific heat capacity of water (J/(kg·°C)); 1 L of water is taken as 1 kg
    static final double WATER_SPECIFIC_HEAT = 4186;

    private final SimulationProperties simulationProperties;
    private final Random random;

    public DeviceStateUpdater(SimulationProperties simulationProperties,
                              @Qualifier("simulationRandom") Random random) {
        this.simulationProperties = simulationProperties;
        this.random = random;
    }

    /**
     * Computes the next state of all devices.
     *
     * @param devices   The dwelling's devices grouped by kind.
     * @param flows     Flows allocated for this cycle.
     * @param weather   Weather used for solar output and battery temperature.
     * @param localDate The dwelling's local date, used to restart daily counters.
     * @return One update per device that was advanced. Batteries and meters beyond the first are not included.
     */
    public List<DeviceStateUpdate> update(DevicesByType devices, EnergyFlows flows,
                                          WeatherSample weather, LocalDate localDate) {
        double seconds = simulationProperties.getIntervalSeconds();
        List<DeviceStateUpdate> updates = new ArrayList<>();

        for (DeviceSnapshot inverter : devices.getSolarInverters()) {
            updates.add(new DeviceStateUpdate(inverter.deviceId(), updateSolarInverter(inverter, weather, seconds, localDate)));
        }
        devices.primaryBattery().ifPresent(battery ->
                updates.add(new DeviceStateUpdate(battery.deviceId(), updateBattery(battery, flows, weather, seconds))));
        devices.primaryMeter().ifPresent(meter ->
                updates.add(new DeviceStateUpdate(meter.deviceId(), updateMeter(meter.stateAs(MeterState.class), flows, seconds, localDate))));
        for (DeviceSnapshot appliance : devices.getAppliances()) {
            updates.add(new DeviceStateUpdate(appliance.deviceId(), updateAppliance(appliance, seconds, localDate)));
        }
        for (DeviceSnapshot storage : devices.getHotWaterStorages()) {
            updates.add(new DeviceStateUpdate(storage.deviceId(), updateHotWaterStorage(storage, seconds)));
        }
        for (DeviceSnapshot charger : devices.getEvChargers()) {
            updates.add(new DeviceStateUpdate(charger.deviceId(), updateEvCharger(charger, seconds, localDate)));
        }
        for (DeviceSnapshot ev : devices.getEvs()) {
            updates.add(new DeviceStateUpdate(ev.deviceId(), updateEv(ev, seconds, localDate)));
        }
        return updates;
    }

    SolarInverterState updateSolarInverter(DeviceSnapshot inverter, WeatherSample weather,
                                           double seconds, LocalDate localDate) {
        SolarInverterState current = inverter.stateAs(SolarInverterState.class);
        if (!current.online()) {
            return new SolarInverterState(0, current.energyTodayKwh(), current.totalEnergyKwh(), false, current.countersDate());
        }
        double powerW = SolarGenerationModel.powerWatts(inverter.configAs(SolarInverterConfig.class), weather);
        double increment = energyIncrementKwh(powerW, seconds);
        return new SolarInverterState(
                Math.round(powerW),
                todayCounter(current.energyTodayKwh(), current.countersDate(), localDate) + increment,
                current.totalEnergyKwh() + increment,
                true,
                localDate.toString());
    }

    BatteryState updateBattery(DeviceSnapshot battery, EnergyFlows flows, WeatherSample weather, double seconds) {
        BatteryConfig config = battery.configAs(BatteryConfig.class);
        BatteryState current = battery.stateAs(BatteryState.class);
        if (!current.online()) {
            return new BatteryState(current.batteryLevel(), 0, false, false,
                    current.temperatureC(), current.controlMode(), current.forcePowerW());
        }
        double energyChangeKwh = energyIncrementKwh(flows.batteryPower(), seconds);
        double level = current.batteryLevel() + energyChangeKwh / config.capacityKwh() * config.efficiency();
        level = EnergyUtils.clamp(EnergyUtils.round(level, 3), config.minSoc(), config.maxSoc());

        double jitter = simulationProperties.getBatteryTemperatureJitterC();
        double temperature = weather.temperatureC() + (random.nextDouble() * 2 - 1) * jitter;

        return new BatteryState(
                level,
                Math.round(flows.batteryPower()),
                flows.batteryPower() > 0,
                true,
                temperature,
                current.controlMode(),
                current.forcePowerW());
    }

    MeterState updateMeter(MeterState current, EnergyFlows flows, double seconds, LocalDate localDate) {
        if (!current.online()) {
            return new MeterState(0, current.energyImportTodayKwh(), current.energyExportTodayKwh(),
                    current.totalEnergyImportKwh(), current.totalEnergyExportKwh(), false, current.countersDate());
        }
        double net = flows.netGridPower();
        double imported = net > 0 ? energyIncrementKwh(net, seconds) : 0;
        double exported = net < 0 ? energyIncrementKwh(-net, seconds) : 0;
        return new MeterState(
                Math.round(net),
                todayCounter(current.energyImportTodayKwh(), current.countersDate(), localDate) + imported,
                todayCounter(current.energyExportTodayKwh(), current.countersDate(), localDate) + exported,
                current.totalEnergyImportKwh() + imported,
                current.totalEnergyExportKwh() + exported,
                true,
                localDate.toString());
    }

    ApplianceState updateAppliance(DeviceSnapshot appliance, double seconds, LocalDate localDate) {
        ApplianceConfig config = appliance.configAs(ApplianceConfig.class);
        ApplianceState current = appliance.stateAs(ApplianceState.class);
        if (!current.online()) {
            return new ApplianceState(current.on(), 0, current.energyTodayKwh(), false, current.countersDate());
        }
        boolean on = current.on();
        // Controllable appliances only change on command
        if (!config.controllable() && random.nextDouble() < simulationProperties.getApplianceToggleProbability()) {
            on = !on;
        }
        double powerW = on ? config.powerW() : 0;
        double today = todayCounter(current.energyTodayKwh(), current.countersDate(), localDate);
        if (on) {
            today += energyIncrementKwh(powerW, seconds);
        }
        return new ApplianceState(on, powerW, today, true, localDate.toString());
    }

    HotWaterStorageState updateHotWaterStorage(DeviceSnapshot storage, double seconds) {
        HotWaterStorageConfig config = storage.configAs(HotWaterStorageConfig.class);
        HotWaterStorageState current = storage.stateAs(HotWaterStorageState.class);
        if (!current.online()) {
            return new HotWaterStorageState(0, current.waterTemperatureC(), current.targetTemperatureC(),
                    current.boostOn(), false);
        }
        double temperature = current.waterTemperatureC();
        double power = 0;

        if (current.boostOn()) {
            if (current.targetTemperatureC() - temperature > 0) {
                power = config.heatingPowerW();
                temperature += power * seconds / (config.tankCapacityL() * WATER_SPECIFIC_HEAT);
            }
        } else {
            temperature -= config.standbyLossPerHourC() / EnergyUtils.SECONDS_PER_HOUR * seconds;
        }

        double clampedTarget = EnergyUtils.clamp(current.targetTemperatureC(), config.minTemperatureC(), config.maxTemperatureC());
        temperature = Math.min(clampedTarget, temperature);
        temperature = EnergyUtils.clamp(temperature, config.minTemperatureC(), config.maxTemperatureC());

        return new HotWaterStorageState(power, temperature, clampedTarget, current.boostOn(), true);
    }

    EvChargerState updateEvCharger(DeviceSnapshot charger, double seconds, LocalDate localDate) {
        EvChargerConfig config = charger.configAs(EvChargerConfig.class);
        EvChargerState current = charger.stateAs(EvChargerState.class);
        if (!current.online()) {
            return new EvChargerState(current.charging(), 0, current.targetPowerW(), current.energyTodayKwh(),
                    false, current.countersDate());
        }
        double today = todayCounter(current.energyTodayKwh(), current.countersDate(), localDate);
        double powerW = 0;
        if (current.charging()) {
            double requested = current.targetPowerW() != null ? current.targetPowerW() : config.maxPowerW();
            powerW = EnergyUtils.clamp(requested, config.minPowerW(), config.maxPowerW());
            today += energyIncrementKwh(powerW, seconds);
        }
        return new EvChargerState(current.charging(), powerW, current.targetPowerW(), today, true, localDate.toString());
    }

    EvState updateEv(DeviceSnapshot ev, double seconds, LocalDate localDate) {
        EvConfig config = ev.configAs(EvConfig.class);
        EvState current = ev.stateAs(EvState.class);
        if (!current.online()) {
            return new EvState(current.batteryLevel(), current.pluggedIn(), current.charging(), 0,
                    current.energyTodayKwh(), false, current.countersDate());
        }
        double today = todayCounter(current.energyTodayKwh(), current.countersDate(), localDate);
        double level = current.batteryLevel();
        boolean charging = current.charging() && current.pluggedIn();
        double powerW = 0;
        if (charging && level < 1.0) {
            powerW = config.maxChargePowerW();
            double increment = energyIncrementKwh(powerW, seconds);
            level = Math.min(1.0, level + increment / config.batteryCapacityKwh() * config.efficiency());
            today += increment;
        }
        if (level >= 1.0) {
            charging = false;
        }
        return new EvState(EnergyUtils.round(level, 3), current.pluggedIn(), charging, powerW, today, true,
                localDate.toString());
    }

    private double todayCounter(double todayKwh, String countersDate, LocalDate localDate) {
        if (simulationProperties.isDailyResetEnabled() && EnergyUtils.isNewCountingPeriod(countersDate, localDate)) {
            return 0;
        }
        return todayKwh;
    }
}
