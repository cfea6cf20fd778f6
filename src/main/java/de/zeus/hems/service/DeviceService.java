package de.zeus.hems.service;

import de.zeus.hems.config.LogFilter;
import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.entity.Device;
import de.zeus.hems.exception.DeviceNotFoundException;
import de.zeus.hems.exception.DeviceStoreException;
import de.zeus.hems.exception.UnknownDeviceTypeException;
import de.zeus.hems.model.DeviceStateUpdate;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.DeviceState;
import de.zeus.hems.repository.DeviceRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

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
 * Device store used by the simulation: typed reads and all-or-nothing state writes.
 * The store is shared with control commands, so a cycle's batch and a concurrent command
 * resolve as last writer wins.
 */
@Service
public class DeviceService {

    private final DeviceRepository deviceRepository;
    private final DeviceCodec deviceCodec;
    private final SimulationProperties simulationProperties;
    private final Clock clock;

    public DeviceService(DeviceRepository deviceRepository, DeviceCodec deviceCodec,
                         SimulationProperties simulationProperties, Clock clock) {
        this.deviceRepository = deviceRepository;
        this.deviceCodec = deviceCodec;
        this.simulationProperties = simulationProperties;
        this.clock = clock;
    }

    /**
     * Loads a single device.
     *
     * @param deviceId The device id.
     * @return The decoded device, or empty if no such device exists.
     */
    @Transactional(readOnly = true)
    public Optional<DeviceSnapshot> getDevice(String deviceId) {
        return deviceRepository.findById(deviceId).map(deviceCodec::toSnapshot);
    }

    /**
     * Loads all devices of a dwelling in creation order.
     * Devices that cannot be decoded (unknown type tag, unreadable JSON) are skipped with a
     * warning, or fail the call when strict device types are enabled.
     *
     * @param dwellingId The dwelling id.
     * @return The decoded devices, possibly empty.
     */
    @Transactional(readOnly = true)
    public List<DeviceSnapshot> getDevicesForDwelling(String dwellingId) {
        List<DeviceSnapshot> snapshots = new ArrayList<>();
        for (Device device : deviceRepository.findByDwellingIdOrderByCreatedAtAscDeviceIdAsc(dwellingId)) {
            try {
                snapshots.add(deviceCodec.toSnapshot(device));
            } catch (UnknownDeviceTypeException | DeviceStoreException e) {
                if (simulationProperties.isStrictDeviceTypes()) {
                    throw e;
                }
                LogFilter.logWarn(DeviceService.class, "Skipping device {} of dwelling {}: {}",
                        device.getDeviceId(), dwellingId, e.getMessage());
            }
        }
        return snapshots;
    }

    /**
     * Replaces the state of several devices in one transaction. Either every update is applied
     * or none is.
     *
     * @param updates New states keyed by device id; a later entry for the same id wins.
     * @throws DeviceStoreException if a device is unknown or the write fails.
     */
    @Transactional
    public void batchUpdateState(List<DeviceStateUpdate> updates) {
        if (updates.isEmpty()) {
            return;
        }

        Map<String, DeviceState> statesById = new LinkedHashMap<>();
        for (DeviceStateUpdate update : updates) {
            statesById.put(update.deviceId(), update.state());
        }

        try {
            List<Device> devices = deviceRepository.findAllById(statesById.keySet());
            if (devices.size() != statesById.size()) {
                Set<String> missing = new LinkedHashSet<>(statesById.keySet());
                devices.forEach(device -> missing.remove(device.getDeviceId()));
                throw new DeviceStoreException("Batch state update rejected, unknown devices: " + missing);
            }

            Instant now = clock.instant();
            for (Device device : devices) {
                device.setStateJson(deviceCodec.writeState(statesById.get(device.getDeviceId())));
                device.setUpdatedAt(now);
            }
            deviceRepository.saveAllAndFlush(devices);
        } catch (DataAccessException e) {
            throw new DeviceStoreException("Batch state update of " + statesById.size() + " devices failed", e);
        }
    }

    /**
     * Replaces the state of one device, used by control commands.
     *
     * @throws DeviceNotFoundException if the device does not exist.
     */
    @Transactional
    public DeviceSnapshot updateState(String deviceId, DeviceState state) {
        Device device = deviceRepository.findById(deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));
        try {
            device.setStateJson(deviceCodec.writeState(state));
            device.setUpdatedAt(clock.instant());
            return deviceCodec.toSnapshot(deviceRepository.save(device));
        } catch (DataAccessException e) {
            throw new DeviceStoreException("State update of device " + deviceId + " failed", e);
        }
    }
}
