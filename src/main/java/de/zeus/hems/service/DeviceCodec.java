package de.zeus.hems.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeus.hems.entity.Device;
import de.zeus.hems.exception.DeviceStoreException;
import de.zeus.hems.model.device.DeviceConfig;
import de.zeus.hems.model.device.DeviceSnapshot;
import de.zeus.hems.model.device.DeviceState;
import de.zeus.hems.model.device.DeviceType;
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
 * Converts between the JSON config/state columns of {@link Device} and the typed records
 * of its {@link DeviceType}.
 */
@Component
public class DeviceCodec {

    private final ObjectMapper objectMapper;

    public DeviceCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Decodes a persisted device. A device without stored state gets the initial state of
     * its type.
     *
     * @throws de.zeus.hems.exception.UnknownDeviceTypeException if the type tag is unknown.
     * @throws DeviceStoreException if config or state cannot be parsed.
     */
    public DeviceSnapshot toSnapshot(Device device) {
        DeviceType type = DeviceType.fromTag(device.getDeviceType());
        DeviceConfig config = read(device.getDeviceId(), emptyToObject(device.getConfigJson()), type.getConfigClass());
        DeviceState state = device.getStateJson() == null || device.getStateJson().isBlank()
                ? type.initialState()
                : read(device.getDeviceId(), device.getStateJson(), type.getStateClass());
        return new DeviceSnapshot(device.getDeviceId(), device.getDwellingId(), type, device.getName(),
                config, state, device.getCreatedAt(), device.getUpdatedAt());
    }

    public String writeState(DeviceState state) {
        return write(state);
    }

    public String writeConfig(DeviceConfig config) {
        return write(config);
    }

    private <T> T read(String deviceId, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DeviceStoreException("Unreadable " + type.getSimpleName() + " for device " + deviceId, e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DeviceStoreException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String emptyToObject(String json) {
        return json == null || json.isBlank() ? "{}" : json;
    }
}
