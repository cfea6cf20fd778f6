package de.zeus.hems.model.device;

import java.time.Instant;

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
 * Decoded view of a persisted device: its type tag resolved and its JSON config/state
 * turned into the typed records of that type.
 */
public record DeviceSnapshot(String deviceId,
                             String dwellingId,
                             DeviceType deviceType,
                             String name,
                             DeviceConfig config,
                             DeviceState state,
                             Instant createdAt,
                             Instant updatedAt) {

    public <C extends DeviceConfig> C configAs(Class<C> configClass) {
        return configClass.cast(config);
    }

    public <S extends DeviceState> S stateAs(Class<S> stateClass) {
        return stateClass.cast(state);
    }

    public boolean isOnline() {
        return state != null && state.online();
    }
}
