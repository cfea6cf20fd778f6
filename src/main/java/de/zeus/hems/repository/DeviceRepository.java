package de.zeus.hems.repository;

import de.zeus.hems.entity.Device;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

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

@Repository
public interface DeviceRepository extends JpaRepository<Device, String> {

    /**
     * Creation order makes "the first battery/meter of a dwelling" stable across cycles.
     */
    List<Device> findByDwellingIdOrderByCreatedAtAscDeviceIdAsc(String dwellingId);
}
