package de.zeus.hems.service;

import de.zeus.hems.model.DwellingSummary;
import de.zeus.hems.model.DwellingUpdate;

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
 * Fan-out of simulation results to real-time subscribers. Delivery is best effort;
 * implementations may throw, the caller logs and moves on.
 */
public interface UpdatePublisher {

    /**
     * Full device detail for subscribers of one dwelling.
     */
    void publishDwellingUpdate(String dwellingId, DwellingUpdate update);

    /**
     * Lightweight summary for dashboard-level subscribers.
     */
    void publishSummary(String dwellingId, DwellingSummary summary);
}
